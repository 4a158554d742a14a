package works.quill.format;

import works.quill.DocumentTree;
import works.quill.exceptions.DocumentParseException;

/**
 * Turns source text into a {@link DocumentTree}.
 * <p>
 * Implementations must produce nodes whose modified flag is false,
 * record each node's {@link works.quill.TextSpan span} where the format allows,
 * and keep the source text on the tree so the spans can be resolved later.
 * Multi-document input yields a root whose value is a
 * {@link works.quill.DocumentsValue DocumentsValue}.
 */
public interface DocumentParser {
	DocumentTree parse(String text) throws DocumentParseException;
}

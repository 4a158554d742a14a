package works.quill.format;

import works.quill.DocumentTree;

/**
 * Renders a {@link DocumentTree} as text.
 * <p>
 * Serializers only read the tree. An unmodified node with a source span may be
 * passed through verbatim; a modified one must be rendered from its value.
 */
public interface DocumentSerializer {
	String serialize(DocumentTree tree);
}

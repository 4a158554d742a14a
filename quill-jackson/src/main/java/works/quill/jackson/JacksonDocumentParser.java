package works.quill.jackson;

import java.math.BigInteger;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.quill.BooleanValue;
import works.quill.DocumentTree;
import works.quill.DocumentsValue;
import works.quill.MappingValue;
import works.quill.Node;
import works.quill.NullValue;
import works.quill.NumberValue;
import works.quill.SequenceValue;
import works.quill.StringValue;
import works.quill.TextSpan;
import works.quill.Value;
import works.quill.exceptions.DocumentParseException;
import works.quill.format.DocumentParser;

import static java.util.Objects.requireNonNull;
import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;

/**
 * Parses JSON, or JSON Lines, into a {@link DocumentTree} using Jackson's streaming parser.
 * <p>
 * Every node comes out unmodified, with a {@link TextSpan} covering exactly its
 * text in the input, so a {@link JacksonDocumentSerializer} can pass untouched
 * regions through verbatim.
 * <p>
 * Stricter than Jackson's defaults: a repeated key within one object and anything
 * after the top-level value are errors.
 */
public final class JacksonDocumentParser implements DocumentParser {
	private final Format format;
	private final ObjectMapper mapper;

	public enum Format {
		/**
		 * A single JSON value.
		 */
		JSON,

		/**
		 * One JSON value per line, parsed as a {@link DocumentsValue} root.
		 * Blank lines are skipped.
		 */
		JSON_LINES,
	}

	public JacksonDocumentParser(Format format) {
		this(format, JsonMapper.builder().build());
	}

	public JacksonDocumentParser(Format format, ObjectMapper mapper) {
		this.format = requireNonNull(format);
		this.mapper = requireNonNull(mapper);
	}

	public Format format() {
		return format;
	}

	@Override
	public DocumentTree parse(String text) throws DocumentParseException {
		requireNonNull(text);
		Node root = switch (format) {
			case JSON -> parseDocument(text, 0, 0);
			case JSON_LINES -> parseLines(text);
		};
		LOGGER.debug("Parsed {} characters of {} into a {}", text.length(), format, root.value().kind());
		return new DocumentTree(root, text);
	}

	private Node parseLines(String text) throws DocumentParseException {
		DocumentsValue documents = DocumentsValue.empty();
		int lineStart = 0;
		int lineNumber = 0;
		while (lineStart <= text.length()) {
			int newline = text.indexOf('\n', lineStart);
			int lineEnd = (newline < 0) ? text.length() : newline;
			String line = text.substring(lineStart, lineEnd);
			if (!line.isBlank()) {
				documents.insert(documents.size(), parseDocument(line, lineStart, lineNumber));
			}
			if (newline < 0) {
				break;
			}
			lineStart = newline + 1;
			lineNumber++;
		}
		return Node.parsed(documents, new TextSpan(0, text.length()));
	}

	/**
	 * @param offset where {@code text} begins within the whole input, for spans
	 * @param lineOffset how many lines of the whole input precede {@code text}, for error reporting
	 */
	private Node parseDocument(String text, int offset, int lineOffset) throws DocumentParseException {
		try (JsonParser p = mapper.createParser(text)) {
			if (p.nextToken() == null) {
				throw new DocumentParseException("No content", lineOffset + 1, 1);
			}
			Node result = readNode(p, text, offset);
			if (p.nextToken() != null) {
				throw new StreamReadException(p, "Unexpected content after the end of the document: " + p.currentToken());
			}
			return result;
		} catch (JacksonException e) {
			throw parseFailure(e, lineOffset);
		}
	}

	/**
	 * Reads the value whose first token is the current one,
	 * leaving the parser on its last token.
	 */
	private Node readNode(JsonParser p, String text, int offset) {
		int start = (int) p.currentTokenLocation().getCharOffset();
		Value value = switch (p.currentToken()) {
			case START_OBJECT -> readMapping(p, text, offset);
			case START_ARRAY -> readSequence(p, text, offset);
			case VALUE_STRING -> StringValue.plain(p.getString());
			case VALUE_NUMBER_INT -> readInteger(p);
			case VALUE_NUMBER_FLOAT -> readFloat(p);
			case VALUE_TRUE -> BooleanValue.TRUE;
			case VALUE_FALSE -> BooleanValue.FALSE;
			case VALUE_NULL -> NullValue.NULL;
			default -> throw new StreamReadException(p, "Unexpected token: " + p.currentToken());
		};
		return Node.parsed(value, spanOf(p, text, start, offset));
	}

	private MappingValue readMapping(JsonParser p, String text, int offset) {
		MappingValue result = MappingValue.empty();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String key = p.currentName();
			if (result.containsKey(key)) {
				throw new StreamReadException(p, "Key appears twice: \"" + key + "\"");
			}
			result.insert(result.size(), key, readNode(p, text, offset));
		}
		return result;
	}

	private SequenceValue readSequence(JsonParser p, String text, int offset) {
		SequenceValue result = SequenceValue.empty();
		while (p.nextToken() != END_ARRAY) {
			result.insert(result.size(), readNode(p, text, offset));
		}
		return result;
	}

	private static NumberValue readInteger(JsonParser p) {
		BigInteger value = p.getBigIntegerValue();
		if (value.bitLength() < Long.SIZE) {
			return NumberValue.of(value.longValue());
		} else {
			LOGGER.warn("Integer {} is too large for a long; storing it as floating-point", value);
			return finite(p, value.doubleValue());
		}
	}

	private static NumberValue readFloat(JsonParser p) {
		return finite(p, p.getDoubleValue());
	}

	private static NumberValue finite(JsonParser p, double value) {
		if (!Double.isFinite(value)) {
			throw new StreamReadException(p, "Number out of range: " + p.getString());
		}
		return NumberValue.of(value);
	}

	/**
	 * The parser reports where each token starts; the end is wherever it has
	 * read up to once the token is finished, which can include one trailing
	 * whitespace character at the top level.
	 */
	@Nullable
	private static TextSpan spanOf(JsonParser p, String text, int start, int offset) {
		int end = (int) p.currentLocation().getCharOffset();
		if (start < 0 || end < start || end > text.length()) {
			return null;
		}
		while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
			end--;
		}
		return new TextSpan(start, end).shiftedBy(offset);
	}

	private static DocumentParseException parseFailure(JacksonException e, int lineOffset) {
		var location = e.getLocation();
		int line = -1;
		int column = -1;
		if (location != null) {
			line = location.getLineNr() + lineOffset;
			column = location.getColumnNr();
		}
		return new DocumentParseException(e.getOriginalMessage(), line, column, e);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonDocumentParser.class);
}

package works.quill.jackson;

import java.io.StringWriter;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.util.DefaultIndenter;
import tools.jackson.core.util.DefaultPrettyPrinter;
import tools.jackson.core.util.Separators;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.databind.json.JsonMapper;
import works.quill.AliasValue;
import works.quill.BooleanValue;
import works.quill.DocumentTree;
import works.quill.DocumentsValue;
import works.quill.MappingValue;
import works.quill.Node;
import works.quill.NullValue;
import works.quill.NumberValue.FloatNumber;
import works.quill.NumberValue.IntegerNumber;
import works.quill.QuillSettings;
import works.quill.SequenceValue;
import works.quill.StringValue;
import works.quill.TextSpan;
import works.quill.Value;
import works.quill.format.DocumentSerializer;

import static java.util.Objects.requireNonNull;

/**
 * Writes a {@link DocumentTree} as JSON, or as JSON Lines if its root is a
 * {@link DocumentsValue}, disturbing the original text as little as possible.
 * <p>
 * With {@link QuillSettings#isPreserveFormatting() preserveFormatting} on:
 * <ul>
 *     <li>a tree with nothing modified comes back exactly as it was parsed, and</li>
 *     <li>otherwise, every unmodified node that has a source span is copied
 *         from the source verbatim, and only modified nodes are rendered anew.</li>
 * </ul>
 * With it off, everything is rendered anew.
 * <p>
 * Fresh JSON output is indented by {@link QuillSettings#getIndentSize() indentSize}
 * spaces per level. JSON Lines output puts each document on its own compact line.
 * <p>
 * JSON has no aliases, so {@link AliasValue aliases} are written as strings
 * of the form {@code "*anchor"}. {@link works.quill.StringStyle String styles}
 * have no JSON counterpart and are ignored.
 */
public final class JacksonDocumentSerializer implements DocumentSerializer {
	private final QuillSettings settings;
	private final ObjectMapper mapper;
	private final ObjectWriter prettyWriter;

	public JacksonDocumentSerializer(QuillSettings settings) {
		this(settings, JsonMapper.builder().build());
	}

	public JacksonDocumentSerializer(QuillSettings settings, ObjectMapper mapper) {
		this.settings = requireNonNull(settings);
		this.mapper = requireNonNull(mapper);
		this.prettyWriter = mapper.writer().with(prettyPrinter(settings.getIndentSize()));
	}

	private static DefaultPrettyPrinter prettyPrinter(int indentSize) {
		DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indentSize), "\n");
		Separators separators = Separators.createDefaultInstance()
			.withObjectNameValueSpacing(Separators.Spacing.AFTER);
		return new DefaultPrettyPrinter(separators)
			.withObjectIndenter(indenter)
			.withArrayIndenter(indenter);
	}

	@Override
	public String serialize(DocumentTree tree) {
		@Nullable String source = settings.isPreserveFormatting()
			? tree.originalSource().orElse(null)
			: null;
		if (source != null && !tree.isModified()) {
			LOGGER.debug("Document unmodified; writing {} characters of source verbatim", source.length());
			return source;
		}
		Node root = tree.root();
		if (root.value() instanceof DocumentsValue documents) {
			return serializeLines(documents, source);
		}
		StringWriter out = new StringWriter();
		try (JsonGenerator gen = prettyWriter.createGenerator(out)) {
			writeNode(gen, root, source);
		}
		return out.append('\n').toString();
	}

	private String serializeLines(DocumentsValue documents, @Nullable String source) {
		StringWriter out = new StringWriter();
		for (Node document : documents.elements()) {
			StringWriter line = new StringWriter();
			try (JsonGenerator gen = mapper.createGenerator(line)) {
				writeNode(gen, document, source);
			}
			out.append(line.toString()).append('\n');
		}
		return out.toString();
	}

	private void writeNode(JsonGenerator gen, Node node, @Nullable String source) {
		String verbatim = verbatimText(node, source);
		if (verbatim != null) {
			gen.writeRawValue(verbatim);
			return;
		}
		Value value = node.value();
		if (value instanceof MappingValue mapping) {
			gen.writeStartObject();
			for (MappingValue.Entry entry : mapping.entries()) {
				gen.writeName(entry.key());
				writeNode(gen, entry.node(), source);
			}
			gen.writeEndObject();
		} else if (value instanceof SequenceValue sequence) {
			gen.writeStartArray();
			for (Node element : sequence.elements()) {
				writeNode(gen, element, source);
			}
			gen.writeEndArray();
		} else if (value instanceof StringValue string) {
			gen.writeString(string.text());
		} else if (value instanceof IntegerNumber number) {
			gen.writeNumber(number.value());
		} else if (value instanceof FloatNumber number) {
			gen.writeNumber(number.value());
		} else if (value instanceof BooleanValue bool) {
			gen.writeBoolean(bool.value());
		} else if (value instanceof NullValue) {
			gen.writeNull();
		} else if (value instanceof AliasValue alias) {
			gen.writeString("*" + alias.anchor());
		} else if (value instanceof DocumentsValue) {
			throw new IllegalStateException("Document stream can only appear at the root");
		} else {
			throw new AssertionError("Unexpected value type: " + value.getClass());
		}
	}

	/**
	 * @return the node's original text if it can stand in for the node, or null
	 */
	@Nullable
	private static String verbatimText(Node node, @Nullable String source) {
		if (source == null || node.isModified()) {
			return null;
		}
		Optional<TextSpan> span = node.span();
		return span.map(s -> s.in(source)).orElse(null);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonDocumentSerializer.class);
}

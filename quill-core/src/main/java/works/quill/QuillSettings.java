package works.quill;

import lombok.Builder;
import lombok.Builder.Default;

/**
 * Tunables for an {@link EditSession} and the serializers that write its documents.
 * <p>
 * Immutable; use {@link #toBuilder()} to derive a variant.
 */
@lombok.Value
@Builder(toBuilder = true)
public class QuillSettings {
	/**
	 * Maximum number of states retained by the undo history,
	 * including the state the document was opened in.
	 * Each one is a full copy of the document, so this bounds memory use
	 * at roughly this many times the document size.
	 */
	@Default int undoLimit = 50;

	/**
	 * When true, serializers copy the original source text of unmodified nodes
	 * instead of re-rendering them, so untouched parts of a file keep their
	 * formatting byte for byte.
	 */
	@Default boolean preserveFormatting = true;

	/**
	 * Spaces per nesting level when a serializer renders nodes canonically.
	 */
	@Default int indentSize = 2;

	/**
	 * Identifies the session in logs. See {@link works.quill.logging.MdcKeys#SESSION_NAME}.
	 */
	@Default String sessionName = "quill";

	public static QuillSettings defaults() {
		return builder().build();
	}
}

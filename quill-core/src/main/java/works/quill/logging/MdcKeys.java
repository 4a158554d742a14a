package works.quill.logging;

/**
 * Keys this library sets in the SLF4J {@link org.slf4j.MDC MDC},
 * so log configurations can include them in their patterns or filter on them.
 */
public final class MdcKeys {
	/**
	 * The {@link works.quill.QuillSettings#getSessionName() name} of the
	 * {@link works.quill.EditSession} performing the logged operation.
	 */
	public static final String SESSION_NAME = "quill.session";

	private MdcKeys() {}
}

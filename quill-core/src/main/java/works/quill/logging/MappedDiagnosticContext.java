package works.quill.logging;

import org.slf4j.MDC;

import static works.quill.logging.MdcKeys.SESSION_NAME;

public final class MappedDiagnosticContext {

	/**
	 * Sets {@link MdcKeys#SESSION_NAME} until the returned scope is closed,
	 * then puts back whatever was there before, so scopes nest.
	 */
	public static MDCScope setupMDC(String sessionName) {
		MDCScope result = new MDCScope(MDC.get(SESSION_NAME));
		MDC.put(SESSION_NAME, sessionName);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String oldValue;

		MDCScope(String oldValue) {
			this.oldValue = oldValue;
		}

		@Override
		public void close() {
			if (oldValue == null) {
				MDC.remove(SESSION_NAME);
			} else {
				MDC.put(SESSION_NAME, oldValue);
			}
		}
	}

	private MappedDiagnosticContext() {}
}

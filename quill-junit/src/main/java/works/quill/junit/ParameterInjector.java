package works.quill.junit;

import java.lang.reflect.Parameter;
import java.util.List;

/**
 * Provides a series of possible values for a given parameter.
 */
public interface ParameterInjector {
	/**
	 * Note: if this method returns different results for the same parameter
	 * at different times, strange behaviour may result.
	 * @return true if this injector provides values for the given parameter.
	 */
	boolean supportsParameter(Parameter parameter);

	/**
	 * Called once per test method. The same value objects are handed to every
	 * invocation that uses them, so mutable values should be factories
	 * rather than the things the test will modify.
	 *
	 * @return non-null {@link List} of values for the parameter.
	 */
	List<?> values();
}

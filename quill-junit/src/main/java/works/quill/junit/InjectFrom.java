package works.quill.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Configures parameter injection for a test class by
 * specifying one or more {@link ParameterInjector}s
 * to be made available for injecting parameters into test methods.
 * <p>
 * When multiple injectors provide values for the same parameter,
 * the later one wins. Annotations on superclasses count as "earlier".
 * <p>
 * Each injector class must have a no-argument constructor
 * (a record with no components is the usual choice).
 *
 * @see InjectedTest
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface InjectFrom {
	Class<? extends ParameterInjector>[] value();
}

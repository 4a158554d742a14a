package works.quill.junit;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;

import static java.util.Arrays.asList;

/**
 * Implements the {@link InjectFrom} annotation.
 */
public class ParameterInjectionContextProvider implements TestTemplateInvocationContextProvider {

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		List<Parameter> requiredParameters = asList(context.getRequiredTestMethod().getParameters());
		List<ParameterInjector> injectors = instantiateAll(getAllInjectorClasses(context));

		// Only injectors that serve some parameter participate in the product;
		// otherwise unused injectors would multiply the invocations for nothing.
		var injectorsByParameter = new LinkedHashMap<Parameter, ParameterInjector>();
		var valuesByInjector = new LinkedHashMap<ParameterInjector, List<?>>();
		requiredParameters.forEach(p -> {
			ParameterInjector injector = injectorFor(p, injectors);
			if (injector != null) {
				injectorsByParameter.put(p, injector);
				valuesByInjector.computeIfAbsent(injector, ParameterInjector::values);
			}
		});

		List<ParameterInjector> used = List.copyOf(valuesByInjector.keySet());
		List<List<Object>> combinations = cartesianProduct(valuesByInjector.values());

		return combinations.stream().map(combo -> {
			var paramValueMap = new LinkedHashMap<Parameter, Object>();
			injectorsByParameter.forEach((parameter, injector) ->
				paramValueMap.put(parameter, combo.get(used.indexOf(injector))));
			return invocationContext(context, combo, paramValueMap);
		});
	}

	private static TestTemplateInvocationContext invocationContext(ExtensionContext context, List<Object> combo, Map<Parameter, Object> paramValueMap) {
		return new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				return context.getRequiredTestMethod().getName() + "[" + invocationIndex + "] " + combo;
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return List.of(new ParameterResolver() {
					@Override
					public boolean supportsParameter(ParameterContext pc, ExtensionContext ec) {
						return paramValueMap.containsKey(pc.getParameter());
					}

					@Override
					public Object resolveParameter(ParameterContext pc, ExtensionContext ec) throws ParameterResolutionException {
						Parameter param = pc.getParameter();
						if (paramValueMap.containsKey(param)) {
							return paramValueMap.get(param);
						}
						throw new ParameterResolutionException("Parameter not bound: " + param);
					}
				});
			}
		};
	}

	/**
	 * @return the injector classes in the order they should be consulted, earliest first
	 */
	private static List<Class<? extends ParameterInjector>> getAllInjectorClasses(ExtensionContext context) {
		List<Class<?>> bottomUp = new ArrayList<>();
		for (var c = context.getRequiredTestClass(); c != Object.class; c = c.getSuperclass()) {
			bottomUp.add(c);
		}
		Collections.reverse(bottomUp);
		List<Class<? extends ParameterInjector>> allInjectors = new ArrayList<>();
		for (var c : bottomUp) {
			for (var a : c.getAnnotationsByType(InjectFrom.class)) {
				allInjectors.addAll(asList(a.value()));
			}
		}
		return allInjectors;
	}

	private static List<ParameterInjector> instantiateAll(List<Class<? extends ParameterInjector>> injectorClasses) {
		List<ParameterInjector> result = new ArrayList<>();
		for (var injectorType : injectorClasses) {
			try {
				Constructor<? extends ParameterInjector> ctor = injectorType.getDeclaredConstructor();
				ctor.setAccessible(true);
				result.add(ctor.newInstance());
			} catch (NoSuchMethodException e) {
				throw new ParameterResolutionException("Injector class must have a no-argument constructor: " + injectorType, e);
			} catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
				throw new ParameterResolutionException("Error calling constructor on injector class " + injectorType, e);
			}
		}
		return result;
	}

	/**
	 * @return null if there's no injector, indicating that the parameter must be resolved some other way
	 */
	private static ParameterInjector injectorFor(Parameter p, List<ParameterInjector> injectors) {
		for (int i = injectors.size() - 1; i >= 0; i--) {
			if (injectors.get(i).supportsParameter(p)) {
				return injectors.get(i);
			}
		}
		return null;
	}

	/**
	 * Compute the cartesian product of a list of lists.
	 */
	static List<List<Object>> cartesianProduct(Collection<? extends List<?>> input) {
		List<List<Object>> result = List.of(List.of());
		for (List<?> list : input) {
			result = result.stream()
				.flatMap(prev -> list.stream().map(v -> {
					List<Object> next = new ArrayList<>(prev);
					next.add(v);
					return next;
				}))
				.toList();
		}
		return result;
	}
}

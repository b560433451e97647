package works.tessera.junit;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.extension.ExtensionConfigurationException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.CaseExpander;
import works.tessera.Declarations;
import works.tessera.DependencyGraph;
import works.tessera.DependencyGraphBuilder;
import works.tessera.FailureCapture;
import works.tessera.FixtureKey;
import works.tessera.FixtureRegistry;
import works.tessera.FixtureScanner;
import works.tessera.ScopeStore;
import works.tessera.TeardownFailure;
import works.tessera.TestCase;
import works.tessera.TestDefinition;
import works.tessera.annotations.Use;
import works.tessera.exceptions.InvalidDeclarationException;
import works.tessera.exceptions.InvalidRegistryException;

/**
 * The fixtures available to one test class, and the scope store holding their global values.
 * Closed by JUnit when the test class completes, which tears down the global values.
 */
final class FixtureSession implements ExtensionContext.Store.CloseableResource {
	private final Class<?> testClass;
	private final FixtureRegistry registry;
	private final ScopeStore store;
	private final Map<String, List<TestCase>> casesByMethod;

	private FixtureSession(Class<?> testClass, FixtureRegistry registry, ScopeStore store, Map<String, List<TestCase>> casesByMethod) {
		this.testClass = testClass;
		this.registry = registry;
		this.store = store;
		this.casesByMethod = casesByMethod;
	}

	/**
	 * Collects every {@link FixtureTest} method of {@code testClass} at once,
	 * so that they share one dependency graph and one scope store.
	 *
	 * @throws InvalidRegistryException if the fixtures are invalid, or some method's parameters can't be satisfied
	 */
	static FixtureSession forClass(Class<?> testClass) throws InvalidRegistryException {
		Declarations declarations = Declarations.empty();
		for (Class<?> c: fixtureClasses(testClass)) {
			declarations = declarations.plus(FixtureScanner.scan(c));
		}
		FixtureRegistry registry = declarations.registry();

		List<TestDefinition> definitions = new ArrayList<>();
		for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method method: c.getDeclaredMethods()) {
				if (method.isAnnotationPresent(FixtureTest.class)) {
					TestDefinition.Builder builder = TestDefinition.builder(method.getName())
						// JUnit invokes the method itself
						.body(args -> { });
					fixtureParameters(registry, method).values().forEach(builder::uses);
					definitions.add(builder.build());
				}
			}
		}
		DependencyGraph graph = DependencyGraphBuilder.build(registry, definitions);

		Map<String, List<TestCase>> casesByMethod = new LinkedHashMap<>();
		for (TestCase testCase: CaseExpander.expand(graph)) {
			casesByMethod.computeIfAbsent(testCase.definition().name(), k -> new ArrayList<>()).add(testCase);
		}
		LOGGER.debug("Opened fixture session for {} with {} fixture(s) and {} test method(s)",
			testClass.getSimpleName(), registry.keys().size(), definitions.size());
		return new FixtureSession(testClass, registry, new ScopeStore(graph, FailureCapture.catching()), casesByMethod);
	}

	ScopeStore store() {
		return store;
	}

	Map<Integer, FixtureKey> fixtureParameters(Method method) throws InvalidDeclarationException {
		return fixtureParameters(registry, method);
	}

	List<TestCase> casesFor(Method method) {
		List<TestCase> result = casesByMethod.get(method.getName());
		if (result == null) {
			throw new ExtensionConfigurationException("No cases collected for " + method);
		}
		return result;
	}

	/**
	 * @return the fixture providing each parameter of {@code method}, by parameter index
	 */
	private static Map<Integer, FixtureKey> fixtureParameters(FixtureRegistry registry, Method method) throws InvalidDeclarationException {
		Map<Integer, FixtureKey> result = new LinkedHashMap<>();
		Parameter[] parameters = method.getParameters();
		for (int i = 0; i < parameters.length; i++) {
			Parameter p = parameters[i];
			if (!p.isAnnotationPresent(Use.class) && !p.isNamePresent()) {
				continue;
			}
			FixtureKey key = FixtureScanner.keyFor(p);
			if (p.isAnnotationPresent(Use.class) || registry.lookup(key).isPresent()) {
				result.put(i, key);
			}
		}
		return result;
	}

	@Override
	public void close() {
		List<TeardownFailure> failures = store.close();
		for (TeardownFailure f: failures) {
			LOGGER.warn("Teardown of global fixture {} for {} failed", f.key(), testClass.getSimpleName(), f.cause());
		}
		LOGGER.debug("Closed fixture session for {}", testClass.getSimpleName());
	}

	/**
	 * Superclasses first, without duplicates.
	 */
	private static Set<Class<?>> fixtureClasses(Class<?> testClass) {
		List<Class<?>> bottomUp = new ArrayList<>();
		for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
			bottomUp.add(c);
		}
		Set<Class<?>> result = new LinkedHashSet<>();
		for (int i = bottomUp.size() - 1; i >= 0; i--) {
			FixturesFrom annotation = bottomUp.get(i).getAnnotation(FixturesFrom.class);
			if (annotation != null) {
				result.addAll(List.of(annotation.value()));
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FixtureSession.class);
}

package works.tessera;

import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.exceptions.CyclicDependencyException;
import works.tessera.exceptions.DuplicateFixtureException;
import works.tessera.exceptions.InvalidRegistryException;
import works.tessera.exceptions.ScopeMismatchException;
import works.tessera.exceptions.TypeMismatchException;
import works.tessera.exceptions.UnknownFixtureException;

/**
 * Validates the registry and the test definitions, and computes the transitive
 * closure of every fixture and every definition.
 * <p>
 * Purely structural: no constructor is ever invoked.
 * Templates are instantiated as needed, but that has no observable side effects.
 */
public final class DependencyGraphBuilder {
	private final FixtureRegistry registry;
	private final Map<FixtureKey, List<FixtureKey>> closures = new LinkedHashMap<>();
	private final List<FixtureKey> path = new ArrayList<>();

	private DependencyGraphBuilder(FixtureRegistry registry) {
		this.registry = registry;
	}

	public static DependencyGraph build(FixtureRegistry registry, List<TestDefinition> definitions) throws InvalidRegistryException {
		if (!registry.duplicates().isEmpty()) {
			throw new DuplicateFixtureException(String.join("; ", registry.duplicates()));
		}
		Set<String> names = new HashSet<>();
		for (TestDefinition d: definitions) {
			if (!names.add(d.name())) {
				throw new DuplicateFixtureException("Test " + d.name() + " is defined more than once");
			}
		}

		DependencyGraphBuilder builder = new DependencyGraphBuilder(registry);

		// Every registered fixture is validated, even those no test uses
		for (FixtureKey key: registry.keys()) {
			builder.visit(key, "the registry");
		}

		Map<String, List<FixtureKey>> definitionClosures = new HashMap<>();
		for (TestDefinition definition: definitions) {
			LinkedHashSet<FixtureKey> closure = new LinkedHashSet<>();
			for (FixtureKey parameter: definition.parameters()) {
				closure.addAll(builder.visit(parameter, "test " + definition.name()));
				closure.add(parameter);
			}
			definitionClosures.put(definition.name(), List.copyOf(closure));
		}

		LOGGER.debug("Validated {} fixtures and {} tests", builder.closures.size(), definitions.size());
		return new DependencyGraph(registry, definitions, builder.closures, definitionClosures);
	}

	/**
	 * Depth-first, in declared dependency order.
	 *
	 * @return the closure of {@code key}, not including {@code key} itself
	 */
	private List<FixtureKey> visit(FixtureKey key, String requiredBy) throws InvalidRegistryException {
		List<FixtureKey> done = closures.get(key);
		if (done != null) {
			return done;
		}
		int cycleStart = path.indexOf(key);
		if (cycleStart >= 0) {
			List<FixtureKey> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
			cycle.add(key);
			throw new CyclicDependencyException(cycle);
		}

		FixtureSpec spec = lookup(key, requiredBy);
		path.add(key);
		LinkedHashSet<FixtureKey> closure = new LinkedHashSet<>();
		for (int i = 0; i < spec.dependencies().size(); i++) {
			FixtureKey dependency = spec.dependencies().get(i);
			List<FixtureKey> dependencyClosure = visit(dependency, "fixture " + key);
			checkBound(spec, spec.boundAt(i), registry.require(dependency));
			closure.addAll(dependencyClosure);
			closure.add(dependency);
		}
		path.remove(path.size() - 1);
		checkScope(spec, closure);

		List<FixtureKey> result = List.copyOf(closure);
		closures.put(key, result);
		return result;
	}

	private FixtureSpec lookup(FixtureKey key, String requiredBy) throws InvalidRegistryException {
		Optional<FixtureSpec> spec = registry.lookup(key);
		if (spec.isPresent()) {
			return spec.get();
		}
		if (key.isInstantiation()) {
			Optional<FixtureTemplate> template = registry.templateNamed(key.baseKey());
			if (template.isPresent()) {
				throw new TypeMismatchException(key,
					template.get().arity() + " type argument(s)",
					key.typeArguments().size() + " type argument(s)");
			}
		}
		throw new UnknownFixtureException(key, requiredBy);
	}

	private static void checkBound(FixtureSpec spec, Optional<Class<?>> bound, FixtureSpec dependency) throws TypeMismatchException {
		if (bound.isPresent()) {
			Class<?> expected = wrap(bound.get());
			Class<?> found = wrap(dependency.valueType());
			if (!expected.isAssignableFrom(found)) {
				throw new TypeMismatchException(spec.key(),
					"a fixture providing " + expected.getName(),
					dependency.key() + " providing " + found.getName());
			}
		}
	}

	/**
	 * A global value outlives every case, so nothing in its closure may be bound to one,
	 * not even through an unshared fixture in between.
	 */
	private void checkScope(FixtureSpec spec, Set<FixtureKey> closure) throws ScopeMismatchException {
		if (spec.scope() != Scope.GLOBAL) {
			return;
		}
		for (FixtureKey k: closure) {
			FixtureSpec dependency = registry.require(k);
			if (dependency.scope().isCaseBound()) {
				throw new ScopeMismatchException(spec.key(), spec.scope(), dependency.key(), dependency.scope());
			}
		}
	}

	private static Class<?> wrap(Class<?> type) {
		return MethodType.methodType(type).wrap().returnType();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraphBuilder.class);
}

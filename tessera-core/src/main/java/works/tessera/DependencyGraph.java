package works.tessera;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The validated, fully expanded dependency structure of a run.
 * <p>
 * Closures are listed in dependency order: every key appears after all of its own dependencies,
 * and dependencies appear in the order they were declared.
 * Built by {@link DependencyGraphBuilder}; never changes afterward.
 */
public final class DependencyGraph {
	private final FixtureRegistry registry;
	private final List<TestDefinition> definitions;
	private final Map<FixtureKey, List<FixtureKey>> fixtureClosures;
	private final Map<String, List<FixtureKey>> definitionClosures;

	DependencyGraph(
		FixtureRegistry registry,
		List<TestDefinition> definitions,
		Map<FixtureKey, List<FixtureKey>> fixtureClosures,
		Map<String, List<FixtureKey>> definitionClosures
	) {
		this.registry = registry;
		this.definitions = List.copyOf(definitions);
		this.fixtureClosures = Map.copyOf(fixtureClosures);
		this.definitionClosures = Map.copyOf(definitionClosures);
	}

	public FixtureRegistry registry() {
		return registry;
	}

	public List<TestDefinition> definitions() {
		return definitions;
	}

	public FixtureSpec spec(FixtureKey key) {
		return registry.require(key);
	}

	/**
	 * @return every fixture {@code key} requires, directly or indirectly, not including {@code key} itself
	 */
	public List<FixtureKey> closureOf(FixtureKey key) {
		List<FixtureKey> result = fixtureClosures.get(key);
		if (result == null) {
			throw new IllegalArgumentException("Fixture is not part of this graph: " + key);
		}
		return result;
	}

	/**
	 * @return every fixture the definition requires, directly or indirectly
	 */
	public List<FixtureKey> closureOf(TestDefinition definition) {
		List<FixtureKey> result = definitionClosures.get(definition.name());
		if (result == null) {
			throw new IllegalArgumentException("Test is not part of this graph: " + definition.name());
		}
		return result;
	}

	/**
	 * @return the parametrized fixtures among {@code key} and its closure, in dependency order
	 */
	public List<FixtureKey> parametrizedIn(FixtureKey key) {
		List<FixtureKey> result = new ArrayList<>();
		for (FixtureKey k: closureOf(key)) {
			if (spec(k).isParametrized()) {
				result.add(k);
			}
		}
		if (spec(key).isParametrized()) {
			result.add(key);
		}
		return List.copyOf(result);
	}

	public List<FixtureKey> parametrizedIn(TestDefinition definition) {
		return closureOf(definition).stream()
			.filter(k -> spec(k).isParametrized())
			.toList();
	}

	@Override
	public String toString() {
		return "DependencyGraph(" + fixtureClosures.size() + " fixtures, " + definitionClosures.size() + " tests)";
	}
}

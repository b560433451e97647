package works.tessera;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One concrete, runnable case: a {@link TestDefinition} together with one value
 * from the domain of every parametrized fixture it depends on.
 * <p>
 * The {@link #caseId() case ID} is the case's name, which is a deterministic function
 * of the definition name and the bindings, so it is stable across collections.
 */
public final class TestCase {
	private final String name;
	private final int index;
	private final TestDefinition definition;
	private final Map<FixtureKey, Object> bindings;
	private final boolean ignored;

	TestCase(String name, int index, TestDefinition definition, Map<FixtureKey, Object> bindings, boolean ignored) {
		this.name = name;
		this.index = index;
		this.definition = definition;
		this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
		this.ignored = ignored;
	}

	public String caseId() {
		return name;
	}

	public String name() {
		return name;
	}

	/**
	 * @return the position of this case in the collected case list
	 */
	public int index() {
		return index;
	}

	public TestDefinition definition() {
		return definition;
	}

	/**
	 * @return the chosen parameter value for each parametrized fixture, in dependency order
	 */
	public Map<FixtureKey, Object> bindings() {
		return bindings;
	}

	public Optional<Object> binding(FixtureKey key) {
		return Optional.ofNullable(bindings.get(key));
	}

	/**
	 * @return the subset of {@link #bindings()} for the given keys, in binding order
	 */
	public Map<FixtureKey, Object> bindingsFor(Collection<FixtureKey> keys) {
		Map<FixtureKey, Object> result = new LinkedHashMap<>();
		bindings.forEach((k, v) -> {
			if (keys.contains(k)) {
				result.put(k, v);
			}
		});
		return result;
	}

	public boolean isIgnored() {
		return ignored;
	}

	public boolean expectFailure() {
		return definition.expectFailure();
	}

	@Override
	public String toString() {
		return name;
	}
}

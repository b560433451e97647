package works.tessera;

import java.util.List;
import java.util.Optional;

/**
 * @param parameter empty if the fixture being constructed is not parametrized
 */
record ResolvedArguments(
	List<FixtureKey> keys,
	List<Object> values,
	Optional<Object> parameter
) implements FixtureArguments {
	ResolvedArguments {
		if (keys.size() != values.size()) {
			throw new IllegalArgumentException("Expected " + keys.size() + " values; got " + values.size());
		}
	}

	@Override
	public Object get(FixtureKey key) {
		int index = keys.indexOf(key);
		if (index < 0) {
			throw new IllegalArgumentException("Not a declared dependency: " + key + "; expected one of " + keys);
		}
		return values.get(index);
	}

	@Override
	public Object get(int index) {
		return values.get(index);
	}

	@Override
	public int size() {
		return values.size();
	}

	@Override
	public Object param() {
		return parameter.orElseThrow(() -> new IllegalStateException("Fixture is not parametrized"));
	}

	@Override
	public String toString() {
		return "ResolvedArguments" + keys;
	}
}

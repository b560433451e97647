package works.tessera;

/**
 * The resolved values handed to a {@link FixtureConstructor} or a {@link TestBody},
 * in the order the dependencies were declared, and also addressable by key.
 */
public interface FixtureArguments {
	/**
	 * @throws IllegalArgumentException if {@code key} is not one of the declared dependencies
	 */
	Object get(FixtureKey key);

	/**
	 * @throws IndexOutOfBoundsException if there is no such dependency
	 */
	Object get(int index);

	int size();

	/**
	 * @return the value bound to this fixture from its parameter domain
	 * @throws IllegalStateException if the fixture being constructed is not parametrized
	 */
	Object param();

	default Object get(String name) {
		return get(FixtureKey.of(name));
	}

	default <T> T get(String name, Class<T> type) {
		return type.cast(get(name));
	}

	default <T> T get(FixtureKey key, Class<T> type) {
		return type.cast(get(key));
	}

	default <T> T get(int index, Class<T> type) {
		return type.cast(get(index));
	}

	default <T> T param(Class<T> type) {
		return type.cast(param());
	}
}

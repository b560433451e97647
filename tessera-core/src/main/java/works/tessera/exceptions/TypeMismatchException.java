package works.tessera.exceptions;

import works.tessera.FixtureKey;

/**
 * A generic fixture was instantiated over a fixture that doesn't provide the required capability,
 * or with the wrong number of type arguments.
 */
public class TypeMismatchException extends InvalidRegistryException {
	private final FixtureKey key;
	private final String expected;
	private final String found;

	public TypeMismatchException(FixtureKey key, String expected, String found) {
		super("Type mismatch in " + key + ": expected " + expected + ", found " + found);
		this.key = key;
		this.expected = expected;
		this.found = found;
	}

	public FixtureKey key() {
		return key;
	}

	public String expected() {
		return expected;
	}

	public String found() {
		return found;
	}
}

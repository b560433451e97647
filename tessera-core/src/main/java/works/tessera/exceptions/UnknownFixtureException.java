package works.tessera.exceptions;

import works.tessera.FixtureKey;

public class UnknownFixtureException extends InvalidRegistryException {
	private final FixtureKey key;
	private final String requiredBy;

	public UnknownFixtureException(FixtureKey key, String requiredBy) {
		super("Unknown fixture " + key + " required by " + requiredBy);
		this.key = key;
		this.requiredBy = requiredBy;
	}

	public FixtureKey key() {
		return key;
	}

	public String requiredBy() {
		return requiredBy;
	}
}

package works.tessera.exceptions;

import works.tessera.FixtureKey;

/**
 * A fixture value could not be produced, either because its own constructor failed,
 * or because one of its dependencies could not be produced.
 * <p>
 * The {@link #rootKey() root key} always names the fixture whose constructor
 * actually failed, however far the failure has propagated.
 */
public class FixtureConstructionException extends RuntimeException {
	private final FixtureKey key;
	private final FixtureKey rootKey;

	public FixtureConstructionException(FixtureKey key, Throwable cause) {
		super("Unable to construct fixture " + key + ": " + describe(cause), cause);
		this.key = key;
		this.rootKey = key;
	}

	private FixtureConstructionException(FixtureKey key, String message, FixtureConstructionException upstream) {
		super(message, upstream);
		this.key = key;
		this.rootKey = upstream.rootKey;
	}

	/**
	 * @return an exception reporting that {@code dependent} can't be constructed because of this failure
	 */
	public FixtureConstructionException propagatedTo(FixtureKey dependent) {
		return new FixtureConstructionException(dependent,
			"Unable to construct fixture " + dependent + ": upstream fixture " + rootKey + " failed", this);
	}

	/**
	 * @return an exception reporting, to a later requester, a failure that has already been recorded
	 */
	public FixtureConstructionException replayed() {
		return new FixtureConstructionException(key,
			"Unable to construct fixture " + key + ": upstream fixture " + rootKey + " failed earlier in the run", this);
	}

	public FixtureKey key() {
		return key;
	}

	public FixtureKey rootKey() {
		return rootKey;
	}

	private static String describe(Throwable cause) {
		String message = cause.getMessage();
		return message == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + message;
	}
}

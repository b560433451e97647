package works.tessera;

/**
 * A teardown callback that failed. Reported, but never stops other teardowns.
 */
public record TeardownFailure(
	FixtureKey key,
	Throwable cause
) {
	@Override
	public String toString() {
		return "TeardownFailure(" + key + ": " + cause + ")";
	}
}

package works.tessera;

/**
 * Which phase of a case failed.
 * Only {@link #BODY} failures are reinterpreted for cases marked expect-failure.
 */
public enum FailureReason {
	/**
	 * A fixture the case needs could not be constructed.
	 */
	SETUP,

	/**
	 * The case body terminated abnormally.
	 */
	BODY,
}

package works.tessera;

/**
 * The definitive result of one {@link TestCase}.
 */
public enum Outcome {
	PASSED,
	FAILED,

	/**
	 * The body of a case marked expect-failure failed, as expected.
	 */
	EXPECTED_FAILURE,

	/**
	 * The body of a case marked expect-failure completed normally.
	 */
	UNEXPECTED_SUCCESS,

	SKIPPED,
	;

	/**
	 * @return true if this outcome is compatible with a successful run
	 */
	public boolean isSuccess() {
		return this != FAILED && this != UNEXPECTED_SUCCESS;
	}
}

package works.tessera;

/**
 * One entry of the case list reported before execution.
 */
public record CaseListing(
	String name,
	boolean isIgnored,
	boolean expectFailure
) {
	static CaseListing of(TestCase testCase) {
		return new CaseListing(testCase.name(), testCase.isIgnored(), testCase.expectFailure());
	}
}

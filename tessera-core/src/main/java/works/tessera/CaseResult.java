package works.tessera;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * @param reason present only for {@link Outcome#FAILED FAILED} and {@link Outcome#EXPECTED_FAILURE EXPECTED_FAILURE}
 * @param message a human-readable diagnostic; null for a plain pass
 * @param failure the exception behind a failure, if any
 * @param teardownFailures failures tearing down the values this case owned, which don't affect the outcome
 */
public record CaseResult(
	String name,
	Outcome outcome,
	Optional<FailureReason> reason,
	@Nullable String message,
	@Nullable Throwable failure,
	List<TeardownFailure> teardownFailures
) {
	public CaseResult {
		teardownFailures = List.copyOf(teardownFailures);
	}

	static CaseResult skipped(TestCase testCase) {
		return new CaseResult(testCase.name(), Outcome.SKIPPED, Optional.empty(),
			testCase.definition().ignoreReason().orElse(null), null, List.of());
	}

	public boolean isSuccess() {
		return outcome.isSuccess();
	}
}

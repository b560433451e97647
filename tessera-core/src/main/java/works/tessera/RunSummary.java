package works.tessera;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Totals for one run.
 *
 * @param outcomes the number of cases with each outcome; every outcome is present
 * @param filteredOut cases collected but not selected by the {@link RunSettings}
 * @param teardownFailures across all cases and the global scope
 * @param collectionFailed a structural error prevented any case from running
 */
public record RunSummary(
	Map<Outcome, Integer> outcomes,
	int filteredOut,
	int teardownFailures,
	boolean collectionFailed
) {
	public RunSummary {
		EnumMap<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
		for (Outcome o: Outcome.values()) {
			counts.put(o, outcomes.getOrDefault(o, 0));
		}
		outcomes = Collections.unmodifiableMap(counts);
	}

	static RunSummary ofCollectionFailure() {
		return new RunSummary(Map.of(), 0, 0, true);
	}

	public int count(Outcome outcome) {
		return outcomes.get(outcome);
	}

	public int total() {
		return outcomes.values().stream().mapToInt(Integer::intValue).sum();
	}

	/**
	 * Teardown failures are reported but don't make a run fail.
	 */
	public boolean isSuccess() {
		return !collectionFailed
			&& count(Outcome.FAILED) == 0
			&& count(Outcome.UNEXPECTED_SUCCESS) == 0;
	}

	/**
	 * @return 0 if the run succeeded, 1 otherwise
	 */
	public int exitCode() {
		return isSuccess() ? 0 : 1;
	}

	@Override
	public String toString() {
		return "RunSummary(" + (isSuccess() ? "ok" : "FAILED")
			+ ": " + count(Outcome.PASSED) + " passed"
			+ ", " + count(Outcome.FAILED) + " failed"
			+ ", " + count(Outcome.EXPECTED_FAILURE) + " expected failures"
			+ ", " + count(Outcome.UNEXPECTED_SUCCESS) + " unexpected successes"
			+ ", " + count(Outcome.SKIPPED) + " skipped"
			+ ", " + filteredOut + " filtered out"
			+ ", " + teardownFailures + " teardown failures"
			+ (collectionFailed ? ", collection failed" : "")
			+ ")";
	}
}

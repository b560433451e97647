package works.tessera;

import java.util.List;
import works.tessera.exceptions.InvalidRegistryException;

/**
 * Receives the results of a run.
 * <p>
 * The engine calls a reporter from one thread at a time, so implementations needn't be thread-safe.
 */
public interface Reporter {
	/**
	 * Called once, before anything is executed, with the selected cases in execution order.
	 */
	default void listed(List<CaseListing> cases) { }

	void caseFinished(CaseResult result);

	/**
	 * @param owner the case whose value failed to tear down, or "global scope"
	 */
	default void teardownFailed(String owner, TeardownFailure failure) { }

	/**
	 * The run can't proceed. No further calls except {@link #runFinished} will follow.
	 */
	default void collectionFailed(InvalidRegistryException exception) { }

	default void runFinished(RunSummary summary) { }
}

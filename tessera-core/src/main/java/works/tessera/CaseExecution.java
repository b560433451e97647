package works.tessera;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.ScopeStore.CaseScope;
import works.tessera.exceptions.FixtureConstructionException;
import works.tessera.logging.MappedDiagnosticContext.MDCScope;

import static works.tessera.CaseState.COLLECTED;
import static works.tessera.CaseState.REPORTED;
import static works.tessera.CaseState.RESOLVING;
import static works.tessera.CaseState.RUNNING;
import static works.tessera.CaseState.TORN_DOWN;
import static works.tessera.logging.MappedDiagnosticContext.setupMDC;

/**
 * Executes one case on the current thread: resolve, run, tear down, and compute the outcome.
 * The values this case owns are torn down whatever happens.
 */
final class CaseExecution implements Callable<CaseResult> {
	private final TestCase testCase;
	private final ScopeStore store;
	private final FailureCapture capture;
	private final boolean isSkipped;
	private CaseState state = COLLECTED;

	CaseExecution(TestCase testCase, ScopeStore store, FailureCapture capture, boolean isSkipped) {
		this.testCase = testCase;
		this.store = store;
		this.capture = capture;
		this.isSkipped = isSkipped;
	}

	@Override
	public CaseResult call() {
		try (MDCScope ignored = setupMDC(testCase.name())) {
			if (isSkipped) {
				transition(REPORTED);
				return CaseResult.skipped(testCase);
			}
			CaseResult result = execute();
			transition(REPORTED);
			return result;
		}
	}

	private CaseResult execute() {
		CaseScope scope = store.openCase(testCase);
		@Nullable FailureReason reason = null;
		@Nullable Throwable failure = null;
		List<TeardownFailure> teardownFailures;
		try {
			transition(RESOLVING);
			FixtureArguments arguments = null;
			try {
				arguments = scope.resolveParameters();
			} catch (FixtureConstructionException e) {
				LOGGER.warn("Setup failed: {}", e.getMessage());
				reason = FailureReason.SETUP;
				failure = e;
			}
			if (arguments != null) {
				transition(RUNNING);
				FixtureArguments args = arguments;
				Captured<Void> result = capture.run(() -> testCase.definition().body().run(args));
				if (result.isFailure()) {
					LOGGER.debug("Body failed", result.failure());
					reason = FailureReason.BODY;
					failure = result.failure();
				}
			}
		} finally {
			teardownFailures = scope.tearDown();
			transition(TORN_DOWN);
		}
		return judge(reason, failure, teardownFailures);
	}

	/**
	 * Applies the case's expectation. Setup failures are never reinterpreted.
	 */
	private CaseResult judge(@Nullable FailureReason reason, @Nullable Throwable failure, List<TeardownFailure> teardownFailures) {
		String name = testCase.name();
		if (reason == null) {
			if (testCase.expectFailure()) {
				return new CaseResult(name, Outcome.UNEXPECTED_SUCCESS, Optional.empty(),
					"Expected failure, but the case passed", null, teardownFailures);
			} else {
				return new CaseResult(name, Outcome.PASSED, Optional.empty(), null, null, teardownFailures);
			}
		}
		String message = Captured.failure(failure).message();
		if (reason == FailureReason.BODY && testCase.expectFailure()) {
			return new CaseResult(name, Outcome.EXPECTED_FAILURE, Optional.of(reason), message, failure, teardownFailures);
		} else {
			return new CaseResult(name, Outcome.FAILED, Optional.of(reason), message, failure, teardownFailures);
		}
	}

	private void transition(CaseState next) {
		LOGGER.debug("{} -> {}", state, next);
		state = next;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CaseExecution.class);
}

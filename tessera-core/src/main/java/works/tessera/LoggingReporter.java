package works.tessera;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.exceptions.InvalidRegistryException;

/**
 * A {@link Reporter} that writes everything to the log.
 */
public final class LoggingReporter implements Reporter {
	public static final LoggingReporter INSTANCE = new LoggingReporter();

	private LoggingReporter() { }

	@Override
	public void listed(List<CaseListing> cases) {
		LOGGER.info("Running {} case(s)", cases.size());
		for (CaseListing c: cases) {
			LOGGER.debug("  {}{}{}", c.name(),
				c.isIgnored() ? " (ignored)" : "",
				c.expectFailure() ? " (expect failure)" : "");
		}
	}

	@Override
	public void caseFinished(CaseResult result) {
		switch (result.outcome()) {
			case PASSED, EXPECTED_FAILURE -> LOGGER.info("{} ... {}", result.name(), result.outcome());
			case SKIPPED -> LOGGER.info("{} ... {}{}", result.name(), result.outcome(),
				result.message() == null ? "" : " (" + result.message() + ")");
			case FAILED, UNEXPECTED_SUCCESS -> LOGGER.error("{} ... {}: {}", result.name(), result.outcome(), result.message());
		}
	}

	@Override
	public void teardownFailed(String owner, TeardownFailure failure) {
		LOGGER.warn("Teardown of {} in {} failed", failure.key(), owner, failure.cause());
	}

	@Override
	public void collectionFailed(InvalidRegistryException exception) {
		LOGGER.error("Collection failed: {}", exception.getMessage());
	}

	@Override
	public void runFinished(RunSummary summary) {
		if (summary.isSuccess()) {
			LOGGER.info("{}", summary);
		} else {
			LOGGER.error("{}", summary);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingReporter.class);
}

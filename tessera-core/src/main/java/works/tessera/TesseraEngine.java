package works.tessera;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.exceptions.InvalidRegistryException;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.tessera.RunState.COLLECTING;
import static works.tessera.RunState.EXECUTING;
import static works.tessera.RunState.FINISHED;
import static works.tessera.RunState.IDLE;

/**
 * Runs test definitions against a fixture registry in two phases.
 * <ol>
 *     <li>
 *         Collection validates the registry, computes dependency closures, and expands
 *         definitions into cases. It never invokes a constructor.
 *     </li>
 *     <li>
 *         Execution runs the selected cases on a pool of worker threads,
 *         reporting each outcome as it becomes available,
 *         and finally tears down the global scope.
 *     </li>
 * </ol>
 *
 * The phases share only the immutable {@link TestPlan}.
 * Every reporter call is made from the thread that called {@link #run}.
 */
public final class TesseraEngine {
	private final FixtureRegistry registry;
	private final List<TestDefinition> definitions;
	private final Reporter reporter;
	private final FailureCapture capture;
	private volatile RunState state = IDLE;

	public TesseraEngine(FixtureRegistry registry, List<TestDefinition> definitions, TesseraConfig config) {
		this.registry = registry;
		this.definitions = List.copyOf(definitions);
		this.reporter = config.reporter();
		this.capture = config.failureCapture();
	}

	public TesseraEngine(FixtureRegistry registry, List<TestDefinition> definitions) {
		this(registry, definitions, TesseraConfig.simple());
	}

	public RunState state() {
		return state;
	}

	/**
	 * Validates and expands without side effects.
	 *
	 * @throws InvalidRegistryException if the fixtures or definitions are structurally invalid
	 */
	public TestPlan collect() throws InvalidRegistryException {
		DependencyGraph graph = DependencyGraphBuilder.build(registry, definitions);
		List<TestCase> cases = CaseExpander.expand(graph, capture);
		LOGGER.debug("Collected {} case(s) from {} definition(s)", cases.size(), definitions.size());
		return new TestPlan(graph, cases);
	}

	/**
	 * Collects, then executes the cases selected by {@code settings}.
	 * A structural error is reported to the {@link Reporter} rather than thrown,
	 * and results in a failed summary with no cases run.
	 *
	 * @throws InterruptedException if interrupted while waiting for cases to finish.
	 * Cases not yet started are abandoned. Cases already running are interrupted and
	 * allowed to finish, and only then is the global scope torn down and the run reported finished.
	 */
	public RunSummary run(RunSettings settings) throws InterruptedException {
		if (state != IDLE) {
			throw new IllegalStateException("Engine has already run; state is " + state);
		}
		transition(COLLECTING);
		TestPlan plan;
		try {
			plan = collect();
		} catch (InvalidRegistryException e) {
			LOGGER.error("Unable to collect tests", e);
			reporter.collectionFailed(e);
			RunSummary summary = RunSummary.ofCollectionFailure();
			reporter.runFinished(summary);
			transition(FINISHED);
			return summary;
		}

		CaseSelector selector = new CaseSelector(settings);
		List<TestCase> selected = selector.select(plan.cases());
		int filteredOut = plan.cases().size() - selected.size();
		reporter.listed(selected.stream().map(CaseListing::of).toList());
		if (settings.isListOnly()) {
			RunSummary summary = new RunSummary(Map.of(), filteredOut, 0, false);
			reporter.runFinished(summary);
			transition(FINISHED);
			return summary;
		}

		transition(EXECUTING);
		Map<Outcome, Integer> outcomes = new EnumMap<>(Outcome.class);
		int teardownFailures = 0;
		InterruptedException interruption = null;
		boolean isInterruptedWhileDraining;
		ScopeStore store = new ScopeStore(plan.graph(), capture);
		ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, settings.getThreads()), r -> {
			Thread t = new Thread(r);
			t.setName("tessera-worker-" + threadCounter.getAndIncrement());
			t.setDaemon(true);
			return t;
		});
		try {
			CompletionService<CaseResult> completions = new ExecutorCompletionService<>(executor);
			for (TestCase testCase: selected) {
				completions.submit(new CaseExecution(testCase, store, capture, selector.isSkipped(testCase)));
			}
			for (int i = 0; i < selected.size(); i++) {
				CaseResult result = awaitResult(completions);
				outcomes.merge(result.outcome(), 1, Integer::sum);
				reporter.caseFinished(result);
				for (TeardownFailure f: result.teardownFailures()) {
					reporter.teardownFailed(result.name(), f);
					teardownFailures++;
				}
			}
		} catch (InterruptedException e) {
			LOGGER.warn("Interrupted; cases not yet started will not run");
			interruption = e;
		} finally {
			// Cases already running may still be using global values
			executor.shutdownNow();
			isInterruptedWhileDraining = awaitTerminationUninterruptibly(executor);
			for (TeardownFailure f: store.close()) {
				reporter.teardownFailed("global scope", f);
				teardownFailures++;
			}
		}

		RunSummary summary = new RunSummary(outcomes, filteredOut, teardownFailures, false);
		reporter.runFinished(summary);
		transition(FINISHED);
		if (interruption != null) {
			throw interruption;
		}
		if (isInterruptedWhileDraining) {
			Thread.currentThread().interrupt();
		}
		return summary;
	}

	/**
	 * @return true if the current thread was interrupted while waiting
	 */
	private static boolean awaitTerminationUninterruptibly(ExecutorService executor) {
		boolean isInterrupted = false;
		while (true) {
			try {
				if (executor.awaitTermination(DRAIN_WARNING_INTERVAL.toMillis(), MILLISECONDS)) {
					return isInterrupted;
				}
				LOGGER.warn("Still waiting for running cases to finish");
			} catch (InterruptedException e) {
				LOGGER.debug("Interrupted while waiting for running cases; still waiting");
				isInterrupted = true;
			}
		}
	}

	/**
	 * {@link CaseExecution} captures everything but {@link VirtualMachineError},
	 * so that's all that can arrive here as an {@link ExecutionException}.
	 */
	private static CaseResult awaitResult(CompletionService<CaseResult> completions) throws InterruptedException {
		try {
			return completions.take().get();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof Error error) {
				throw error;
			}
			throw new IllegalStateException("Unexpected exception executing case", e.getCause());
		}
	}

	private void transition(RunState next) {
		LOGGER.debug("Run {} -> {}", state, next);
		state = next;
	}

	private static final Duration DRAIN_WARNING_INTERVAL = Duration.ofSeconds(30);
	private static final AtomicInteger threadCounter = new AtomicInteger(1);
	private static final Logger LOGGER = LoggerFactory.getLogger(TesseraEngine.class);
}

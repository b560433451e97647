package works.tessera;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.exceptions.FixtureConstructionException;

/**
 * Materializes fixture values according to their {@link Scope}, caches the shared ones,
 * and tears everything down in reverse order of construction.
 * <p>
 * Values are owned by one of two lifetimes:
 * <ul>
 *     <li>
 *         a {@link CaseScope}, which owns every non-global value constructed on behalf of its case,
 *         and tears them down when the case ends; or
 *     </li>
 *     <li>
 *         the store itself, which owns every {@link Scope#GLOBAL global} value, along with any
 *         unshared values constructed to build them, and tears them down on {@link #close()}.
 *     </li>
 * </ul>
 *
 * Global values are constructed at most once per instance key, even under concurrent demand:
 * the first requester runs the constructor while the others wait for its result.
 * A global fixture whose constructor fails stays failed for the rest of the run;
 * later requesters get the same failure without another attempt.
 * <p>
 * The instance key of a global fixture includes the parameter bindings of its own closure,
 * so a global fixture built over a parametrized fixture has one value per parameter value.
 */
public final class ScopeStore {
	private final DependencyGraph graph;
	private final FailureCapture capture;
	private final ConcurrentHashMap<GlobalInstanceKey, GlobalSlot> globals = new ConcurrentHashMap<>();
	private final TeardownStack globalTeardowns = new TeardownStack("global scope");
	private final AtomicBoolean isOpen = new AtomicBoolean(true);

	public ScopeStore(DependencyGraph graph, FailureCapture capture) {
		this.graph = graph;
		this.capture = capture;
	}

	public CaseScope openCase(TestCase testCase) {
		if (!isOpen.get()) {
			throw new IllegalStateException("Scope store is closed; can't open case " + testCase.name());
		}
		return new CaseScope(testCase);
	}

	/**
	 * Tears down every global value, most recently constructed first.
	 * Only the first call has any effect.
	 *
	 * @return the teardown failures
	 */
	public List<TeardownFailure> close() {
		if (!isOpen.compareAndSet(true, false)) {
			LOGGER.debug("Already closed");
			return List.of();
		}
		return globalTeardowns.unwind(capture);
	}

	/**
	 * One execution of one case. Not thread-safe: a case resolves its fixtures on a single thread.
	 */
	public final class CaseScope {
		private final TestCase testCase;
		private final TeardownStack teardowns;
		private final Map<FixtureKey, Object> shared = new HashMap<>();
		private final Resolver resolver;
		private boolean isTornDown = false;

		private CaseScope(TestCase testCase) {
			this.testCase = testCase;
			this.teardowns = new TeardownStack("case " + testCase.name());
			this.resolver = new Resolver(this, teardowns, testCase.bindings());
		}

		public TestCase testCase() {
			return testCase;
		}

		/**
		 * @throws FixtureConstructionException if the value, or anything it depends on, can't be constructed
		 */
		public Object resolve(FixtureKey key) {
			if (isTornDown) {
				throw new IllegalStateException("Case " + testCase.name() + " has already been torn down");
			}
			return ScopeStore.this.resolve(resolver, key);
		}

		/**
		 * Resolves the definition's parameters in declared order.
		 *
		 * @throws FixtureConstructionException at the first parameter that can't be resolved
		 */
		public FixtureArguments resolveParameters() {
			List<FixtureKey> keys = testCase.definition().parameters();
			List<Object> values = new ArrayList<>(keys.size());
			for (FixtureKey key: keys) {
				values.add(resolve(key));
			}
			return new ResolvedArguments(keys, values, Optional.empty());
		}

		/**
		 * Tears down every value this case owns, most recently constructed first.
		 * Only the first call has any effect.
		 */
		public List<TeardownFailure> tearDown() {
			if (isTornDown) {
				return List.of();
			}
			isTornDown = true;
			shared.clear();
			return teardowns.unwind(capture);
		}

		Object resolveShared(FixtureSpec spec) {
			Object existing = shared.get(spec.key());
			if (existing != null) {
				return existing;
			}
			Object value = construct(spec, resolver);
			shared.put(spec.key(), value);
			return value;
		}

		@Override
		public String toString() {
			return "CaseScope(" + testCase.name() + ")";
		}
	}

	/**
	 * Resolves keys on behalf of one owner.
	 *
	 * @param caseScope null when constructing a global value, which can't depend on case-bound values
	 * @param owner receives every unshared value constructed by this resolver
	 */
	private record Resolver(
		@Nullable CaseScope caseScope,
		TeardownStack owner,
		Map<FixtureKey, Object> bindings
	) { }

	private Object resolve(Resolver resolver, FixtureKey key) {
		FixtureSpec spec = graph.spec(key);
		return switch (spec.scope()) {
			case GLOBAL -> resolveGlobal(spec, resolver.bindings());
			case PER_CASE, MATRIX -> {
				if (resolver.caseScope() == null) {
					throw new IllegalStateException("Fixture " + key + " with scope " + spec.scope() + " can't be resolved outside a case");
				}
				yield resolver.caseScope().resolveShared(spec);
			}
			case FRESH, MATRIX_UNIQUE -> construct(spec, resolver);
		};
	}

	private Object resolveGlobal(FixtureSpec spec, Map<FixtureKey, Object> bindings) {
		Map<FixtureKey, Object> relevant = new HashMap<>();
		for (FixtureKey k: graph.parametrizedIn(spec.key())) {
			Object binding = bindings.get(k);
			if (binding == null) {
				throw new IllegalStateException("No binding for parametrized fixture " + k + " required by " + spec.key());
			}
			relevant.put(k, binding);
		}
		GlobalInstanceKey instanceKey = new GlobalInstanceKey(spec.key(), Map.copyOf(relevant));
		GlobalSlot slot = globals.computeIfAbsent(instanceKey, GlobalSlot::new);
		return slot.get(() -> construct(spec, new Resolver(null, globalTeardowns, instanceKey.bindings())));
	}

	/**
	 * Resolves every dependency of {@code spec} depth-first in declared order,
	 * then invokes the constructor, and hands the new value to the resolver's owner.
	 */
	private Object construct(FixtureSpec spec, Resolver resolver) {
		List<Object> values = new ArrayList<>(spec.dependencies().size());
		for (FixtureKey dependency: spec.dependencies()) {
			try {
				values.add(resolve(resolver, dependency));
			} catch (FixtureConstructionException e) {
				throw e.propagatedTo(spec.key());
			}
		}

		Optional<Object> param = Optional.empty();
		if (spec.isParametrized()) {
			Object binding = resolver.bindings().get(spec.key());
			if (binding == null) {
				throw new IllegalStateException("No binding for parametrized fixture " + spec.key());
			}
			param = Optional.of(binding);
		}
		ResolvedArguments arguments = new ResolvedArguments(spec.dependencies(), values, param);

		LOGGER.debug("Constructing {} for {}", spec.key(), resolver.owner());
		Captured<Object> result = capture.capture(() -> spec.constructor().construct(arguments));
		if (result.isFailure()) {
			LOGGER.debug("Constructor of {} failed", spec.key(), result.failure());
			throw new FixtureConstructionException(spec.key(), result.failure());
		}
		Object value = result.value();
		if (value == null) {
			throw new FixtureConstructionException(spec.key(), new NullPointerException("Constructor returned null"));
		}
		resolver.owner().push(new FixtureInstance(spec.key(), value, spec.teardown().orElse(null)));
		return value;
	}

	private record GlobalInstanceKey(FixtureKey key, Map<FixtureKey, Object> bindings) { }

	/**
	 * Single-writer lazy initialization of one global value.
	 * Requesters arriving during construction block until it completes or fails,
	 * then receive the same value or the same failure.
	 */
	private static final class GlobalSlot {
		private final GlobalInstanceKey instanceKey;
		private Object value;
		private FixtureConstructionException failure;
		private boolean isResolved = false;

		GlobalSlot(GlobalInstanceKey instanceKey) {
			this.instanceKey = instanceKey;
		}

		synchronized Object get(Supplier<Object> constructor) {
			if (!isResolved) {
				try {
					value = constructor.get();
				} catch (FixtureConstructionException e) {
					LOGGER.warn("Global fixture {} failed; it will not be attempted again in this run", instanceKey.key());
					failure = e;
					isResolved = true;
					throw e;
				}
				isResolved = true;
			} else if (failure != null) {
				throw failure.replayed();
			}
			return value;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ScopeStore.class);
}

package works.tessera;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import works.tessera.ScopeStore.CaseScope;
import works.tessera.exceptions.FixtureConstructionException;
import works.tessera.exceptions.InvalidRegistryException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.tessera.Scope.FRESH;
import static works.tessera.Scope.GLOBAL;
import static works.tessera.Scope.MATRIX;
import static works.tessera.Scope.MATRIX_UNIQUE;
import static works.tessera.Scope.PER_CASE;

class ScopeStoreTest {
	final List<String> events = new ArrayList<>();
	ScopeStore store;

	@AfterEach
	void closeStore() {
		if (store != null) {
			store.close();
		}
	}

	@Test
	void fresh_eachRequesterGetsItsOwnValue() throws InvalidRegistryException {
		AtomicInteger next = new AtomicInteger();
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("counter").constructor(args -> next.getAndIncrement()).build())
			.register(FixtureSpec.builder("a").dependsOn("counter").constructor(args -> args.get(0)).build())
			.register(FixtureSpec.builder("b").dependsOn("counter").constructor(args -> args.get(0)).build())
			.build();
		TestCase testCase = collect(registry, test("t", "a", "b")).get(0);

		FixtureArguments args = store.openCase(testCase).resolveParameters();
		assertEquals(0, args.get("a"));
		assertEquals(1, args.get("b"));
	}

	@Test
	void perCase_sharedWithinCaseButNotAcrossCases() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("shared").scope(PER_CASE).constructor(args -> new Object()).build())
			.register(FixtureSpec.builder("a").dependsOn("shared").constructor(args -> args.get(0)).build())
			.register(FixtureSpec.builder("b").dependsOn("shared").constructor(args -> args.get(0)).build())
			.build();
		List<TestCase> cases = collect(registry, test("t1", "a", "b"), test("t2", "a"));

		FixtureArguments first = store.openCase(cases.get(0)).resolveParameters();
		FixtureArguments second = store.openCase(cases.get(1)).resolveParameters();
		assertSame(first.get("a"), first.get("b"));
		assertNotSame(first.get("a"), second.get("a"));
	}

	@Test
	void matrix_sharedWithinCase_matrixUnique_isNot() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("m").scope(MATRIX).constructor(args -> new Object()).build())
			.register(FixtureSpec.builder("mu").scope(MATRIX_UNIQUE).constructor(args -> new Object()).build())
			.register(FixtureSpec.builder("x").dependsOn("m", "mu").constructor(args -> List.of(args.get(0), args.get(1))).build())
			.register(FixtureSpec.builder("y").dependsOn("m", "mu").constructor(args -> List.of(args.get(0), args.get(1))).build())
			.build();
		TestCase testCase = collect(registry, test("t", "x", "y")).get(0);

		FixtureArguments args = store.openCase(testCase).resolveParameters();
		List<?> x = (List<?>) args.get("x");
		List<?> y = (List<?>) args.get("y");
		assertSame(x.get(0), y.get(0));
		assertNotSame(x.get(1), y.get(1));
	}

	@Test
	void global_constructedOnceUnderConcurrentDemand() throws Exception {
		AtomicInteger constructions = new AtomicInteger();
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("db").scope(GLOBAL).constructor(args -> {
				constructions.incrementAndGet();
				Thread.sleep(50);
				return new Object();
			}).build())
			.build();
		TestCase testCase = collect(registry, test("t", "db")).get(0);
		FixtureKey db = FixtureKey.of("db");

		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			CountDownLatch start = new CountDownLatch(1);
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					return store.openCase(testCase).resolve(db);
				}));
			}
			start.countDown();
			Object expected = futures.get(0).get(10, TimeUnit.SECONDS);
			for (Future<Object> f: futures) {
				assertSame(expected, f.get(10, TimeUnit.SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(1, constructions.get());
	}

	@Test
	void teardown_reverseOfConstruction() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(recording("a", PER_CASE))
			.register(recording("b", FRESH, "a"))
			.register(recording("c", PER_CASE, "b"))
			.build();
		TestCase testCase = collect(registry, test("t", "c")).get(0);

		CaseScope scope = store.openCase(testCase);
		scope.resolveParameters();
		List<TeardownFailure> failures = scope.tearDown();

		assertEquals(List.of(), failures);
		assertEquals(List.of(
			"construct a", "construct b", "construct c",
			"teardown c", "teardown b", "teardown a"
		), events);
	}

	@Test
	void teardown_failureDoesNotStopOtherTeardowns() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(recording("a", FRESH))
			.register(FixtureSpec.builder("b").dependsOn("a")
				.constructor(args -> "b")
				.teardown(value -> { throw new IllegalStateException("can't tear down b"); })
				.build())
			.build();
		TestCase testCase = collect(registry, test("t", "b")).get(0);

		CaseScope scope = store.openCase(testCase);
		scope.resolveParameters();
		List<TeardownFailure> failures = scope.tearDown();

		assertEquals(1, failures.size());
		assertEquals(FixtureKey.of("b"), failures.get(0).key());
		assertEquals(List.of("construct a", "teardown a"), events);
		assertEquals(List.of(), scope.tearDown(), "Second teardown has no effect");
	}

	@Test
	void setupFailure_namesRootKey() throws InvalidRegistryException {
		AtomicInteger dependentConstructions = new AtomicInteger();
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("root").constructor(args -> { throw new IllegalStateException("no database"); }).build())
			.register(FixtureSpec.builder("middle").dependsOn("root").constructor(args -> dependentConstructions.incrementAndGet()).build())
			.build();
		TestCase testCase = collect(registry, test("t", "middle")).get(0);

		CaseScope scope = store.openCase(testCase);
		FixtureConstructionException e = assertThrows(FixtureConstructionException.class, scope::resolveParameters);
		assertEquals(FixtureKey.of("middle"), e.key());
		assertEquals(FixtureKey.of("root"), e.rootKey());
		assertThat(e.getMessage(), containsString("root"));
		assertEquals(0, dependentConstructions.get(), "Dependent constructor must not run");
	}

	@Test
	void nullValue_isConstructionFailure() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("nothing").constructor(args -> null).build())
			.build();
		TestCase testCase = collect(registry, test("t", "nothing")).get(0);

		FixtureConstructionException e = assertThrows(FixtureConstructionException.class,
			() -> store.openCase(testCase).resolveParameters());
		assertInstanceOf(NullPointerException.class, e.getCause());
	}

	@Test
	void globalFailure_replayedWithoutRetry() throws InvalidRegistryException {
		AtomicInteger attempts = new AtomicInteger();
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("server").scope(GLOBAL).constructor(args -> {
				attempts.incrementAndGet();
				throw new IllegalStateException("port in use");
			}).build())
			.register(FixtureSpec.builder("client").dependsOn("server").constructor(args -> "client").build())
			.build();
		List<TestCase> cases = collect(registry, test("t1", "client"), test("t2", "server"));

		FixtureConstructionException first = assertThrows(FixtureConstructionException.class,
			() -> store.openCase(cases.get(0)).resolveParameters());
		FixtureConstructionException second = assertThrows(FixtureConstructionException.class,
			() -> store.openCase(cases.get(1)).resolveParameters());

		assertEquals(FixtureKey.of("client"), first.key());
		assertEquals(FixtureKey.of("server"), first.rootKey());
		assertEquals(FixtureKey.of("server"), second.rootKey());
		assertThat(second.getMessage(), containsString("failed earlier in the run"));
		assertEquals(1, attempts.get());
	}

	@Test
	void global_ownsItsUnsharedDependencies() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(recording("connection", FRESH))
			.register(recording("pool", GLOBAL, "connection"))
			.build();
		TestCase testCase = collect(registry, test("t", "pool")).get(0);

		CaseScope scope = store.openCase(testCase);
		scope.resolveParameters();
		scope.tearDown();
		assertEquals(List.of("construct connection", "construct pool"), events, "Nothing torn down with the case");

		assertEquals(List.of(), store.close());
		assertEquals(List.of(
			"construct connection", "construct pool",
			"teardown pool", "teardown connection"
		), events);
		assertEquals(List.of(), store.close(), "Second close has no effect");
		assertEquals(4, events.size());
	}

	@Test
	void parametrizedGlobal_oneValuePerBinding() throws InvalidRegistryException {
		AtomicInteger constructions = new AtomicInteger();
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("size").parameters(1, 2).constructor(FixtureArguments::param).build())
			.register(FixtureSpec.builder("buffer").scope(GLOBAL).dependsOn("size").constructor(args -> {
				constructions.incrementAndGet();
				return new StringBuilder("size " + args.get(0));
			}).build())
			.build();
		List<TestCase> cases = collect(registry, test("t", "buffer"));
		assertEquals(2, cases.size());
		FixtureKey buffer = FixtureKey.of("buffer");

		Object forOne = store.openCase(cases.get(0)).resolve(buffer);
		Object forTwo = store.openCase(cases.get(1)).resolve(buffer);
		Object forOneAgain = store.openCase(cases.get(0)).resolve(buffer);

		assertEquals("size 1", forOne.toString());
		assertEquals("size 2", forTwo.toString());
		assertSame(forOne, forOneAgain);
		assertEquals(2, constructions.get());
	}

	@Test
	void closedStore_rejectsNewCases() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(recording("a", FRESH))
			.build();
		TestCase testCase = collect(registry, test("t", "a")).get(0);
		store.close();
		assertThrows(IllegalStateException.class, () -> store.openCase(testCase));
		assertTrue(events.isEmpty());
	}

	private List<TestCase> collect(FixtureRegistry registry, TestDefinition... definitions) throws InvalidRegistryException {
		DependencyGraph graph = DependencyGraphBuilder.build(registry, List.of(definitions));
		store = new ScopeStore(graph, FailureCapture.catching());
		return CaseExpander.expand(graph);
	}

	private static TestDefinition test(String name, String... uses) {
		return TestDefinition.builder(name).uses(uses).body(args -> { }).build();
	}

	private FixtureSpec recording(String name, Scope scope, String... dependencies) {
		return FixtureSpec.builder(name)
			.scope(scope)
			.dependsOn(dependencies)
			.constructor(args -> {
				events.add("construct " + name);
				return name;
			})
			.teardown(value -> events.add("teardown " + name))
			.build();
	}
}

package works.tessera;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.tessera.exceptions.InvalidDeclarationException;
import works.tessera.exceptions.InvalidRegistryException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaseExpanderTest {

	@Test
	void unparametrized_oneCaseNamedAfterDefinition() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("a").constructor(args -> "a").build())
			.build();

		List<TestCase> cases = expand(registry, test("plain", "a"));

		assertEquals(1, cases.size());
		assertEquals("plain", cases.get(0).name());
		assertEquals(Map.of(), cases.get(0).bindings());
	}

	@Test
	void twoDomains_cartesianProductInDeclaredOrder() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("p").parameters(1, 2).constructor(FixtureArguments::param).build())
			.register(FixtureSpec.builder("q").parameters("a", "b", "c").constructor(FixtureArguments::param).build())
			.build();

		List<TestCase> cases = expand(registry, test("t", "p", "q"));

		assertEquals(List.of(
			"t[p=1,q=a]", "t[p=1,q=b]", "t[p=1,q=c]",
			"t[p=2,q=a]", "t[p=2,q=b]", "t[p=2,q=c]"
		), cases.stream().map(TestCase::name).toList());
		for (int i = 0; i < cases.size(); i++) {
			assertEquals(i, cases.get(i).index());
			assertEquals(cases.get(i).name(), cases.get(i).caseId());
		}
		assertEquals(2, cases.get(3).binding(FixtureKey.of("p")).orElseThrow());
		assertEquals("a", cases.get(3).binding(FixtureKey.of("q")).orElseThrow());
	}

	@Test
	void indirectParameter_expandsDependentTest() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("size").parameters(1, 5).constructor(FixtureArguments::param).build())
			.register(FixtureSpec.builder("buffer").dependsOn("size").constructor(args -> new byte[args.get(0, Integer.class)]).build())
			.build();

		List<TestCase> first = expand(registry, test("t", "buffer"));
		List<TestCase> second = expand(registry, test("t", "buffer"));

		assertEquals(List.of("t[size=1]", "t[size=5]"), first.stream().map(TestCase::name).toList());
		assertEquals(
			first.stream().map(TestCase::caseId).toList(),
			second.stream().map(TestCase::caseId).toList(),
			"Case IDs are stable across collections");
	}

	@Test
	void sharedParametrizedFixture_boundOnce() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("p").parameters(1, 2, 3).constructor(FixtureArguments::param).build())
			.register(FixtureSpec.builder("x").dependsOn("p").constructor(args -> args.get(0)).build())
			.register(FixtureSpec.builder("y").dependsOn("p").constructor(args -> args.get(0)).build())
			.build();

		List<TestCase> cases = expand(registry, test("t", "x", "y"));

		assertEquals(3, cases.size(), "p appears once in the closure, so it's expanded once");
	}

	@Test
	void collidingDescriptions_getDistinctNames() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("p").parameters("x", new StringBuilder("x")).constructor(FixtureArguments::param).build())
			.build();

		List<TestCase> cases = expand(registry, test("t", "p"));

		assertEquals(List.of("t[p=x]", "t[p=x]#2"), cases.stream().map(TestCase::name).toList());
	}

	@Test
	void ignoredDefinition_allCasesIgnored() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("p").parameters(1, 2).constructor(FixtureArguments::param).build())
			.build();

		List<TestCase> cases = expand(registry,
			TestDefinition.builder("slow").uses("p").body(args -> { }).ignored("too slow").build(),
			test("fast", "p"));

		assertEquals(4, cases.size());
		assertTrue(cases.get(0).isIgnored());
		assertTrue(cases.get(1).isIgnored());
		assertFalse(cases.get(2).isIgnored());
		assertFalse(cases.get(3).isIgnored());
	}

	@Test
	void ignoreConditionThrows_invalidDeclaration() throws InvalidRegistryException {
		FixtureRegistry registry = FixtureRegistry.builder()
			.register(FixtureSpec.builder("a").constructor(args -> "a").build())
			.build();
		DependencyGraph graph = DependencyGraphBuilder.build(registry, List.of(
			TestDefinition.builder("t").uses("a").body(args -> { })
				.ignoredIf(() -> { throw new IllegalStateException("no such property"); }, "no reason")
				.build()));

		InvalidDeclarationException e = assertThrows(InvalidDeclarationException.class, () -> CaseExpander.expand(graph));
		assertThat(e.getMessage(), containsString("t"));
		assertThat(e.getMessage(), containsString("no such property"));
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}

	@Test
	void bindingCombinations_keyedByFixture() {
		FixtureKey p = FixtureKey.of("p");
		FixtureKey q = FixtureKey.of("q");
		Map<FixtureKey, List<Object>> domains = Map.of(p, List.of(1, 2), q, List.of("a"));

		List<Map<FixtureKey, Object>> combinations = CaseExpander.bindingCombinations(List.of(p, q), domains::get);

		assertEquals(List.of(Map.of(p, 1, q, "a"), Map.of(p, 2, q, "a")), combinations);
		assertEquals(List.of(p, q), List.copyOf(combinations.get(0).keySet()));
		assertEquals(List.of(Map.of()), CaseExpander.bindingCombinations(List.of(), domains::get));
	}

	@Test
	void describe_arraysByContent() {
		assertEquals("[1, 2]", CaseExpander.describe(new int[]{1, 2}));
		assertEquals("[a, [b]]", CaseExpander.describe(new Object[]{"a", new String[]{"b"}}));
		assertEquals("7", CaseExpander.describe(7));
	}

	private static List<TestCase> expand(FixtureRegistry registry, TestDefinition... definitions) throws InvalidRegistryException {
		return CaseExpander.expand(DependencyGraphBuilder.build(registry, List.of(definitions)));
	}

	private static TestDefinition test(String name, String... uses) {
		return TestDefinition.builder(name).uses(uses).body(args -> { }).build();
	}
}

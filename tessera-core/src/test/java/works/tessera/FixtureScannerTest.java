package works.tessera;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.tessera.TesseraEngineTest.RecordingReporter;
import works.tessera.annotations.Case;
import works.tessera.annotations.Fixture;
import works.tessera.annotations.Param;
import works.tessera.annotations.ParamsFrom;
import works.tessera.annotations.TypeArg;
import works.tessera.annotations.Use;
import works.tessera.exceptions.InvalidDeclarationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.tessera.Outcome.EXPECTED_FAILURE;
import static works.tessera.Outcome.PASSED;

class FixtureScannerTest {

	@Test
	void scan_declarationOrderNamesAndTypes() throws InvalidDeclarationException {
		Declarations declarations = FixtureScanner.scan(new Greetings());

		assertEquals(List.of("greeting", "shout", "buffer"),
			declarations.fixtures().stream().map(f -> f.key().name()).toList());
		assertEquals(List.of("greets"),
			declarations.definitions().stream().map(TestDefinition::name).toList());

		FixtureSpec shout = declarations.fixtures().get(1);
		assertEquals(String.class, shout.valueType());
		assertEquals(List.of(FixtureKey.of("greeting")), shout.dependencies());
		assertEquals(String.class, shout.boundFor(FixtureKey.of("greeting")).orElseThrow());
		assertEquals(Scope.PER_CASE, declarations.fixtures().get(2).scope());
		assertEquals(List.of(FixtureKey.of("shout"), FixtureKey.of("buffer")),
			declarations.definitions().get(0).parameters());
	}

	@Test
	void scannedDeclarations_runWithTeardownMethod() throws InvalidDeclarationException, InterruptedException {
		Greetings receiver = new Greetings();

		RecordingReporter reporter = run(FixtureScanner.scan(receiver));

		assertEquals(PASSED, reporter.outcome("greets"));
		assertEquals(List.of("buffer", "HELLO", "release"), receiver.events);
	}

	@Test
	void paramsFrom_expandsCases() throws InvalidDeclarationException, InterruptedException {
		Declarations declarations = FixtureScanner.scan(Sizes.class);

		assertEquals(List.of(1, 2, 3), declarations.fixtures().get(0).parameterDomain().orElseThrow());
		assertEquals(Integer.class, declarations.fixtures().get(0).valueType());

		RecordingReporter reporter = run(declarations);

		assertEquals(List.of("positive[size=1]", "positive[size=2]", "positive[size=3]"),
			reporter.results.keySet().stream().sorted().toList());
		assertTrue(reporter.results.values().stream().allMatch(r -> r.outcome() == PASSED));
	}

	@Test
	void typeArg_declaresTemplateProvidingSameType() throws InvalidDeclarationException, InterruptedException {
		Declarations declarations = FixtureScanner.scan(Templates.class);

		assertEquals(1, declarations.templates().size());
		FixtureTemplate shared = declarations.templates().get(0);
		assertEquals(FixtureKey.of("Shared"), shared.baseKey());
		assertEquals(List.of(Object.class), shared.typeParameterBounds());

		RecordingReporter reporter = run(declarations);

		assertEquals(PASSED, reporter.outcome("usesShared"));
	}

	@Test
	void autoCloseableValue_closedWithoutTeardownMethod() throws InvalidDeclarationException, InterruptedException {
		Closing receiver = new Closing();

		RecordingReporter reporter = run(FixtureScanner.scan(receiver));

		assertEquals(PASSED, reporter.outcome("uses"));
		assertEquals(List.of("opened", "used", "closed"), receiver.events);
	}

	@Test
	void caseAnnotation_expectationsAndIgnoreConditions() throws InvalidDeclarationException {
		Declarations declarations = FixtureScanner.scan(Conditional.class);

		TestDefinition deploy = declarations.definitions().get(0);
		assertEquals("deploy", deploy.name());
		assertTrue(deploy.isIgnored());
		assertEquals("no deploys on friday", deploy.ignoreReason().orElseThrow());

		TestDefinition knownBug = declarations.definitions().get(1);
		assertEquals("known bug", knownBug.name());
		assertFalse(knownBug.isIgnored());
		assertTrue(knownBug.expectFailure());
	}

	@Test
	void expectFailure_bodyExceptionIsUnwrapped() throws InvalidDeclarationException, InterruptedException {
		RecordingReporter reporter = run(FixtureScanner.scan(Conditional.class));

		assertEquals(EXPECTED_FAILURE, reporter.outcome("known bug"));
		assertTrue(reporter.results.get("known bug").failure() instanceof IllegalStateException);
	}

	@Test
	void privateMethod_rejected() {
		InvalidDeclarationException e = assertThrows(InvalidDeclarationException.class,
			() -> FixtureScanner.scan(PrivateFixture.class));
		assertThat(e.getMessage(), containsString("private"));
	}

	@Test
	void fixtureAndCase_rejected() {
		assertThrows(InvalidDeclarationException.class, () -> FixtureScanner.scan(Both.class));
	}

	@Test
	void paramWithoutDomain_rejected() {
		InvalidDeclarationException e = assertThrows(InvalidDeclarationException.class,
			() -> FixtureScanner.scan(MissingDomain.class));
		assertThat(e.getMessage(), containsString("MissingDomain.value"));
		assertThat(e.getMessage(), containsString("ParamsFrom"));
	}

	@Test
	void emptyDomain_rejected() {
		assertThrows(InvalidDeclarationException.class, () -> FixtureScanner.scan(EmptyDomain.class));
	}

	@Test
	void voidFixture_rejected() {
		assertThrows(InvalidDeclarationException.class, () -> FixtureScanner.scan(VoidFixture.class));
	}

	private static RecordingReporter run(Declarations declarations) throws InterruptedException {
		RecordingReporter reporter = new RecordingReporter();
		new TesseraEngine(declarations.registry(), declarations.definitions(), TesseraConfig.builder().reporter(reporter).build())
			.run(RunSettings.builder().threads(1).build());
		return reporter;
	}

	static class Greetings {
		final List<String> events = new ArrayList<>();

		@Fixture
		String greeting() {
			return "hello";
		}

		@Fixture(name = "shout")
		String loud(String greeting) {
			return greeting.toUpperCase();
		}

		@Fixture(scope = Scope.PER_CASE, teardown = "release")
		StringBuilder buffer() {
			events.add("buffer");
			return new StringBuilder();
		}

		void release(StringBuilder buffer) {
			events.add(buffer.toString());
			events.add("release");
		}

		@Case
		void greets(@Use("shout") String message, StringBuilder buffer) {
			buffer.append(message);
		}
	}

	static class Sizes {
		static List<Integer> sizes() {
			return List.of(1, 2, 3);
		}

		@Fixture
		@ParamsFrom("sizes")
		static int size(@Param int value) {
			return value;
		}

		@Case
		static void positive(int size) {
			assertTrue(size > 0);
		}
	}

	static class Templates {
		@Fixture
		static String base() {
			return "base";
		}

		@Fixture(name = "Shared", scope = Scope.GLOBAL)
		static Object shared(@TypeArg(providesSame = true) Object value) {
			return value;
		}

		@Case
		static void usesShared(@Use(value = "Shared", of = "base") String value) {
			assertEquals("base", value);
		}
	}

	static class Closing {
		final List<String> events = new ArrayList<>();

		@Fixture
		Resource resource() {
			events.add("opened");
			return new Resource(events);
		}

		@Case
		void uses(Resource resource) {
			resource.events().add("used");
		}
	}

	record Resource(List<String> events) implements AutoCloseable {
		@Override
		public void close() {
			events.add("closed");
		}
	}

	static class Conditional {
		static boolean isFriday() {
			return true;
		}

		@Case(ignoreIf = "isFriday", reason = "no deploys on friday")
		static void deploy() {
		}

		@Case(name = "known bug", expectFailure = true)
		static void knownBug() {
			throw new IllegalStateException("still broken");
		}
	}

	static class PrivateFixture {
		@Fixture
		private static String hidden() {
			return "hidden";
		}
	}

	static class Both {
		@Fixture
		@Case
		static String confused() {
			return "confused";
		}
	}

	static class MissingDomain {
		@Fixture
		static String value(@Param String value) {
			return value;
		}
	}

	static class EmptyDomain {
		static List<String> none() {
			return List.of();
		}

		@Fixture
		@ParamsFrom("none")
		static String value(@Param String value) {
			return value;
		}
	}

	static class VoidFixture {
		@Fixture
		static void nothing() {
		}
	}
}

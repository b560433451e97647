package works.tessera;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResolvedArgumentsTest {
	final FixtureKey a = FixtureKey.of("a");
	final FixtureKey b = FixtureKey.of("b");

	@Test
	void param_parametrized() {
		FixtureArguments args = new ResolvedArguments(List.of(a), List.of("x"), Optional.of(42));
		assertEquals(42, args.param());
	}

	@Test
	void param_notParametrized() {
		FixtureArguments args = new ResolvedArguments(List.of(a), List.of("x"), Optional.empty());
		assertThrows(IllegalStateException.class, args::param);
	}

	@Test
	void get_byKeyAndIndex() {
		FixtureArguments args = new ResolvedArguments(List.of(a, b, a), List.of("x", "y", "z"), Optional.empty());
		assertEquals("y", args.get(b));
		assertEquals("x", args.get(a));
		assertEquals("z", args.get(2));
		assertEquals(3, args.size());
		assertThrows(IllegalArgumentException.class, () -> args.get(FixtureKey.of("c")));
	}

	@Test
	void mismatchedSizes_rejected() {
		assertThrows(IllegalArgumentException.class,
			() -> new ResolvedArguments(List.of(a, b), List.of("x"), Optional.empty()));
	}
}

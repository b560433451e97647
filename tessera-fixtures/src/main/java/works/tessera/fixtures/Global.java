package works.tessera.fixtures;

import works.tessera.FixtureKey;
import works.tessera.FixtureTemplate;
import works.tessera.Scope;

/**
 * Shares any fixture across the whole run.
 * <p>
 * {@code Global<x>} provides the same value as {@code x}, but constructed once per run
 * (or once per parameter binding, if {@code x} depends on a parametrized fixture)
 * and torn down after the last case. The value of {@code x} made for this purpose
 * is owned by {@code Global<x>}, so {@code x} itself may be {@link Scope#FRESH FRESH}.
 * <p>
 * Since a global value outlives every case,
 * {@code x} can't depend on anything with a case-bound scope.
 */
public final class Global {
	public static final FixtureKey KEY = FixtureKey.of("Global");

	private Global() { }

	public static FixtureTemplate template() {
		return TEMPLATE;
	}

	public static FixtureKey of(String name) {
		return of(FixtureKey.of(name));
	}

	public static FixtureKey of(FixtureKey key) {
		return KEY.instantiatedWith(key);
	}

	private static final FixtureTemplate TEMPLATE = FixtureTemplate.builder(KEY.name())
		.typeParameter(Object.class)
		.providesTypeArgument(0)
		.scope(Scope.GLOBAL)
		.constructor(args -> args.get(0))
		.build();
}

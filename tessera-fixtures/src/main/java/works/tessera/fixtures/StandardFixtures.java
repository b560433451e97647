package works.tessera.fixtures;

import works.tessera.FixtureRegistry;

/**
 * Registers the fixtures in this package under their default keys.
 */
public final class StandardFixtures {
	private StandardFixtures() { }

	public static FixtureRegistry.Builder registerIn(FixtureRegistry.Builder builder) {
		return builder
			.register(TempDir.spec())
			.register(TempFile.spec())
			.registerTemplate(Global.template());
	}
}

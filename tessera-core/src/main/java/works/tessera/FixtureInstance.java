package works.tessera;

import org.jetbrains.annotations.Nullable;

/**
 * A constructed fixture value, along with the teardown owed to it.
 */
record FixtureInstance(
	FixtureKey key,
	Object value,
	@Nullable Teardown teardown
) { }

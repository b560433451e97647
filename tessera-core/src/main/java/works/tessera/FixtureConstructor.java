package works.tessera;

/**
 * Produces a fixture value from the values of the fixture's dependencies.
 * Must not return null.
 */
@FunctionalInterface
public interface FixtureConstructor {
	Object construct(FixtureArguments arguments) throws Exception;
}

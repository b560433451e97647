package works.tessera;

/**
 * The code of a test case.
 * Any {@link Throwable} it throws counts as a failure of the case.
 */
@FunctionalInterface
public interface TestBody {
	void run(FixtureArguments arguments) throws Throwable;
}

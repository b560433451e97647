package works.tessera.exceptions;

import works.tessera.FixtureKey;
import works.tessera.Scope;

/**
 * A fixture depends on a shared fixture whose values don't live as long as its own.
 */
public class ScopeMismatchException extends InvalidRegistryException {
	public ScopeMismatchException(FixtureKey key, Scope scope, FixtureKey dependency, Scope dependencyScope) {
		super("Fixture " + key + " with scope " + scope
			+ " can't depend on " + dependency + " with scope " + dependencyScope);
	}
}

package works.tessera.exceptions;

public class DuplicateFixtureException extends InvalidRegistryException {
	public DuplicateFixtureException(String message) {
		super(message);
	}
}

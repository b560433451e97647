package works.tessera.exceptions;

/**
 * An annotated fixture or case method can't be turned into a definition.
 */
public class InvalidDeclarationException extends InvalidRegistryException {
	public InvalidDeclarationException(String message) {
		super(message);
	}

	public InvalidDeclarationException(String message, Throwable cause) {
		super(message, cause);
	}
}

package works.tessera.exceptions;

/**
 * A structural problem with the registered fixtures or test definitions,
 * detected during collection before any fixture is constructed.
 * No case of the run can be trusted when one of these occurs.
 */
public class InvalidRegistryException extends Exception {
	public InvalidRegistryException(String message) {
		super(message);
	}

	public InvalidRegistryException(String message, Throwable cause) {
		super(message, cause);
	}
}

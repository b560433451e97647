package works.tessera;

import org.jetbrains.annotations.Nullable;

/**
 * The result of running user code through a {@link FailureCapture}.
 * Exactly one of {@code value} and {@code failure} is meaningful;
 * {@code value} may be null even on success.
 */
public record Captured<T>(
	@Nullable T value,
	@Nullable Throwable failure
) {
	public static <T> Captured<T> success(@Nullable T value) {
		return new Captured<>(value, null);
	}

	public static <T> Captured<T> failure(Throwable failure) {
		return new Captured<>(null, failure);
	}

	public boolean isFailure() {
		return failure != null;
	}

	/**
	 * @return a one-line description of the failure, or null on success
	 */
	public @Nullable String message() {
		if (failure == null) {
			return null;
		}
		String message = failure.getMessage();
		return message == null ? failure.getClass().getName() : failure.getClass().getSimpleName() + ": " + message;
	}
}

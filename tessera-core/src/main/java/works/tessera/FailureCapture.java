package works.tessera;

/**
 * Runs user code (a case body, a fixture constructor, or a teardown)
 * and converts abnormal termination into a {@link Captured} failure
 * instead of letting it unwind into the engine.
 *
 * @see #catching()
 */
public interface FailureCapture {
	<T> Captured<T> capture(Invocation<T> invocation);

	default Captured<Void> run(Action action) {
		return capture(() -> {
			action.run();
			return null;
		});
	}

	/**
	 * Captures every {@link Throwable} except {@link VirtualMachineError},
	 * from which nothing in the run could meaningfully recover.
	 */
	static FailureCapture catching() {
		return CatchingFailureCapture.INSTANCE;
	}

	@FunctionalInterface
	interface Invocation<T> {
		T invoke() throws Throwable;
	}

	@FunctionalInterface
	interface Action {
		void run() throws Throwable;
	}
}

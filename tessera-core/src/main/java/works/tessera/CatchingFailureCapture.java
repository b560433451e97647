package works.tessera;

final class CatchingFailureCapture implements FailureCapture {
	static final CatchingFailureCapture INSTANCE = new CatchingFailureCapture();

	private CatchingFailureCapture() { }

	@Override
	public <T> Captured<T> capture(Invocation<T> invocation) {
		try {
			return Captured.success(invocation.invoke());
		} catch (VirtualMachineError e) {
			throw e;
		} catch (Throwable e) {
			return Captured.failure(e);
		}
	}

	@Override
	public String toString() {
		return "CatchingFailureCapture";
	}
}

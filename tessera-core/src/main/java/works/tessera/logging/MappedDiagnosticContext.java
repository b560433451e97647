package works.tessera.logging;

import org.slf4j.MDC;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	/**
	 * Sets {@link MdcKeys#CASE} for the current thread until the returned scope is closed,
	 * at which point the previous value, if any, is restored.
	 */
	public static MDCScope setupMDC(String caseName) {
		MDCScope result = new MDCScope(MdcKeys.CASE, MDC.get(MdcKeys.CASE));
		MDC.put(MdcKeys.CASE, caseName);
		return result;
	}

	/**
	 * This is like {@link MDC.MDCCloseable} except instead of removing the key on close,
	 * it restores whatever value the key had when the scope was opened.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String key;
		private final String oldValue;

		MDCScope(String key, String oldValue) {
			this.key = key;
			this.oldValue = oldValue;
		}

		@Override
		public void close() {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}
}

package works.tessera.logging;

/**
 * Keys under which tessera places values in the SLF4J {@link org.slf4j.MDC}.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * The name of the case being executed on the current thread.
	 */
	public static final String CASE = "tessera.case";
}

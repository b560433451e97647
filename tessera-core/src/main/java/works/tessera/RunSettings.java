package works.tessera;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RunSettings {
	/**
	 * How many cases may execute at once.
	 * Within one case, resolution and the body always run sequentially.
	 */
	@Default int threads = Runtime.getRuntime().availableProcessors();

	/**
	 * A case is selected if its name matches any of these, or if there are none.
	 *
	 * @see #exact
	 */
	@Default List<String> filters = List.of();

	/**
	 * If true, {@link #filters} and {@link #skip} must equal the case name;
	 * otherwise they need only be contained in it.
	 */
	@Default boolean exact = false;

	/**
	 * A case whose name matches any of these is not selected, even if it matches a filter.
	 */
	@Default List<String> skip = List.of();

	@Default IgnoredMode ignoredMode = IgnoredMode.EXCLUDE;

	/**
	 * Collect and report the case list without executing anything.
	 */
	@Default boolean listOnly = false;

	public static RunSettings defaults() {
		return RunSettings.builder().build();
	}

	public enum IgnoredMode {
		/**
		 * Ignored cases are reported as {@link Outcome#SKIPPED SKIPPED}.
		 */
		EXCLUDE,

		/**
		 * Ignored cases run like any other.
		 */
		INCLUDE,

		/**
		 * Only ignored cases are selected, and they run.
		 */
		ONLY,
	}
}

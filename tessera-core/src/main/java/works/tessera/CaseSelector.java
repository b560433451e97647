package works.tessera;

import java.util.List;
import works.tessera.RunSettings.IgnoredMode;

/**
 * Applies the selection rules of {@link RunSettings} to collected cases.
 */
final class CaseSelector {
	private final RunSettings settings;

	CaseSelector(RunSettings settings) {
		this.settings = settings;
	}

	List<TestCase> select(List<TestCase> cases) {
		return cases.stream().filter(this::isSelected).toList();
	}

	boolean isSelected(TestCase testCase) {
		if (settings.getIgnoredMode() == IgnoredMode.ONLY && !testCase.isIgnored()) {
			return false;
		}
		String name = testCase.name();
		if (settings.getSkip().stream().anyMatch(pattern -> matches(name, pattern))) {
			return false;
		}
		return settings.getFilters().isEmpty()
			|| settings.getFilters().stream().anyMatch(pattern -> matches(name, pattern));
	}

	/**
	 * @return true if the case is reported as skipped without being executed
	 */
	boolean isSkipped(TestCase testCase) {
		return testCase.isIgnored() && settings.getIgnoredMode() == IgnoredMode.EXCLUDE;
	}

	private boolean matches(String name, String pattern) {
		return settings.isExact() ? name.equals(pattern) : name.contains(pattern);
	}
}

package works.tessera;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.exceptions.InvalidDeclarationException;

import static java.util.stream.Collectors.joining;

/**
 * Turns each {@link TestDefinition} into one {@link TestCase} per combination
 * of the parameter values of the parametrized fixtures it depends on, directly or indirectly.
 * <p>
 * Combinations are emitted in lexicographic order of the domains as declared:
 * the first parametrized fixture in dependency order varies slowest.
 * A definition with no parametrized fixtures yields exactly one case, named after the definition.
 */
public final class CaseExpander {
	private CaseExpander() { }

	/**
	 * Evaluates ignore conditions with {@link FailureCapture#catching()}.
	 *
	 * @throws InvalidDeclarationException if some definition's ignore condition fails
	 */
	public static List<TestCase> expand(DependencyGraph graph) throws InvalidDeclarationException {
		return expand(graph, FailureCapture.catching());
	}

	/**
	 * @param capture runs each definition's ignore condition, once
	 * @throws InvalidDeclarationException if some definition's ignore condition fails
	 */
	public static List<TestCase> expand(DependencyGraph graph, FailureCapture capture) throws InvalidDeclarationException {
		List<TestCase> result = new ArrayList<>();
		Map<String, Integer> nameCounts = new HashMap<>();
		for (TestDefinition definition: graph.definitions()) {
			Captured<Boolean> ignored = capture.capture(definition::isIgnored);
			if (ignored.isFailure()) {
				throw new InvalidDeclarationException("Unable to evaluate ignore condition of test "
					+ definition.name() + ": " + ignored.message(), ignored.failure());
			}
			List<FixtureKey> parametrized = graph.parametrizedIn(definition);
			List<Map<FixtureKey, Object>> combinations = bindingCombinations(parametrized,
				k -> graph.spec(k).parameterDomain().orElseThrow());
			for (Map<FixtureKey, Object> bindings: combinations) {
				String name = uniqueName(caseName(definition.name(), bindings), nameCounts);
				result.add(new TestCase(name, result.size(), definition, bindings, ignored.value()));
			}
			LOGGER.debug("Expanded {} into {} case(s) over {}", definition.name(), combinations.size(), parametrized);
		}
		return List.copyOf(result);
	}

	/**
	 * @return {@code base} followed by the bindings in brackets, like {@code test_x[p=1,q=hello]}
	 */
	static String caseName(String base, Map<FixtureKey, Object> bindings) {
		if (bindings.isEmpty()) {
			return base;
		}
		return bindings.entrySet().stream()
			.map(e -> e.getKey() + "=" + describe(e.getValue()))
			.collect(joining(",", base + "[", "]"));
	}

	static String describe(Object value) {
		if (value.getClass().isArray()) {
			String wrapped = Arrays.deepToString(new Object[]{ value });
			return wrapped.substring(1, wrapped.length() - 1);
		}
		return String.valueOf(value);
	}

	/**
	 * Parameter values whose descriptions coincide would otherwise produce
	 * indistinguishable cases, so later ones get a numeric suffix.
	 */
	private static String uniqueName(String name, Map<String, Integer> nameCounts) {
		int count = nameCounts.merge(name, 1, Integer::sum);
		if (count == 1) {
			return name;
		}
		String candidate = name + "#" + count;
		while (nameCounts.containsKey(candidate)) {
			candidate = name + "#" + (++count);
		}
		nameCounts.put(candidate, 1);
		return candidate;
	}

	/**
	 * Every way of binding each key to one value from its domain,
	 * with the first key varying slowest.
	 */
	static List<Map<FixtureKey, Object>> bindingCombinations(List<FixtureKey> keys, Function<FixtureKey, List<Object>> domainOf) {
		List<Map<FixtureKey, Object>> result = List.of(Map.of());
		for (FixtureKey key: keys) {
			List<Object> domain = domainOf.apply(key);
			List<Map<FixtureKey, Object>> extended = new ArrayList<>(result.size() * domain.size());
			for (Map<FixtureKey, Object> partial: result) {
				for (Object value: domain) {
					Map<FixtureKey, Object> bindings = new LinkedHashMap<>(partial);
					bindings.put(key, value);
					extended.add(bindings);
				}
			}
			result = extended;
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CaseExpander.class);
}

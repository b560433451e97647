package works.tessera;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixtures, templates, and test definitions found by a {@link FixtureScanner}.
 */
public record Declarations(
	List<FixtureSpec> fixtures,
	List<FixtureTemplate> templates,
	List<TestDefinition> definitions
) {
	public Declarations {
		fixtures = List.copyOf(fixtures);
		templates = List.copyOf(templates);
		definitions = List.copyOf(definitions);
	}

	public static Declarations empty() {
		return EMPTY;
	}

	public Declarations plus(Declarations other) {
		return new Declarations(
			concat(fixtures, other.fixtures),
			concat(templates, other.templates),
			concat(definitions, other.definitions));
	}

	public FixtureRegistry.Builder registerIn(FixtureRegistry.Builder builder) {
		builder.registerAll(fixtures);
		templates.forEach(builder::registerTemplate);
		return builder;
	}

	public FixtureRegistry registry() {
		return registerIn(FixtureRegistry.builder()).build();
	}

	private static <T> List<T> concat(List<T> first, List<T> second) {
		List<T> result = new ArrayList<>(first);
		result.addAll(second);
		return result;
	}

	private static final Declarations EMPTY = new Declarations(List.of(), List.of(), List.of());
}

package works.tessera;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each {@link FixtureKey} to its {@link FixtureSpec} for the lifetime of the process.
 * <p>
 * Registration never fails: duplicate keys are remembered and reported
 * by the {@link DependencyGraphBuilder} at collection time, like every other structural problem.
 * <p>
 * Keys naming an instantiation of a {@link FixtureTemplate} are materialized on first lookup,
 * and the materialized spec is reused for every later lookup of the same key.
 */
public final class FixtureRegistry {
	private final Map<FixtureKey, FixtureSpec> specs;
	private final Map<FixtureKey, FixtureTemplate> templates;
	private final List<String> duplicates;
	private final List<FixtureKey> keysInOrder;
	private final ConcurrentHashMap<FixtureKey, FixtureSpec> instantiations = new ConcurrentHashMap<>();

	private FixtureRegistry(Builder builder) {
		this.specs = Map.copyOf(builder.specs);
		this.templates = Map.copyOf(builder.templates);
		List<String> problems = new ArrayList<>(builder.duplicates);
		for (FixtureKey key: templates.keySet()) {
			if (specs.containsKey(key)) {
				problems.add("Template " + key + " has the same name as a fixture");
			}
		}
		this.duplicates = List.copyOf(problems);
		this.keysInOrder = List.copyOf(builder.specs.keySet());
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<FixtureSpec> lookup(FixtureKey key) {
		FixtureSpec spec = specs.get(key);
		if (spec != null) {
			return Optional.of(spec);
		}
		return template(key).map(t -> {
			FixtureSpec existing = instantiations.get(key);
			if (existing != null) {
				return existing;
			}
			// Not computeIfAbsent: instantiating may look up the type arguments, which may themselves be instantiations
			FixtureSpec instantiated = t.instantiate(key, this::valueTypeOf);
			FixtureSpec prior = instantiations.putIfAbsent(key, instantiated);
			if (prior == null) {
				LOGGER.debug("Instantiated template {} as {}", t, key);
				return instantiated;
			} else {
				return prior;
			}
		});
	}

	/**
	 * Unknown keys are reported by the {@link DependencyGraphBuilder}, so here they just provide {@link Object}.
	 */
	private Class<?> valueTypeOf(FixtureKey key) {
		return lookup(key).<Class<?>>map(FixtureSpec::valueType).orElse(Object.class);
	}

	/**
	 * For use after collection has validated the registry.
	 *
	 * @throws IllegalStateException if there's no such fixture
	 */
	public FixtureSpec require(FixtureKey key) {
		return lookup(key).orElseThrow(() -> new IllegalStateException("No such fixture: " + key));
	}

	/**
	 * @return the template that {@code key} instantiates, if {@code key} is an instantiation
	 * with the right number of type arguments.
	 */
	public Optional<FixtureTemplate> template(FixtureKey key) {
		if (!key.isInstantiation()) {
			return Optional.empty();
		}
		FixtureTemplate template = templates.get(key.baseKey());
		if (template == null || template.arity() != key.typeArguments().size()) {
			return Optional.empty();
		}
		return Optional.of(template);
	}

	/**
	 * @return the template with the given base key regardless of arity
	 */
	Optional<FixtureTemplate> templateNamed(FixtureKey baseKey) {
		return Optional.ofNullable(templates.get(baseKey));
	}

	/**
	 * @return the keys of the concrete specs, in registration order
	 */
	public List<FixtureKey> keys() {
		return keysInOrder;
	}

	List<String> duplicates() {
		return duplicates;
	}

	@Override
	public String toString() {
		return "FixtureRegistry(" + specs.size() + " fixtures, " + templates.size() + " templates)";
	}

	public static class Builder {
		private final Map<FixtureKey, FixtureSpec> specs = new LinkedHashMap<>();
		private final Map<FixtureKey, FixtureTemplate> templates = new LinkedHashMap<>();
		private final List<String> duplicates = new ArrayList<>();

		Builder() { }

		public Builder register(FixtureSpec spec) {
			if (spec.key().isInstantiation()) {
				// Explicit specializations are allowed, and take precedence over the template
				LOGGER.debug("Registering explicit instantiation {}", spec.key());
			}
			FixtureSpec old = specs.putIfAbsent(spec.key(), spec);
			if (old != null) {
				duplicates.add("Fixture " + spec.key() + " is registered more than once");
			}
			return this;
		}

		public Builder registerAll(Collection<FixtureSpec> specs) {
			specs.forEach(this::register);
			return this;
		}

		public Builder registerTemplate(FixtureTemplate template) {
			FixtureTemplate old = templates.putIfAbsent(template.baseKey(), template);
			if (old != null) {
				duplicates.add("Template " + template.baseKey() + " is registered more than once");
			}
			return this;
		}

		public FixtureRegistry build() {
			return new FixtureRegistry(this);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FixtureRegistry.class);
}

package works.tessera;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The static definition of a fixture: how to build it, what it needs, and how long it lives.
 * <p>
 * A fixture with a {@link #parameterDomain() parameter domain} is <em>parametrized</em>:
 * every case that depends on it, directly or indirectly, is expanded into
 * one case per domain value, and the constructor sees the value for its case
 * through {@link FixtureArguments#param()}.
 */
public final class FixtureSpec {
	private final FixtureKey key;
	private final Scope scope;
	private final List<FixtureKey> dependencies;
	private final List<Class<?>> dependencyBounds; // null where unbounded
	private final Class<?> valueType;
	private final FixtureConstructor constructor;
	private final @Nullable Teardown teardown;
	private final @Nullable List<Object> parameterDomain;

	private FixtureSpec(Builder builder) {
		this.key = builder.key;
		this.scope = builder.scope;
		this.dependencies = List.copyOf(builder.dependencies);
		this.dependencyBounds = Collections.unmodifiableList(new ArrayList<>(builder.dependencyBounds));
		this.valueType = builder.valueType;
		this.constructor = requireNonNull(builder.constructor, "constructor");
		this.teardown = builder.teardown;
		this.parameterDomain = builder.parameterDomain == null ? null : List.copyOf(builder.parameterDomain);
	}

	public static Builder builder(String name) {
		return new Builder(FixtureKey.of(name));
	}

	public static Builder builder(FixtureKey key) {
		return new Builder(key);
	}

	public FixtureKey key() {
		return key;
	}

	public Scope scope() {
		return scope;
	}

	/**
	 * In declared order. The same key may appear more than once,
	 * in which case it is resolved once per position.
	 */
	public List<FixtureKey> dependencies() {
		return dependencies;
	}

	/**
	 * The capability the dependency at {@code index} is required to provide, if any.
	 * Checked during collection against the dependency's {@link #valueType()}.
	 */
	public Optional<Class<?>> boundAt(int index) {
		return Optional.ofNullable(dependencyBounds.get(index));
	}

	/**
	 * @return the bound of the first position at which {@code dependency} is declared with one
	 */
	public Optional<Class<?>> boundFor(FixtureKey dependency) {
		for (int i = 0; i < dependencies.size(); i++) {
			if (dependencies.get(i).equals(dependency) && dependencyBounds.get(i) != null) {
				return Optional.of(dependencyBounds.get(i));
			}
		}
		return Optional.empty();
	}

	/**
	 * The type of value the constructor promises to return.
	 */
	public Class<?> valueType() {
		return valueType;
	}

	public FixtureConstructor constructor() {
		return constructor;
	}

	public Optional<Teardown> teardown() {
		return Optional.ofNullable(teardown);
	}

	public Optional<List<Object>> parameterDomain() {
		return Optional.ofNullable(parameterDomain);
	}

	public boolean isParametrized() {
		return parameterDomain != null;
	}

	@Override
	public String toString() {
		return "FixtureSpec(" + key + ", " + scope + ", dependencies=" + dependencies + ")";
	}

	public static class Builder {
		private final FixtureKey key;
		private Scope scope = Scope.FRESH;
		private final List<FixtureKey> dependencies = new ArrayList<>();
		private final List<Class<?>> dependencyBounds = new ArrayList<>();
		private Class<?> valueType = Object.class;
		private FixtureConstructor constructor;
		private Teardown teardown;
		private List<Object> parameterDomain;

		Builder(FixtureKey key) {
			this.key = requireNonNull(key);
		}

		public Builder scope(Scope scope) {
			this.scope = requireNonNull(scope);
			return this;
		}

		public Builder dependsOn(String... names) {
			for (String name: names) {
				dependsOn(FixtureKey.of(name));
			}
			return this;
		}

		public Builder dependsOn(FixtureKey dependency) {
			dependencies.add(requireNonNull(dependency));
			dependencyBounds.add(null);
			return this;
		}

		/**
		 * Declares a dependency that must provide values of type {@code bound}.
		 */
		public Builder dependsOn(FixtureKey dependency, Class<?> bound) {
			requireNonNull(bound);
			dependencies.add(requireNonNull(dependency));
			dependencyBounds.add(bound);
			return this;
		}

		public Builder provides(Class<?> valueType) {
			this.valueType = requireNonNull(valueType);
			return this;
		}

		public Builder constructor(FixtureConstructor constructor) {
			this.constructor = requireNonNull(constructor);
			return this;
		}

		public Builder teardown(Teardown teardown) {
			this.teardown = requireNonNull(teardown);
			return this;
		}

		public Builder parameters(Collection<?> domain) {
			if (domain.isEmpty()) {
				throw new IllegalArgumentException("Parameter domain of " + key + " can't be empty");
			}
			this.parameterDomain = List.copyOf(domain);
			return this;
		}

		public Builder parameters(Object... domain) {
			return parameters(List.of(domain));
		}

		public FixtureSpec build() {
			return new FixtureSpec(this);
		}

		@Override
		public String toString() {
			return "FixtureSpec.Builder(key=" + key + ", scope=" + scope + ", dependencies=" + dependencies + ")";
		}
	}
}

package works.tessera;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A generic fixture, polymorphic over other fixtures that provide some capability.
 * <p>
 * The template is never used directly. A key such as {@code Double<Base1>}
 * names an instantiation of the template {@code Double} over the fixture {@code Base1};
 * the {@link FixtureRegistry} materializes one {@link FixtureSpec} per distinct instantiation.
 * In the materialized spec, the type arguments come first among the dependencies,
 * in order, followed by the template's own dependencies.
 * <p>
 * Each type parameter has a bound: the class that the corresponding type argument's
 * {@link FixtureSpec#valueType() value type} must be assignable to.
 * <p>
 * A template whose value is one of its type arguments, or derived from it,
 * can declare that with {@link Builder#providesTypeArgument}, and each instantiation
 * then provides whatever that argument provides.
 */
public final class FixtureTemplate {
	private final FixtureKey baseKey;
	private final List<Class<?>> typeParameterBounds;
	private final Scope scope;
	private final List<FixtureKey> dependencies;
	private final Class<?> valueType;
	private final int valueTypeArgument;
	private final FixtureConstructor constructor;
	private final @Nullable Teardown teardown;
	private final @Nullable List<Object> parameterDomain;

	private FixtureTemplate(Builder builder) {
		this.baseKey = builder.baseKey;
		this.typeParameterBounds = List.copyOf(builder.typeParameterBounds);
		this.scope = builder.scope;
		this.dependencies = List.copyOf(builder.dependencies);
		this.valueType = builder.valueType;
		this.valueTypeArgument = builder.valueTypeArgument;
		this.constructor = requireNonNull(builder.constructor, "constructor");
		this.teardown = builder.teardown;
		this.parameterDomain = builder.parameterDomain;
		if (typeParameterBounds.isEmpty()) {
			throw new IllegalArgumentException("Template " + baseKey + " must have at least one type parameter");
		}
		if (valueTypeArgument >= typeParameterBounds.size()) {
			throw new IllegalArgumentException("Template " + baseKey + " has no type parameter #" + valueTypeArgument);
		}
	}

	public static Builder builder(String name) {
		return new Builder(FixtureKey.of(name));
	}

	public FixtureKey baseKey() {
		return baseKey;
	}

	public List<Class<?>> typeParameterBounds() {
		return typeParameterBounds;
	}

	public int arity() {
		return typeParameterBounds.size();
	}

	/**
	 * Does not check the bounds; that is the job of the {@link DependencyGraphBuilder}.
	 *
	 * @throws IllegalArgumentException if {@code key} isn't an instantiation of this template
	 * with the right number of type arguments.
	 * @param valueTypeOf the value type provided by a given type argument
	 */
	FixtureSpec instantiate(FixtureKey key, Function<FixtureKey, Class<?>> valueTypeOf) {
		if (!key.baseKey().equals(baseKey) || key.typeArguments().size() != arity()) {
			throw new IllegalArgumentException("Key " + key + " is not an instantiation of template " + this);
		}
		FixtureSpec.Builder builder = FixtureSpec.builder(key)
			.scope(scope)
			.provides(valueTypeArgument < 0 ? valueType : valueTypeOf.apply(key.typeArguments().get(valueTypeArgument)))
			.constructor(constructor);
		for (int i = 0; i < arity(); i++) {
			builder.dependsOn(key.typeArguments().get(i), typeParameterBounds.get(i));
		}
		dependencies.forEach(builder::dependsOn);
		if (teardown != null) {
			builder.teardown(teardown);
		}
		if (parameterDomain != null) {
			builder.parameters(parameterDomain);
		}
		return builder.build();
	}

	@Override
	public String toString() {
		return baseKey + typeParameterBounds.stream()
			.map(Class::getSimpleName)
			.toList()
			.toString()
			.replace('[', '<')
			.replace(']', '>');
	}

	public static class Builder {
		private final FixtureKey baseKey;
		private final List<Class<?>> typeParameterBounds = new ArrayList<>();
		private Scope scope = Scope.FRESH;
		private final List<FixtureKey> dependencies = new ArrayList<>();
		private Class<?> valueType = Object.class;
		private int valueTypeArgument = -1;
		private FixtureConstructor constructor;
		private Teardown teardown;
		private List<Object> parameterDomain;

		Builder(FixtureKey baseKey) {
			this.baseKey = baseKey;
		}

		/**
		 * Adds a type parameter whose arguments must provide values of type {@code bound}.
		 */
		public Builder typeParameter(Class<?> bound) {
			typeParameterBounds.add(requireNonNull(bound));
			return this;
		}

		public Builder scope(Scope scope) {
			this.scope = requireNonNull(scope);
			return this;
		}

		public Builder dependsOn(FixtureKey dependency) {
			dependencies.add(requireNonNull(dependency));
			return this;
		}

		public Builder provides(Class<?> valueType) {
			this.valueType = requireNonNull(valueType);
			this.valueTypeArgument = -1;
			return this;
		}

		/**
		 * Each instantiation provides the same value type as its type argument
		 * at {@code typeParameterIndex}.
		 */
		public Builder providesTypeArgument(int typeParameterIndex) {
			if (typeParameterIndex < 0) {
				throw new IllegalArgumentException("Negative type parameter index: " + typeParameterIndex);
			}
			this.valueTypeArgument = typeParameterIndex;
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
				throw new IllegalArgumentException("Parameter domain of " + baseKey + " can't be empty");
			}
			this.parameterDomain = List.copyOf(domain);
			return this;
		}

		public FixtureTemplate build() {
			return new FixtureTemplate(this);
		}
	}
}

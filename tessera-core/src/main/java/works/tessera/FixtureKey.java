package works.tessera;

import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

import static java.util.stream.Collectors.joining;

/**
 * The identity of a fixture definition.
 * <p>
 * A plain key is just a name. A key for an instantiation of a {@link FixtureTemplate generic fixture}
 * also carries the keys of the fixtures it was instantiated over,
 * so that {@code Double<Base1>} and {@code Double<Base2>} are distinct fixtures.
 */
public final class FixtureKey {
	@NotNull
	final String name;

	@NotNull
	final List<FixtureKey> typeArguments;

	private FixtureKey(@NotNull String name, @NotNull List<FixtureKey> typeArguments) {
		this.name = name;
		this.typeArguments = typeArguments;
	}

	public static FixtureKey of(String name) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Fixture name can't be empty");
		}
		for (char c: name.toCharArray()) {
			if (c == '<' || c == '>' || c == ',' || Character.isWhitespace(c)) {
				throw new IllegalArgumentException("Fixture name can't contain '" + c + "': \"" + name + "\"");
			}
		}
		return new FixtureKey(name, List.of());
	}

	public FixtureKey instantiatedWith(FixtureKey... typeArguments) {
		return instantiatedWith(List.of(typeArguments));
	}

	public FixtureKey instantiatedWith(List<FixtureKey> typeArguments) {
		if (isInstantiation()) {
			throw new IllegalStateException("Fixture key is already instantiated: " + this);
		}
		if (typeArguments.isEmpty()) {
			return this;
		}
		return new FixtureKey(name, List.copyOf(typeArguments));
	}

	public String name() {
		return name;
	}

	public List<FixtureKey> typeArguments() {
		return typeArguments;
	}

	public boolean isInstantiation() {
		return !typeArguments.isEmpty();
	}

	/**
	 * @return the key of the template this key instantiates, or this key itself if it's not an instantiation
	 */
	public FixtureKey baseKey() {
		return isInstantiation() ? new FixtureKey(name, List.of()) : this;
	}

	@Override
	public String toString() {
		if (typeArguments.isEmpty()) {
			return name;
		}
		return typeArguments.stream()
			.map(FixtureKey::toString)
			.collect(joining(",", name + "<", ">"));
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		FixtureKey that = (FixtureKey) o;
		return name.equals(that.name) && typeArguments.equals(that.typeArguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, typeArguments);
	}
}

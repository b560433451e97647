package works.tessera.exceptions;

import java.util.List;
import works.tessera.FixtureKey;

import static java.util.stream.Collectors.joining;

public class CyclicDependencyException extends InvalidRegistryException {
	private final List<FixtureKey> cycle;

	/**
	 * @param cycle the fixtures forming the cycle, starting and ending with the same key
	 */
	public CyclicDependencyException(List<FixtureKey> cycle) {
		super("Cyclic fixture dependency: " + cycle.stream().map(FixtureKey::toString).collect(joining(" -> ")));
		this.cycle = List.copyOf(cycle);
	}

	public List<FixtureKey> cycle() {
		return cycle;
	}
}

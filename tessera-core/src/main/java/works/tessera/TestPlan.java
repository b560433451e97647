package works.tessera;

import java.util.List;

/**
 * The immutable result of the collection phase.
 * Nothing in it has constructed a fixture value.
 */
public record TestPlan(
	DependencyGraph graph,
	List<TestCase> cases
) {
	public TestPlan {
		cases = List.copyOf(cases);
	}

	public List<CaseListing> listing() {
		return cases.stream().map(CaseListing::of).toList();
	}
}

package works.tessera;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A declared test, before expansion into {@link TestCase}s.
 * <p>
 * The body receives the values of the {@link #parameters() parameters} bound by key.
 */
public final class TestDefinition {
	private final String name;
	private final List<FixtureKey> parameters;
	private final TestBody body;
	private final boolean expectFailure;
	private final @Nullable BooleanSupplier ignoreCondition;
	private final @Nullable String ignoreReason;

	private TestDefinition(Builder builder) {
		this.name = builder.name;
		this.parameters = List.copyOf(builder.parameters);
		this.body = requireNonNull(builder.body, "body");
		this.expectFailure = builder.expectFailure;
		this.ignoreCondition = builder.ignoreCondition;
		this.ignoreReason = builder.ignoreReason;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String name() {
		return name;
	}

	public List<FixtureKey> parameters() {
		return parameters;
	}

	public TestBody body() {
		return body;
	}

	public boolean expectFailure() {
		return expectFailure;
	}

	/**
	 * Evaluates the ignore condition, if any.
	 * Called once per definition during collection.
	 */
	public boolean isIgnored() {
		return ignoreCondition != null && ignoreCondition.getAsBoolean();
	}

	public Optional<String> ignoreReason() {
		return Optional.ofNullable(ignoreReason);
	}

	@Override
	public String toString() {
		return "TestDefinition(" + name + ", parameters=" + parameters + ")";
	}

	public static class Builder {
		private final String name;
		private final List<FixtureKey> parameters = new ArrayList<>();
		private TestBody body;
		private boolean expectFailure = false;
		private BooleanSupplier ignoreCondition;
		private String ignoreReason;

		Builder(String name) {
			if (name.isEmpty()) {
				throw new IllegalArgumentException("Test name can't be empty");
			}
			this.name = name;
		}

		public Builder uses(String... names) {
			for (String n: names) {
				uses(FixtureKey.of(n));
			}
			return this;
		}

		public Builder uses(FixtureKey key) {
			if (parameters.contains(key)) {
				throw new IllegalArgumentException("Test " + name + " already uses " + key);
			}
			parameters.add(requireNonNull(key));
			return this;
		}

		public Builder body(TestBody body) {
			this.body = requireNonNull(body);
			return this;
		}

		public Builder expectFailure() {
			return expectFailure(true);
		}

		public Builder expectFailure(boolean expectFailure) {
			this.expectFailure = expectFailure;
			return this;
		}

		public Builder ignored() {
			return ignoredIf(() -> true, null);
		}

		public Builder ignored(String reason) {
			return ignoredIf(() -> true, reason);
		}

		/**
		 * @param condition evaluated once during collection; must be free of side effects
		 */
		public Builder ignoredIf(BooleanSupplier condition, @Nullable String reason) {
			this.ignoreCondition = requireNonNull(condition);
			this.ignoreReason = reason;
			return this;
		}

		public TestDefinition build() {
			return new TestDefinition(this);
		}
	}
}

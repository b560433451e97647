package works.tessera;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The values owned by one scope lifetime, most recently constructed first.
 * <p>
 * A value is pushed only after all the values it was constructed from have been pushed,
 * so unwinding in stack order never tears down a value while something built from it is still live.
 */
final class TeardownStack {
	private final String owner;
	private final Deque<FixtureInstance> instances = new ArrayDeque<>();

	TeardownStack(String owner) {
		this.owner = owner;
	}

	synchronized void push(FixtureInstance instance) {
		instances.push(instance);
	}

	synchronized int size() {
		return instances.size();
	}

	/**
	 * Runs every pending teardown, most recent first, even if some of them fail.
	 * The stack is empty afterward.
	 *
	 * @return the failures, in the order they occurred
	 */
	List<TeardownFailure> unwind(FailureCapture capture) {
		List<FixtureInstance> pending;
		synchronized (this) {
			pending = new ArrayList<>(instances);
			instances.clear();
		}
		LOGGER.debug("Tearing down {} value(s) owned by {}", pending.size(), owner);
		List<TeardownFailure> failures = new ArrayList<>();
		for (FixtureInstance instance: pending) {
			Teardown teardown = instance.teardown();
			if (teardown == null) {
				continue;
			}
			LOGGER.debug("Tearing down {}", instance.key());
			Captured<Void> result = capture.run(() -> teardown.tearDown(instance.value()));
			if (result.isFailure()) {
				LOGGER.warn("Teardown of {} owned by {} failed; continuing with remaining teardowns", instance.key(), owner, result.failure());
				failures.add(new TeardownFailure(instance.key(), result.failure()));
			}
		}
		return failures;
	}

	@Override
	public String toString() {
		return "TeardownStack(" + owner + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TeardownStack.class);
}

package works.tessera;

import static java.util.Objects.requireNonNull;

/**
 * The collaborators a {@link TesseraEngine} uses, as opposed to the {@link RunSettings}
 * governing what one run does.
 */
public final class TesseraConfig {
	private final Reporter reporter;
	private final FailureCapture failureCapture;

	private TesseraConfig(Reporter reporter, FailureCapture failureCapture) {
		this.reporter = reporter;
		this.failureCapture = failureCapture;
	}

	public static TesseraConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Reporter reporter() {
		return reporter;
	}

	public FailureCapture failureCapture() {
		return failureCapture;
	}

	public static class Builder {
		private Reporter reporter;
		private FailureCapture failureCapture;

		Builder() {
			reporter = LoggingReporter.INSTANCE;
			failureCapture = FailureCapture.catching();
		}

		public Builder reporter(Reporter reporter) {
			this.reporter = requireNonNull(reporter);
			return this;
		}

		public Builder failureCapture(FailureCapture failureCapture) {
			this.failureCapture = requireNonNull(failureCapture);
			return this;
		}

		public TesseraConfig build() {
			return new TesseraConfig(this.reporter, this.failureCapture);
		}

		@Override
		public String toString() {
			return "TesseraConfig.Builder(reporter=" + this.reporter + ", failureCapture=" + this.failureCapture + ")";
		}
	}

	private static final TesseraConfig SIMPLE_CONFIG = new TesseraConfig(LoggingReporter.INSTANCE, FailureCapture.catching());
}

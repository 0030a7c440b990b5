package org.akton.arn.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.akton.arn.ArnError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ArnErrorReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * logged and the remaining reporters still run.
 *
 * <pre>{@code
 * ArnErrorReporter reporter = CompositeArnErrorReporter.builder()
 *     .add(new Log4jArnErrorReporter())
 *     .addIf(metricsEnabled, new MetricsArnErrorReporter("billing"))
 *     .build();
 * }</pre>
 */
public final class CompositeArnErrorReporter implements ArnErrorReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeArnErrorReporter.class);

	private final List<ArnErrorReporter> reporters;

	private CompositeArnErrorReporter(List<ArnErrorReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeArnErrorReporter of(ArnErrorReporter... reporters) {
		return new CompositeArnErrorReporter(Arrays.asList(reporters));
	}

	public static CompositeArnErrorReporter of(Collection<? extends ArnErrorReporter> reporters) {
		return new CompositeArnErrorReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(String operation, ArnError error) {
		for (ArnErrorReporter reporter : reporters) {
			try {
				reporter.report(operation, error);
			} catch (RuntimeException e) {
				LOG.warn("ArnErrorReporter {} failed while reporting {} from {}",
						reporter.getClass().getName(), error.code(), operation, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Builder for creating a {@link CompositeArnErrorReporter}.
	 */
	public static final class Builder {
		private final List<ArnErrorReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(ArnErrorReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends ArnErrorReporter> reporters) {
			for (ArnErrorReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, ArnErrorReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeArnErrorReporter build() {
			return new CompositeArnErrorReporter(reporters);
		}
	}
}

package org.akton.arn.ops;

import org.akton.arn.ArnError;

/**
 * Reports rejected ARN operations for observability.
 * Implementations might write structured logs or metrics events.
 *
 * <p>Reporters observe errors; they never change what the codec returns.</p>
 */
@FunctionalInterface
public interface ArnErrorReporter {

    /**
     * Reports an error returned by a codec operation.
     *
     * @param operation the operation that produced the error, e.g. {@code ArnCodec.parse}
     * @param error the error returned to the caller
     */
    void report(String operation, ArnError error);

    /**
     * A reporter that does nothing.
     */
    static ArnErrorReporter noOp() {
        return (operation, error) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static ArnErrorReporter composite(ArnErrorReporter... reporters) {
        return CompositeArnErrorReporter.of(reporters);
    }
}

package org.akton.arn.boundary;

import java.util.Objects;
import org.akton.arn.ArnError;
import org.akton.arn.Cause;
import org.akton.arn.Outcome;
import org.akton.arn.ops.ArnErrorReporter;

/**
 * The single point where a checked exception from a non-deterministic source is
 * translated into the Outcome world.
 *
 * <p>Identifier generation is the only part of the codec that can fail for reasons
 * unrelated to its input. Checked exceptions thrown by the wrapped work become
 * {@link ArnError.GenerationFailed}, are reported, and are returned as a failed
 * {@link Outcome}. RuntimeExceptions are defects and propagate unchanged.</p>
 *
 * <pre>{@code
 * GenerationBoundary boundary = GenerationBoundary.withReporter(reporter);
 * Outcome<UUID> payload = boundary.call("ArnCodec.create", generator::next);
 * }</pre>
 */
public final class GenerationBoundary {

    private final ArnErrorReporter reporter;

    /**
     * Creates a boundary that translates failures but does not report them.
     */
    public static GenerationBoundary silent() {
        return new GenerationBoundary(ArnErrorReporter.noOp());
    }

    public static GenerationBoundary withReporter(ArnErrorReporter reporter) {
        return new GenerationBoundary(reporter);
    }

    public GenerationBoundary(ArnErrorReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name for reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with {@link ArnError.GenerationFailed}
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            return handleException(operation, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Exception e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ArnError error = new ArnError.GenerationFailed(reason, Cause.fromThrowable(e));
        reporter.report(operation, error);
        return Outcome.fail(error);
    }
}

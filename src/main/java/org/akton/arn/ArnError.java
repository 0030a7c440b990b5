package org.akton.arn;

import java.util.Objects;

/**
 * The closed set of reasons an ARN operation can be rejected.
 *
 * <p>Errors are values: they are returned inside {@link Outcome.Fail} and carry the
 * offending input so callers can produce actionable diagnostics. None of them expose
 * state beyond the input that failed.</p>
 */
public sealed interface ArnError
        permits ArnError.MalformedArn, ArnError.InvalidSegment,
                ArnError.InvalidIdentifier, ArnError.GenerationFailed {

    /**
     * Stable, namespaced code for this kind of error.
     */
    ErrorCode code();

    /**
     * Human-readable description including the offending input.
     */
    String message();

    Severity severity();

    /**
     * The string did not split into exactly {@link Segment#COUNT} colon-delimited fields.
     *
     * @param input the rejected string
     * @param fieldCount how many fields the string actually split into
     */
    record MalformedArn(String input, int fieldCount) implements ArnError {

        public MalformedArn {
            Objects.requireNonNull(input, "input must not be null");
        }

        @Override
        public ErrorCode code() {
            return ErrorCode.MALFORMED;
        }

        @Override
        public String message() {
            return "expected " + Segment.COUNT + " colon-delimited fields but found "
                    + fieldCount + " in '" + input + "'";
        }

        @Override
        public Severity severity() {
            return Severity.INPUT;
        }
    }

    /**
     * A field violated its emptiness rule or character class.
     *
     * @param position the field index, 0 for the {@code arn} prefix and 1 for the partition
     * @param value the offending field, or null when it was not supplied
     * @param reason what was wrong with it
     */
    record InvalidSegment(int position, String value, String reason) implements ArnError {

        public InvalidSegment {
            Objects.requireNonNull(reason, "reason must not be null");
            Segment.at(position);
        }

        public Segment segment() {
            return Segment.at(position);
        }

        @Override
        public ErrorCode code() {
            return ErrorCode.INVALID_SEGMENT;
        }

        @Override
        public String message() {
            return "invalid " + segment().label() + " at position " + position
                    + " ('" + value + "'): " + reason;
        }

        @Override
        public Severity severity() {
            return Severity.INPUT;
        }
    }

    /**
     * The identifier field is not a well-formed {@code <tag>_<value>}.
     *
     * @param value the rejected identifier text, or null when it was not supplied
     * @param reason what was wrong with it
     */
    record InvalidIdentifier(String value, String reason) implements ArnError {

        public InvalidIdentifier {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public ErrorCode code() {
            return ErrorCode.INVALID_IDENTIFIER;
        }

        @Override
        public String message() {
            return "invalid resource id '" + value + "': " + reason;
        }

        @Override
        public Severity severity() {
            return Severity.INPUT;
        }
    }

    /**
     * A fresh identifier could not be generated.
     *
     * @param reason what the generator reported
     * @param cause the underlying exception, summarized
     */
    record GenerationFailed(String reason, Cause cause) implements ArnError {

        public GenerationFailed {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public ErrorCode code() {
            return ErrorCode.GENERATION_FAILED;
        }

        @Override
        public String message() {
            return "identifier generation failed: " + reason;
        }

        @Override
        public Severity severity() {
            return Severity.SYSTEM;
        }
    }
}

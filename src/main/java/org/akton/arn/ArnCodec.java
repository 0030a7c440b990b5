package org.akton.arn;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.akton.arn.boundary.GenerationBoundary;
import org.akton.arn.id.IdGenerator;
import org.akton.arn.id.RandomIdGenerator;
import org.akton.arn.id.TypeTag;
import org.akton.arn.id.TypedId;
import org.akton.arn.ops.ArnErrorReporter;

/**
 * Converts between {@link Arn} values and their canonical string form, and issues new ARNs.
 *
 * <p>Canonical form:</p>
 * <pre>{@code arn:<partition>:<service>:<category>:<type-tag>_<unique-value>}</pre>
 *
 * <p>The string always has exactly five colon-delimited fields. The category may be
 * empty ({@code arn:p:s::res_...}), but no field is ever omitted and delimiters are
 * never trimmed, so a stray leading or trailing colon is rejected as
 * {@link ArnError.MalformedArn} rather than repaired.</p>
 *
 * <p>Every operation returns an {@link Outcome}; rejected input is reported to the
 * configured {@link ArnErrorReporter} and returned, never thrown. A codec is immutable
 * and may be shared between threads.</p>
 *
 * <pre>{@code
 * ArnCodec codec = ArnCodec.builder()
 *     .defaultTag(TypeTag.USER)
 *     .reporter(new Log4jArnErrorReporter())
 *     .build();
 *
 * Arn issued = codec.create("prod", "billing", "acct1").getOrThrow();
 * Outcome<Arn> parsed = codec.parse(issued.toString());
 * }</pre>
 */
public final class ArnCodec {

    public static final String PREFIX = "arn";
    public static final char DELIMITER = ':';

    static final String DEFAULT_PARTITION = "akton";
    static final String DEFAULT_SERVICE = "system";
    static final String DEFAULT_CATEGORY = "default";

    private static final ArnCodec STANDARD = builder().build();

    private final IdGenerator idGenerator;
    private final TypeTag defaultTag;
    private final ArnErrorReporter reporter;
    private final GenerationBoundary boundary;

    private ArnCodec(Builder builder) {
        this.idGenerator = builder.idGenerator;
        this.defaultTag = builder.defaultTag;
        this.reporter = builder.reporter;
        this.boundary = GenerationBoundary.withReporter(builder.reporter);
    }

    /**
     * Returns the shared codec: secure random identifiers, tag {@code res}, no reporting.
     */
    public static ArnCodec standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TypeTag defaultTag() {
        return defaultTag;
    }

    /**
     * Renders the canonical string. Never fails for a constructed Arn.
     */
    public String format(Arn arn) {
        Objects.requireNonNull(arn, "arn must not be null");
        return render(arn);
    }

    static String render(Arn arn) {
        return PREFIX + DELIMITER
                + arn.partition() + DELIMITER
                + arn.service() + DELIMITER
                + arn.category() + DELIMITER
                + arn.resourceId();
    }

    /**
     * Parses a canonical ARN string.
     *
     * @param text the string to parse
     * @return Ok with the Arn, or Fail with {@link ArnError.MalformedArn} when the field count
     *         is wrong, {@link ArnError.InvalidSegment} for the first invalid field, or
     *         {@link ArnError.InvalidIdentifier} when the last field is not a typed id
     */
    public Outcome<Arn> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");

        String[] fields = text.split(String.valueOf(DELIMITER), -1);
        if (fields.length != Segment.COUNT) {
            return reject("ArnCodec.parse", new ArnError.MalformedArn(text, fields.length));
        }
        if (!PREFIX.equals(fields[Segment.PREFIX.position()])) {
            return reject("ArnCodec.parse", new ArnError.InvalidSegment(
                    Segment.PREFIX.position(), fields[0], "expected literal '" + PREFIX + "'"));
        }
        return build("ArnCodec.parse",
                fields[Segment.PARTITION.position()],
                fields[Segment.SERVICE.position()],
                fields[Segment.CATEGORY.position()],
                fields[Segment.RESOURCE_ID.position()]);
    }

    /**
     * Issues a new ARN with a freshly generated identifier tagged with {@link #defaultTag()}.
     */
    public Outcome<Arn> create(String partition, String service, String category) {
        return create(partition, service, category, defaultTag);
    }

    /**
     * Issues a new ARN with a freshly generated identifier.
     *
     * <p>The segments are validated before the generator is touched, so invalid input
     * never consumes an identifier.</p>
     *
     * @return Ok with the Arn, {@link ArnError.InvalidSegment} for the first invalid segment,
     *         or {@link ArnError.GenerationFailed} if the identifier source failed
     */
    public Outcome<Arn> create(String partition, String service, String category, TypeTag tag) {
        Objects.requireNonNull(tag, "tag must not be null");

        Optional<ArnError.InvalidSegment> problem = SegmentRules.validate(partition, service, category);
        if (problem.isPresent()) {
            return reject("ArnCodec.create", problem.get());
        }
        Outcome<UUID> payload = boundary.call("ArnCodec.create", idGenerator::next);
        return payload.map(value -> Arn.validated(partition, service, category, TypedId.of(tag, value)));
    }

    /**
     * Rebuilds an ARN from its segments and the text of a previously issued identifier.
     */
    public Outcome<Arn> withId(String partition, String service, String category, String resourceId) {
        return build("ArnCodec.withId", partition, service, category, resourceId);
    }

    /**
     * Rebuilds an ARN from its segments and a previously issued identifier.
     */
    public Outcome<Arn> withId(String partition, String service, String category, TypedId resourceId) {
        if (resourceId == null) {
            return reject("ArnCodec.withId", new ArnError.InvalidIdentifier(null, "identifier is missing"));
        }
        Optional<ArnError.InvalidSegment> problem = SegmentRules.validate(partition, service, category);
        if (problem.isPresent()) {
            return reject("ArnCodec.withId", problem.get());
        }
        return Outcome.ok(Arn.validated(partition, service, category, resourceId));
    }

    /**
     * Issues {@code arn:akton:system:default:root_<fresh>}, the ARN of a system root resource.
     */
    public Outcome<Arn> defaultArn() {
        return create(DEFAULT_PARTITION, DEFAULT_SERVICE, DEFAULT_CATEGORY, TypeTag.ROOT);
    }

    private Outcome<Arn> build(String operation, String partition, String service, String category, String resourceId) {
        Optional<ArnError.InvalidSegment> problem = SegmentRules.validate(partition, service, category);
        if (problem.isPresent()) {
            return reject(operation, problem.get());
        }
        return TypedId.parse(resourceId)
                .onFailure(error -> reporter.report(operation, error))
                .map(id -> Arn.validated(partition, service, category, id));
    }

    private <T> Outcome<T> reject(String operation, ArnError error) {
        reporter.report(operation, error);
        return Outcome.fail(error);
    }

    /**
     * Builder for {@link ArnCodec}.
     */
    public static final class Builder {
        private IdGenerator idGenerator = new RandomIdGenerator();
        private TypeTag defaultTag = TypeTag.RESOURCE;
        private ArnErrorReporter reporter = ArnErrorReporter.noOp();

        private Builder() {
        }

        /**
         * Sets the source of identifier payloads. Defaults to {@link RandomIdGenerator}.
         */
        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        /**
         * Sets the tag used by {@link ArnCodec#create(String, String, String)}. Defaults to {@code res}.
         */
        public Builder defaultTag(TypeTag defaultTag) {
            this.defaultTag = Objects.requireNonNull(defaultTag, "defaultTag must not be null");
            return this;
        }

        /**
         * Sets the reporter notified of every rejection. Defaults to {@link ArnErrorReporter#noOp()}.
         */
        public Builder reporter(ArnErrorReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public ArnCodec build() {
            return new ArnCodec(this);
        }
    }
}

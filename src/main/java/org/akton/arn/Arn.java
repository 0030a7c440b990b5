package org.akton.arn;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.akton.arn.id.TypedId;

/**
 * An Akton Resource Name.
 *
 * <p>Canonical form: {@code arn:<partition>:<service>:<category>:<tag>_<value>}, for
 * example {@code arn:prod:billing:acct1:usr_01h455vb4pex5vsknk084sn02q}.</p>
 *
 * <p><strong>Immutability:</strong> an Arn can only be obtained through {@link ArnCodec},
 * {@link ArnBuilder} or JSON deserialization, all of which validate every segment. The
 * {@code with*} methods return a new, re-validated Arn.</p>
 * <p><strong>Equality:</strong> by value over all four segments, so
 * {@code codec.parse(arn.toString())} equals {@code arn}.</p>
 */
public final class Arn {

    private final String partition;
    private final String service;
    private final String category;
    private final TypedId resourceId;

    private Arn(String partition, String service, String category, TypedId resourceId) {
        this.partition = partition;
        this.service = service;
        this.category = category;
        this.resourceId = resourceId;
    }

    // Callers must have run SegmentRules on the three string segments.
    static Arn validated(String partition, String service, String category, TypedId resourceId) {
        return new Arn(
                Objects.requireNonNull(partition),
                Objects.requireNonNull(service),
                Objects.requireNonNull(category),
                Objects.requireNonNull(resourceId));
    }

    /**
     * Parses a canonical ARN string with the standard codec.
     *
     * @see ArnCodec#parse(String)
     */
    public static Outcome<Arn> parse(String text) {
        return ArnCodec.standard().parse(text);
    }

    /**
     * Jackson entry point; rejects malformed text with {@link ArnFailedException}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Arn fromString(String text) {
        return parse(text).getOrThrow();
    }

    public String partition() {
        return partition;
    }

    public String service() {
        return service;
    }

    /**
     * @return the category, possibly empty
     */
    public String category() {
        return category;
    }

    public TypedId resourceId() {
        return resourceId;
    }

    public Outcome<Arn> withPartition(String partition) {
        return revalidate(Segment.PARTITION, partition,
                () -> new Arn(partition, service, category, resourceId));
    }

    public Outcome<Arn> withService(String service) {
        return revalidate(Segment.SERVICE, service,
                () -> new Arn(partition, service, category, resourceId));
    }

    public Outcome<Arn> withCategory(String category) {
        return revalidate(Segment.CATEGORY, category,
                () -> new Arn(partition, service, category, resourceId));
    }

    /**
     * Returns a copy naming a different resource. A {@link TypedId} is valid by
     * construction, so this cannot fail.
     */
    public Arn withResourceId(TypedId resourceId) {
        return new Arn(partition, service, category, Objects.requireNonNull(resourceId, "resourceId must not be null"));
    }

    private static Outcome<Arn> revalidate(Segment segment, String value, Supplier<Arn> copy) {
        Optional<ArnError.InvalidSegment> problem = SegmentRules.validate(segment, value);
        if (problem.isPresent()) {
            return Outcome.fail(problem.get());
        }
        return Outcome.ok(copy.get());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arn arn = (Arn) o;
        return partition.equals(arn.partition)
                && service.equals(arn.service)
                && category.equals(arn.category)
                && resourceId.equals(arn.resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partition, service, category, resourceId);
    }

    @JsonValue
    @Override
    public String toString() {
        return ArnCodec.render(this);
    }
}

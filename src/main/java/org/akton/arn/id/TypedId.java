package org.akton.arn.id;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.akton.arn.ArnError;
import org.akton.arn.Outcome;

/**
 * A unique identifier qualified by the kind of resource it names.
 *
 * <p>The text form is {@code <tag>_<value>}, where the value is the 128-bit payload in
 * {@link CrockfordBase32}, e.g. {@code usr_01h455vb4pex5vsknk084sn02q}. The tag never
 * contains an underscore, so the first underscore always separates the two parts.</p>
 *
 * @param tag the resource kind
 * @param value the 128-bit payload
 */
public record TypedId(TypeTag tag, UUID value) {

    public static final char SEPARATOR = '_';

    public TypedId {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static TypedId of(TypeTag tag, UUID value) {
        return new TypedId(tag, value);
    }

    /**
     * Decodes the text form of an identifier.
     *
     * @param text the identifier, e.g. {@code usr_01h455vb4pex5vsknk084sn02q}
     * @return Ok with the identifier, or Fail with {@link ArnError.InvalidIdentifier}
     */
    public static Outcome<TypedId> parse(String text) {
        if (text == null || text.isEmpty()) {
            return invalid(text, "identifier is empty");
        }
        int separator = text.indexOf(SEPARATOR);
        if (separator < 0) {
            return invalid(text, "missing '" + SEPARATOR + "' between type tag and value");
        }
        String tag = text.substring(0, separator);
        String encoded = text.substring(separator + 1);

        Optional<String> tagProblem = TypeTag.validate(tag);
        if (tagProblem.isPresent()) {
            return invalid(text, tagProblem.get());
        }
        Optional<String> valueProblem = CrockfordBase32.validate(encoded);
        if (valueProblem.isPresent()) {
            return invalid(text, valueProblem.get());
        }
        return Outcome.ok(new TypedId(new TypeTag(tag), CrockfordBase32.decode(encoded)));
    }

    /**
     * Jackson entry point; rejects malformed text with {@link org.akton.arn.ArnFailedException}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TypedId fromString(String text) {
        return parse(text).getOrThrow();
    }

    private static Outcome<TypedId> invalid(String text, String reason) {
        return Outcome.fail(new ArnError.InvalidIdentifier(text, reason));
    }

    @JsonValue
    @Override
    public String toString() {
        return tag.value() + SEPARATOR + CrockfordBase32.encode(value);
    }
}

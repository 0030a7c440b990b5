package org.akton.arn.id;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The short prefix that says what kind of resource an identifier names.
 *
 * <p>A tag is 1 to 63 characters: a lowercase ASCII letter followed by lowercase letters
 * or digits. The common resource kinds are available as constants; any other tag that
 * satisfies the rule may be created with {@link #of(String)}.</p>
 *
 * @param value the tag text, e.g. {@code usr}
 */
public record TypeTag(String value) {

    public static final int MAX_LENGTH = 63;

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9]*$");

    public static final TypeTag ROOT = new TypeTag("root");
    public static final TypeTag USER = new TypeTag("usr");
    public static final TypeTag ACCOUNT = new TypeTag("acct");
    public static final TypeTag SERVICE = new TypeTag("svc");
    public static final TypeTag RESOURCE = new TypeTag("res");

    public TypeTag {
        validate(value).ifPresent(reason -> {
            throw new IllegalArgumentException("invalid type tag '" + value + "': " + reason);
        });
    }

    /**
     * Creates a TypeTag.
     *
     * @throws IllegalArgumentException if the value is not a valid tag
     */
    public static TypeTag of(String value) {
        return new TypeTag(value);
    }

    /**
     * Checks a candidate tag without constructing it.
     *
     * @return empty if valid, otherwise the reason it is not
     */
    public static Optional<String> validate(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.of("type tag is empty");
        }
        if (value.length() > MAX_LENGTH) {
            return Optional.of("type tag exceeds " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            return Optional.of("type tag must be a lowercase letter followed by lowercase letters or digits");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return Objects.toString(value);
    }
}

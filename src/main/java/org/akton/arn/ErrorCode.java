package org.akton.arn;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of ARN error.
 *
 * @param namespace The subsystem that raised the error (always "arn" for this library)
 * @param name The specific error kind within that namespace (e.g., "malformed", "invalid_segment")
 */
public record ErrorCode(String namespace, String name) {

    public static final ErrorCode MALFORMED = of("arn", "malformed");
    public static final ErrorCode INVALID_SEGMENT = of("arn", "invalid_segment");
    public static final ErrorCode INVALID_IDENTIFIER = of("arn", "invalid_identifier");
    public static final ErrorCode GENERATION_FAILED = of("arn", "generation_failed");

    public ErrorCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static ErrorCode of(String namespace, String name) {
        return new ErrorCode(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}

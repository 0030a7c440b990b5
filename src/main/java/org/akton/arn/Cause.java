package org.akton.arn;

import java.util.Objects;

/**
 * Captures the underlying exception of a system failure for diagnostics, without
 * keeping a reference to the exception itself.
 *
 * @param type The exception class name
 * @param fingerprint A stable identifier for deduplication (exception type and throwing frame)
 * @param detail The message of that same exception (may be null)
 */
public record Cause(String type, String fingerprint, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Cause fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        Throwable root = t.getCause() != null ? t.getCause() : t;
        return new Cause(root.getClass().getName(), computeFingerprint(root), root.getMessage());
    }

    private static String computeFingerprint(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}

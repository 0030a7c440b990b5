package org.akton.arn.id;

/**
 * Thrown by an {@link IdGenerator} when its source of randomness cannot produce a value.
 * Checked, because callers must decide what an identifier-less operation means for them.
 */
public class EntropyUnavailableException extends Exception {

    public EntropyUnavailableException(String message) {
        super(message);
    }

    public EntropyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.akton.arn;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first.
 */
public class ArnFailedException extends RuntimeException {

    private final ArnError error;

    public ArnFailedException(ArnError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public ArnError error() {
        return error;
    }
}

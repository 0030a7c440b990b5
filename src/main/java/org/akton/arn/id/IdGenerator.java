package org.akton.arn.id;

import java.util.UUID;

/**
 * Source of fresh 128-bit identifier payloads.
 *
 * <p>Every identifier the codec issues comes from exactly one {@link #next()} call, so
 * substituting the generator is enough to make generation deterministic in tests.</p>
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Produces a new payload.
     *
     * @return a value that has not been returned before, with overwhelming probability
     * @throws EntropyUnavailableException if the underlying random source failed
     */
    UUID next() throws EntropyUnavailableException;
}

package org.akton.arn.id;

import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.UUID;

/**
 * Generates version 4 (random) UUIDs from a {@link SecureRandom}.
 *
 * <p>122 of the 128 bits are random; the remaining six carry the version and variant.
 * A failure of the random source surfaces as {@link EntropyUnavailableException} and is
 * never replaced by a weaker source.</p>
 */
public final class RandomIdGenerator implements IdGenerator {

    private final SecureRandom random;

    public RandomIdGenerator() {
        this(new SecureRandom());
    }

    public RandomIdGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public UUID next() throws EntropyUnavailableException {
        byte[] bytes = new byte[16];
        try {
            random.nextBytes(bytes);
        } catch (ProviderException e) {
            throw new EntropyUnavailableException(
                    "secure random source failed: " + e.getMessage(), e);
        }
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40);
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);
        return new UUID(toLong(bytes, 0), toLong(bytes, 8));
    }

    private static long toLong(byte[] bytes, int offset) {
        long result = 0;
        for (int i = offset; i < offset + 8; i++) {
            result = (result << 8) | (bytes[i] & 0xff);
        }
        return result;
    }
}

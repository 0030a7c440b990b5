package org.akton.arn.id;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Fixed-length Crockford base32 encoding of 128-bit values.
 *
 * <p>A UUID is treated as an unsigned 128-bit integer, left-padded with two zero bits to
 * 130 bits and written as 26 five-bit characters, most significant first. Only the
 * lowercase alphabet is produced and accepted, so every value has exactly one text form.
 * Because of the padding the first character is always {@code 0}-{@code 7}.</p>
 */
public final class CrockfordBase32 {

    /**
     * Number of characters in an encoded value.
     */
    public static final int ENCODED_LENGTH = 26;

    private static final char[] ALPHABET = "0123456789abcdefghjkmnpqrstvwxyz".toCharArray();
    private static final byte[] DECODE = new byte[128];

    static {
        Arrays.fill(DECODE, (byte) -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            DECODE[ALPHABET[i]] = (byte) i;
        }
    }

    private CrockfordBase32() {
    }

    public static String encode(UUID value) {
        Objects.requireNonNull(value, "value must not be null");
        long msb = value.getMostSignificantBits();
        long lsb = value.getLeastSignificantBits();
        char[] out = new char[ENCODED_LENGTH];
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            out[i] = ALPHABET[fiveBitsAt(msb, lsb, 125 - 5 * i)];
        }
        return new String(out);
    }

    /**
     * Checks that {@code text} is a canonical encoding.
     *
     * @return empty if valid, otherwise the reason it is not
     */
    public static Optional<String> validate(String text) {
        if (text == null) {
            return Optional.of("value is missing");
        }
        if (text.length() != ENCODED_LENGTH) {
            return Optional.of("expected " + ENCODED_LENGTH + " characters but found " + text.length());
        }
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            char c = text.charAt(i);
            if (c >= DECODE.length || DECODE[c] < 0) {
                return Optional.of("illegal character '" + c + "' at offset " + i);
            }
        }
        if (DECODE[text.charAt(0)] > 7) {
            return Optional.of("value exceeds 128 bits");
        }
        return Optional.empty();
    }

    /**
     * Decodes a canonical encoding.
     *
     * @throws IllegalArgumentException if {@link #validate(String)} would reject the text
     */
    public static UUID decode(String text) {
        validate(text).ifPresent(reason -> {
            throw new IllegalArgumentException(reason);
        });
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            int v = DECODE[text.charAt(i)];
            msb = (msb << 5) | (lsb >>> 59);
            lsb = (lsb << 5) | v;
        }
        return new UUID(msb, lsb);
    }

    // Bits [shift, shift + 5) of the 128-bit value msb:lsb.
    private static int fiveBitsAt(long msb, long lsb, int shift) {
        if (shift >= 64) {
            return (int) ((msb >>> (shift - 64)) & 31);
        }
        if (shift + 5 <= 64) {
            return (int) ((lsb >>> shift) & 31);
        }
        return (int) (((lsb >>> shift) | (msb << (64 - shift))) & 31);
    }
}

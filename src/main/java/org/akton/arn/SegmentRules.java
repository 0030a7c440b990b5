package org.akton.arn;

import java.util.Optional;

/**
 * The per-segment validation shared by every path that produces an {@link Arn}.
 *
 * <p>Partition, service and category all use the same character class: ASCII letters,
 * digits and hyphen. Only segments whose {@link Segment#emptyAllowed()} is set may be empty.</p>
 */
final class SegmentRules {

    private SegmentRules() {
    }

    /**
     * Checks one segment value.
     *
     * @return empty if valid, otherwise the error naming the segment's position
     */
    static Optional<ArnError.InvalidSegment> validate(Segment segment, String value) {
        if (value == null) {
            return reject(segment, null, segment.label() + " is missing");
        }
        if (value.isEmpty()) {
            return segment.emptyAllowed()
                    ? Optional.empty()
                    : reject(segment, value, segment.label() + " must not be empty");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!isAllowed(c)) {
                return reject(segment, value, "illegal character '" + c + "' at offset " + i
                        + "; only letters, digits and '-' are allowed");
            }
        }
        return Optional.empty();
    }

    /**
     * Checks partition, service and category in order and returns the first violation.
     */
    static Optional<ArnError.InvalidSegment> validate(String partition, String service, String category) {
        return validate(Segment.PARTITION, partition)
                .or(() -> validate(Segment.SERVICE, service))
                .or(() -> validate(Segment.CATEGORY, category));
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-';
    }

    private static Optional<ArnError.InvalidSegment> reject(Segment segment, String value, String reason) {
        return Optional.of(new ArnError.InvalidSegment(segment.position(), value, reason));
    }
}

package org.akton.arn;

/**
 * The colon-delimited fields of an ARN, in their fixed order.
 *
 * <p>The {@linkplain #position() position} is the field index in the canonical string,
 * so {@code arn} is 0 and the partition is 1.</p>
 */
public enum Segment {
    PREFIX(0, "prefix", false),
    PARTITION(1, "partition", false),
    SERVICE(2, "service", false),
    CATEGORY(3, "category", true),
    RESOURCE_ID(4, "resource id", false);

    /**
     * Number of fields in every ARN string.
     */
    public static final int COUNT = values().length;

    private final int position;
    private final String label;
    private final boolean emptyAllowed;

    Segment(int position, String label, boolean emptyAllowed) {
        this.position = position;
        this.label = label;
        this.emptyAllowed = emptyAllowed;
    }

    public int position() {
        return position;
    }

    public String label() {
        return label;
    }

    public boolean emptyAllowed() {
        return emptyAllowed;
    }

    public static Segment at(int position) {
        if (position < 0 || position >= COUNT) {
            throw new IllegalArgumentException("no segment at position " + position);
        }
        return values()[position];
    }
}

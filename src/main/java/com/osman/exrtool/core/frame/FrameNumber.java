package com.osman.exrtool.core.frame;

import java.util.Objects;

/**
 * Frame number parsed from a file name, or the distinguished "no frame" value.
 * <p>
 * Numbered frames order ascending; {@link #NONE} orders after every numbered frame.
 */
public final class FrameNumber implements Comparable<FrameNumber> {

    public static final FrameNumber NONE = new FrameNumber(false, 0L);

    private final boolean present;
    private final long value;

    private FrameNumber(boolean present, long value) {
        this.present = present;
        this.value = value;
    }

    public static FrameNumber of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Frame number must not be negative: " + value);
        }
        return new FrameNumber(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public long getAsLong() {
        if (!present) {
            throw new IllegalStateException("No frame number");
        }
        return value;
    }

    @Override
    public int compareTo(FrameNumber other) {
        if (present != other.present) {
            return present ? -1 : 1;
        }
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameNumber other)) return false;
        return present == other.present && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? Long.toString(value) : "<no frame>";
    }
}

package com.libragraph.salvage.core.coverage;

/**
 * Half-open byte interval {@code [start, end)} of the dump.
 */
public record ByteRange(long start, long end) implements Comparable<ByteRange> {

    public ByteRange {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public static ByteRange of(long start, long length) {
        return new ByteRange(start, start + length);
    }

    public long length() {
        return end - start;
    }

    public boolean contains(long offset) {
        return offset >= start && offset < end;
    }

    public boolean overlaps(ByteRange other) {
        return start < other.end && other.start < end;
    }

    /**
     * Bytes between the two ranges, 0 when they touch or overlap.
     */
    public long distanceTo(ByteRange other) {
        if (overlaps(other)) return 0;
        return other.start >= end ? other.start - end : start - other.end;
    }

    @Override
    public int compareTo(ByteRange o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(end, o.end);
    }

    @Override
    public String toString() {
        return String.format("[0x%08X, 0x%08X)", start, end);
    }
}

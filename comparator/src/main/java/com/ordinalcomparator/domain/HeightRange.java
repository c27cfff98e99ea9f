package com.ordinalcomparator.domain;

/**
 * Closed block height interval {@code [start, end]}. Empty when start &gt; end.
 */
public record HeightRange(long start, long end) {

    public HeightRange {
        if (start < 0) {
            throw new IllegalArgumentException("start height must be non-negative: " + start);
        }
    }

    public boolean isEmpty() {
        return start > end;
    }

    public long size() {
        return isEmpty() ? 0 : end - start + 1;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}

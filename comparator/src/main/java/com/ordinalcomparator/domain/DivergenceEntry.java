package com.ordinalcomparator.domain;

import java.util.Comparator;

/**
 * One detected disagreement for a block. {@code key} is the comparator's match key
 * (empty for block-level entries such as {@link DivergenceKind#COUNT_MISMATCH}).
 */
public record DivergenceEntry(long height, DivergenceKind kind, String key, String detail) {

    /** Report order: match key, then kind. */
    public static final Comparator<DivergenceEntry> REPORT_ORDER = Comparator
            .comparing(DivergenceEntry::key)
            .thenComparing(DivergenceEntry::kind);

    public DivergenceEntry {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        key = key == null ? "" : key;
        detail = detail == null ? "" : detail;
    }
}

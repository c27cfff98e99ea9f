package com.ordinalcomparator.domain;

/**
 * Kinds of disagreement between primary and secondary receipts. Declaration order is the
 * tie-breaker when ordering entries that share a match key.
 */
public enum DivergenceKind {
    MISSING_IN_SECONDARY,
    MISSING_IN_PRIMARY,
    FIELD_MISMATCH,
    COUNT_MISMATCH
}

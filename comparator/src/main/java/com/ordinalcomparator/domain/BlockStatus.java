package com.ordinalcomparator.domain;

public enum BlockStatus {
    /** Both sides fetched and compared; divergences (possibly none) are conclusive. */
    OK,
    /** Retry budget exhausted on at least one side; the height is unverified. */
    FETCH_FAILED,
    /** Non-retriable failure; the run must stop. */
    FATAL
}

package com.ordinalcomparator.reconcile.endpoint;

/**
 * Classification of a failed indexer call. TIMEOUT and UNAVAILABLE are retried; INVALID_RESPONSE is not.
 */
public enum FetchErrorKind {
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE;

    public boolean isRetriable() {
        return this != INVALID_RESPONSE;
    }
}

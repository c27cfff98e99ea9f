package com.ordinalcomparator.reconcile.endpoint;

/**
 * Timeout, connection failure, 5xx, 408 or 429 from an indexer. Retried under the retry policy.
 */
public class TransientFetchException extends EndpointException {

    public TransientFetchException(FetchErrorKind kind, String message) {
        super(kind, message);
    }

    public TransientFetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}

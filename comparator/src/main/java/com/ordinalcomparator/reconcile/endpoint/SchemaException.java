package com.ordinalcomparator.reconcile.endpoint;

/**
 * Response that cannot be understood: malformed JSON, unknown event type, wrong network, rejected request (4xx).
 * Never retried; it aborts the run.
 */
public class SchemaException extends EndpointException {

    public SchemaException(String message) {
        super(FetchErrorKind.INVALID_RESPONSE, message);
    }

    public SchemaException(String message, Throwable cause) {
        super(FetchErrorKind.INVALID_RESPONSE, message, cause);
    }
}

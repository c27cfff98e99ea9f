package com.ordinalcomparator.reconcile.endpoint;

import lombok.Getter;

/**
 * Base for failures of a call to an indexer endpoint.
 */
@Getter
public abstract class EndpointException extends RuntimeException {

    private final FetchErrorKind kind;

    protected EndpointException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected EndpointException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

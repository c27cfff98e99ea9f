package com.ordinalcomparator.reconcile.endpoint;

/**
 * Thrown when a fetch stops retrying because the run is being cancelled or the worker was interrupted.
 */
public class FetchAbortedException extends RuntimeException {

    public FetchAbortedException(String message) {
        super(message);
    }

    public FetchAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}

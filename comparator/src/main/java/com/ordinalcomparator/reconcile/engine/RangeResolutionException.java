package com.ordinalcomparator.reconcile.engine;

/**
 * The end height could not be resolved from the endpoints' tips. No block is processed.
 */
public class RangeResolutionException extends RuntimeException {

    public RangeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

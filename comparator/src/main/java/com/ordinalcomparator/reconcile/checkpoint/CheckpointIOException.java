package com.ordinalcomparator.reconcile.checkpoint;

/**
 * Checkpoint could not be read or written. Fatal for the run.
 */
public class CheckpointIOException extends RuntimeException {

    public CheckpointIOException(String message) {
        super(message);
    }

    public CheckpointIOException(String message, Throwable cause) {
        super(message, cause);
    }
}

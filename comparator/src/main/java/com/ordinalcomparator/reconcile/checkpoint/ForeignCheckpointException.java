package com.ordinalcomparator.reconcile.checkpoint;

/**
 * Stored checkpoint belongs to a different (chain, protocol, endpoints) tuple than the run that loaded it.
 */
public class ForeignCheckpointException extends CheckpointIOException {

    public ForeignCheckpointException(String message) {
        super(message);
    }
}

package com.ordinalcomparator.reconcile.checkpoint;

import com.ordinalcomparator.domain.Checkpoint;
import com.ordinalcomparator.domain.CheckpointKey;

import java.util.Optional;

/**
 * Durable last-reconciled height per {@link CheckpointKey}.
 */
public interface CheckpointStore {

    /**
     * @throws ForeignCheckpointException when the stored record does not belong to {@code key}
     * @throws CheckpointIOException      when the store cannot be read
     */
    Optional<Checkpoint> load(CheckpointKey key);

    /**
     * Replaces the stored checkpoint. A crash leaves either the old or the new value.
     *
     * @throws CheckpointIOException when the write fails
     */
    void save(Checkpoint checkpoint);
}

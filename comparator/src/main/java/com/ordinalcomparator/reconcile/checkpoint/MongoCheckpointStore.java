package com.ordinalcomparator.reconcile.checkpoint;

import com.ordinalcomparator.domain.Checkpoint;
import com.ordinalcomparator.domain.CheckpointKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Optional;

/**
 * One document per checkpoint key in {@code comparator_checkpoints}, {@code _id} = key fingerprint.
 * {@link MongoTemplate#save} replaces the whole document, which is atomic for a single document.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoCheckpointStore implements CheckpointStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Checkpoint> load(CheckpointKey key) {
        Checkpoint checkpoint;
        try {
            checkpoint = mongoTemplate.findById(key.fingerprint(), Checkpoint.class);
        } catch (DataAccessException e) {
            throw new CheckpointIOException("Cannot read checkpoint " + key.fingerprint(), e);
        }
        if (checkpoint == null) {
            return Optional.empty();
        }
        if (!checkpoint.belongsTo(key)) {
            throw new ForeignCheckpointException("Checkpoint document " + checkpoint.getId()
                    + " does not belong to " + key);
        }
        return Optional.of(checkpoint);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        try {
            mongoTemplate.save(checkpoint);
            log.debug("Checkpoint {} saved at height {}", checkpoint.getId(), checkpoint.getLastReconciledHeight());
        } catch (DataAccessException e) {
            throw new CheckpointIOException("Cannot write checkpoint " + checkpoint.getId(), e);
        }
    }
}

package com.ordinalcomparator.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Highest height fully reconciled for one {@link CheckpointKey}. Written only by the engine after
 * an in-order finalized block; never deleted by the application.
 */
@Document(collection = "comparator_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class Checkpoint {

    /** {@link CheckpointKey#fingerprint()}. */
    @Id
    private String id;
    private ChainId chain;
    private ProtocolId protocol;
    private String primaryEndpoint;
    private String secondaryEndpoint;
    private long lastReconciledHeight;
    private Instant updatedAt;

    public static Checkpoint of(CheckpointKey key, long lastReconciledHeight, Instant updatedAt) {
        Checkpoint c = new Checkpoint();
        c.setId(key.fingerprint());
        c.setChain(key.chain());
        c.setProtocol(key.protocol());
        c.setPrimaryEndpoint(key.primaryEndpoint());
        c.setSecondaryEndpoint(key.secondaryEndpoint());
        c.setLastReconciledHeight(lastReconciledHeight);
        c.setUpdatedAt(updatedAt);
        return c;
    }

    /**
     * True when the stored tuple is exactly the given key. A stored record that fails this is foreign.
     */
    public boolean belongsTo(CheckpointKey key) {
        return key.chain() == chain
                && key.protocol() == protocol
                && key.primaryEndpoint().equals(primaryEndpoint)
                && key.secondaryEndpoint().equals(secondaryEndpoint);
    }
}

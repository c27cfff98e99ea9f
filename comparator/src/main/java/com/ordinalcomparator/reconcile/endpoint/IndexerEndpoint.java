package com.ordinalcomparator.reconcile.endpoint;

import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;

/**
 * One remote indexer. Single attempt per call; retries and rate limiting live in {@link GovernedEndpoint}.
 * Implementations must be safe for concurrent use.
 */
public interface IndexerEndpoint {

    String baseUrl();

    /**
     * Normalized receipts of one block. A block without events yields empty receipts.
     *
     * @throws TransientFetchException on timeout or unavailability
     * @throws SchemaException         when the response cannot be parsed
     */
    Receipts fetch(ChainId chain, ProtocolId protocol, long height);

    /**
     * Latest block height this indexer has processed for the chain. Fails with {@link SchemaException}
     * when the indexer reports a different network.
     */
    long tip(ChainId chain);
}

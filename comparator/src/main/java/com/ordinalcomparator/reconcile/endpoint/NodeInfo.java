package com.ordinalcomparator.reconcile.endpoint;

/**
 * Chain info reported by an indexer's node info route.
 *
 * @param network        normalized network name ("mainnet" is reported as "bitcoin")
 * @param ordBlockHeight latest height processed by the indexer
 */
public record NodeInfo(String network, long ordBlockHeight) {
}

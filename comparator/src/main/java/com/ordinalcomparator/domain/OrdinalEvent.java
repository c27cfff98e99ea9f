package com.ordinalcomparator.domain;

/**
 * One inscription event (inscribe or transfer) as reported by an Ordinal indexer.
 * {@code owner}, {@code contentHash} and {@code sequenceNumber} may be null when the indexer omits them.
 */
public record OrdinalEvent(
        String txid,
        String inscriptionId,
        String type,
        String owner,
        String contentHash,
        Long sequenceNumber
) {
}

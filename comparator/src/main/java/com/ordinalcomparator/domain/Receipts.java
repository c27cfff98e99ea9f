package com.ordinalcomparator.domain;

/**
 * Protocol events one indexer reported for one block. Immutable once fetched; only the comparator
 * for {@link #protocol()} interprets the contents.
 */
public interface Receipts {

    ProtocolId protocol();

    int size();
}

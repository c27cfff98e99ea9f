package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;

import java.util.List;

/**
 * Protocol-specific diff of the receipts two indexers reported for one block.
 * Implementations are pure: no I/O, no clock, no shared mutable state.
 */
public interface ReceiptComparator {

    ProtocolId protocol();

    /**
     * Divergences ordered by match key, then kind. Equal inputs always give equal lists and
     * {@code compare(h, a, a)} never reports a missing entry.
     */
    List<DivergenceEntry> compare(long height, Receipts primary, Receipts secondary);
}

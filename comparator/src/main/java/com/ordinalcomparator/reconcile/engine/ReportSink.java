package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.BlockResult;

/**
 * Receives every finalized height in order, then the run summary once. Called from the engine thread only.
 */
public interface ReportSink {

    void onBlock(BlockResult result);

    void onSummary(RunSummary summary);
}

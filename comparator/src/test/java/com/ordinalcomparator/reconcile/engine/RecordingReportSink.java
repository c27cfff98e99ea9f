package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.BlockResult;

import java.util.ArrayList;
import java.util.List;

class RecordingReportSink implements ReportSink {

    final List<BlockResult> blocks = new ArrayList<>();
    final List<RunSummary> summaries = new ArrayList<>();

    @Override
    public synchronized void onBlock(BlockResult result) {
        blocks.add(result);
    }

    @Override
    public synchronized void onSummary(RunSummary summary) {
        summaries.add(summary);
    }

    synchronized void clear() {
        blocks.clear();
        summaries.clear();
    }
}

package com.ordinalcomparator.reconcile.report;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.reconcile.engine.ReportSink;
import com.ordinalcomparator.reconcile.engine.RunSummary;

import java.util.List;

public class CompositeReportSink implements ReportSink {

    private final List<ReportSink> sinks;

    public CompositeReportSink(List<ReportSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void onBlock(BlockResult result) {
        for (ReportSink sink : sinks) {
            sink.onBlock(result);
        }
    }

    @Override
    public void onSummary(RunSummary summary) {
        for (ReportSink sink : sinks) {
            sink.onSummary(summary);
        }
    }
}

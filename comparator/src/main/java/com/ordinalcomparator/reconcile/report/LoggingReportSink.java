package com.ordinalcomparator.reconcile.report;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.reconcile.engine.ReportSink;
import com.ordinalcomparator.reconcile.engine.RunSummary;
import lombok.extern.slf4j.Slf4j;

/**
 * Divergences at WARN, clean blocks at DEBUG, fatal blocks at ERROR, summary at INFO.
 */
@Slf4j
public class LoggingReportSink implements ReportSink {

    @Override
    public void onBlock(BlockResult result) {
        switch (result.status()) {
            case OK -> {
                if (!result.hasDivergences()) {
                    log.debug("Block {} matches", result.height());
                    return;
                }
                log.warn("Block {}: {} divergence(s)", result.height(), result.divergences().size());
                for (DivergenceEntry d : result.divergences()) {
                    log.warn("  {} key={} {}", d.kind(), d.key().isEmpty() ? "<block>" : d.key(), d.detail());
                }
            }
            case FETCH_FAILED -> log.warn("Block {} unverified: {}", result.height(), result.detail());
            case FATAL -> log.error("Block {} failed: {}", result.height(), result.detail());
        }
    }

    @Override
    public void onSummary(RunSummary summary) {
        log.info("Reconciliation {} for range {}: {} blocks processed, {} divergent, {} divergences, {} unverified",
                summary.state(),
                summary.range() == null ? "-" : summary.range(),
                summary.processedBlocks(),
                summary.divergentBlocks(),
                summary.totalDivergences(),
                summary.unverifiedHeights().size());
        if (summary.divergenceFound()) {
            log.warn("Divergences by kind: {}", summary.divergencesByKind());
            log.warn("Divergences by height bucket: {}", summary.divergencesByBucket());
        }
        if (!summary.unverifiedHeights().isEmpty()) {
            log.warn("Unverified heights: {}", summary.unverifiedHeights());
        }
        if (summary.failure() != null) {
            log.error("Run failed: {}", summary.failure());
        }
        log.info("Last reconciled height {}, elapsed {} s ({} s/block)",
                summary.lastReconciledHeight() == null ? "-" : summary.lastReconciledHeight(),
                String.format("%.1f", summary.elapsed().toMillis() / 1000.0),
                String.format("%.3f", summary.secondsPerBlock()));
    }
}

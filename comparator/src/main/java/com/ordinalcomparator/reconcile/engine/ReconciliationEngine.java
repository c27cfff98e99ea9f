package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.BlockStatus;
import com.ordinalcomparator.domain.Checkpoint;
import com.ordinalcomparator.domain.CheckpointKey;
import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.DivergenceKind;
import com.ordinalcomparator.domain.HeightRange;
import com.ordinalcomparator.domain.RunConfig;
import com.ordinalcomparator.reconcile.checkpoint.CheckpointIOException;
import com.ordinalcomparator.reconcile.checkpoint.CheckpointStore;
import com.ordinalcomparator.reconcile.compare.ComparatorRegistry;
import com.ordinalcomparator.reconcile.config.EngineProperties;
import com.ordinalcomparator.reconcile.endpoint.EndpointException;
import com.ordinalcomparator.reconcile.endpoint.FetchAbortedException;
import com.ordinalcomparator.reconcile.endpoint.GovernedEndpoint;
import com.ordinalcomparator.reconcile.endpoint.GovernedEndpointFactory;
import com.ordinalcomparator.reconcile.scheduler.BlockTaskScheduler;
import com.ordinalcomparator.reconcile.scheduler.FetchCompareTask;
import com.ordinalcomparator.reconcile.scheduler.ScheduledRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Drives one reconciliation run: resolves the effective range from the checkpoint and the endpoints' tips,
 * consumes ordered block results, reports them, and advances the checkpoint. The checkpoint is written
 * only here, only for heights released in order.
 * <p>
 * States: INITIALIZING, RESOLVING_RANGE, RUNNING, then COMPLETED, CANCELLED or FAILED.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final GovernedEndpointFactory endpointFactory;
    private final ComparatorRegistry comparatorRegistry;
    private final CheckpointStore checkpointStore;
    private final ReportSink reportSink;
    private final EngineProperties engineProperties;
    private final RunProgressTracker progressTracker;
    private final Clock clock;

    private volatile EngineState state = EngineState.INITIALIZING;
    private volatile boolean cancelRequested;
    private volatile ScheduledRun activeRun;

    public EngineState getState() {
        return state;
    }

    /**
     * Requests cancellation: no new heights are dispatched, in-flight heights get the shutdown grace period,
     * and the run ends CANCELLED with the checkpoint at the highest contiguous finalized height.
     */
    public void cancel() {
        cancelRequested = true;
        ScheduledRun run = activeRun;
        if (run != null) {
            log.info("Cancellation requested, waiting up to {} ms for in-flight blocks",
                    engineProperties.getShutdownGracePeriodMs());
            run.cancel(gracePeriod());
        }
    }

    public RunSummary run(RunConfig config) {
        Instant startedAt = clock.instant();
        cancelRequested = false;
        RunAccumulator acc = new RunAccumulator(startedAt);
        state = EngineState.INITIALIZING;

        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            return finish(acc.failed("Invalid run configuration: " + e.getMessage()));
        }
        CheckpointKey key = config.checkpointKey();
        Optional<Checkpoint> stored;
        try {
            stored = checkpointStore.load(key);
        } catch (CheckpointIOException e) {
            log.error("Cannot load checkpoint for {}: {}", key, e.getMessage());
            return finish(acc.failed(e.getMessage()));
        }
        long configuredStart = config.configuredStartOrDefault();
        long start = configuredStart;
        if (stored.isPresent()) {
            long last = stored.get().getLastReconciledHeight();
            acc.lastReconciled = last;
            start = Math.max(configuredStart, last + 1);
            log.info("Resuming after checkpoint {} (configured start {})", last, configuredStart);
        }

        GovernedEndpoint primary = endpointFactory.create(config.primaryEndpoint());
        GovernedEndpoint secondary = endpointFactory.create(config.secondaryEndpoint());

        state = EngineState.RESOLVING_RANGE;
        long end;
        try {
            end = resolveEnd(config, primary, secondary);
        } catch (RangeResolutionException e) {
            if (cancelRequested) {
                log.info("Cancelled while resolving the range");
                acc.state = EngineState.CANCELLED;
                return finish(acc);
            }
            log.error("Range resolution failed: {}", e.getMessage());
            return finish(acc.failed(e.getMessage()));
        }
        HeightRange range = new HeightRange(start, end);
        acc.range = range;
        if (range.isEmpty()) {
            log.info("Nothing to reconcile: start {} is past end {}", start, end);
            acc.state = EngineState.COMPLETED;
            return finish(acc);
        }
        if (cancelRequested) {
            acc.state = EngineState.CANCELLED;
            return finish(acc);
        }

        state = EngineState.RUNNING;
        log.info("Reconciling {} {} blocks {} ({} blocks) with {} workers: primary={} secondary={}",
                config.chain(), config.protocol(), range, range.size(), config.threadCount(),
                config.primaryEndpoint(), config.secondaryEndpoint());
        FetchCompareTask task = new FetchCompareTask(primary, secondary, config.chain(), config.protocol(),
                comparatorRegistry.forProtocol(config.protocol()));
        BlockTaskScheduler scheduler = new BlockTaskScheduler(task, engineProperties.getReorderWindowFactor());
        progressTracker.start(range);
        try (ScheduledRun run = scheduler.run(range, config.threadCount())) {
            activeRun = run;
            if (cancelRequested) {
                run.cancel(gracePeriod());
            }
            consume(run, key, acc);
        } catch (CheckpointIOException e) {
            log.error("Checkpoint write failed: {}", e.getMessage());
            acc.failure = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Run aborted at height {}", acc.nextExpected(), e);
            acc.failure = "unexpected failure: " + e;
        } finally {
            activeRun = null;
            progressTracker.finish();
        }

        if (acc.failure != null) {
            acc.state = EngineState.FAILED;
        } else if (acc.lastFinalized != null && acc.lastFinalized == range.end()) {
            acc.state = EngineState.COMPLETED;
        } else if (cancelRequested) {
            acc.state = EngineState.CANCELLED;
        } else {
            acc.state = EngineState.FAILED;
            acc.failure = "result stream ended before height " + acc.nextExpected();
        }
        return finish(acc);
    }

    private void consume(ScheduledRun run, CheckpointKey key, RunAccumulator acc) {
        while (run.hasNext()) {
            BlockResult result = run.next();
            reportSink.onBlock(result);
            acc.record(result, engineProperties.getHeightBucketSize());
            progressTracker.blockFinalized(result.height());
            if (result.status() == BlockStatus.OK) {
                advance(key, result.height(), acc);
            } else if (result.status() == BlockStatus.FETCH_FAILED && engineProperties.isTolerateGaps()) {
                advance(key, result.height(), acc);
            } else if (result.status() == BlockStatus.FETCH_FAILED) {
                acc.failure = "height " + result.height() + " could not be fetched: " + result.detail();
                return;
            } else {
                acc.failure = "height " + result.height() + ": " + result.detail();
                return;
            }
        }
    }

    private void advance(CheckpointKey key, long height, RunAccumulator acc) {
        checkpointStore.save(Checkpoint.of(key, height, clock.instant()));
        acc.lastReconciled = height;
        acc.lastFinalized = height;
    }

    /**
     * Both tips are always queried: {@code tip} also checks each endpoint's network, and a configured end
     * past either tip is cut back to the lower tip.
     */
    private long resolveEnd(RunConfig config, GovernedEndpoint primary, GovernedEndpoint secondary) {
        long primaryTip = tipOf(primary, config);
        long secondaryTip = tipOf(secondary, config);
        long commonTip = Math.min(primaryTip, secondaryTip);
        Long configuredEnd = config.endHeight();
        if (configuredEnd == null) {
            log.info("Tips: primary {} secondary {}; reconciling up to {}", primaryTip, secondaryTip, commonTip);
            return commonTip;
        }
        if (configuredEnd > commonTip) {
            log.warn("Configured end {} is past the common tip {} (primary {}, secondary {}); reconciling up to {}",
                    configuredEnd, commonTip, primaryTip, secondaryTip, commonTip);
            return commonTip;
        }
        return configuredEnd;
    }

    private long tipOf(GovernedEndpoint endpoint, RunConfig config) {
        try {
            return endpoint.tip(config.chain(), () -> cancelRequested);
        } catch (EndpointException | FetchAbortedException e) {
            throw new RangeResolutionException("Cannot resolve tip of " + endpoint.baseUrl() + ": " + e.getMessage(), e);
        }
    }

    private Duration gracePeriod() {
        return Duration.ofMillis(Math.max(0L, engineProperties.getShutdownGracePeriodMs()));
    }

    private RunSummary finish(RunAccumulator acc) {
        if (acc.state == null) {
            acc.state = EngineState.FAILED;
        }
        state = acc.state;
        RunSummary summary = acc.toSummary(Duration.between(acc.startedAt, clock.instant()));
        reportSink.onSummary(summary);
        return summary;
    }

    /** Mutable run totals, touched only by the engine thread. */
    private static final class RunAccumulator {
        private final Instant startedAt;
        private final Map<DivergenceKind, Long> byKind = new EnumMap<>(DivergenceKind.class);
        private final TreeMap<Long, Long> byBucket = new TreeMap<>();
        private final List<Long> unverified = new ArrayList<>();
        private EngineState state;
        private HeightRange range;
        private long processed;
        private long divergentBlocks;
        private Long lastReconciled;
        private Long lastFinalized;
        private String failure;

        private RunAccumulator(Instant startedAt) {
            this.startedAt = startedAt;
        }

        private RunAccumulator failed(String reason) {
            this.state = EngineState.FAILED;
            this.failure = reason;
            return this;
        }

        private void record(BlockResult result, long bucketSize) {
            processed++;
            if (result.status() == BlockStatus.FETCH_FAILED) {
                unverified.add(result.height());
            }
            if (result.hasDivergences()) {
                divergentBlocks++;
                long bucket = bucketSize > 0 ? (result.height() / bucketSize) * bucketSize : 0;
                for (DivergenceEntry d : result.divergences()) {
                    byKind.merge(d.kind(), 1L, Long::sum);
                    byBucket.merge(bucket, 1L, Long::sum);
                }
            }
        }

        private long nextExpected() {
            if (lastFinalized != null) {
                return lastFinalized + 1;
            }
            return range == null ? -1 : range.start();
        }

        private RunSummary toSummary(Duration elapsed) {
            return new RunSummary(state, range, processed, divergentBlocks, lastReconciled,
                    byKind, byBucket, unverified, failure, elapsed);
        }
    }
}

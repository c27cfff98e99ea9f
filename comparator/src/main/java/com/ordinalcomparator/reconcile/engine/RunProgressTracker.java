package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.HeightRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic progress line while a run is RUNNING: processed/total, last reconciled height, throughput.
 */
@Component
@Slf4j
public class RunProgressTracker {

    private final Clock clock;
    private volatile Progress current;

    public RunProgressTracker(Clock clock) {
        this.clock = clock;
    }

    public void start(HeightRange range) {
        current = new Progress(range, clock.instant());
    }

    public void blockFinalized(long height) {
        Progress p = current;
        if (p != null) {
            p.processed.incrementAndGet();
            p.lastHeight.set(height);
        }
    }

    public void finish() {
        current = null;
    }

    @Scheduled(fixedDelayString = "${comparator.engine.progress-interval-ms:10000}",
            initialDelayString = "${comparator.engine.progress-interval-ms:10000}")
    public void logProgress() {
        Progress p = current;
        if (p == null) {
            return;
        }
        long processed = p.processed.get();
        long total = p.range.size();
        double seconds = Math.max(0.001, Duration.between(p.startedAt, clock.instant()).toMillis() / 1000.0);
        long last = p.lastHeight.get();
        log.info("Progress: {}/{} blocks ({}%), last reconciled {}, {} blocks/s",
                processed, total,
                String.format("%.1f", total == 0 ? 100.0 : processed * 100.0 / total),
                last < 0 ? "-" : last,
                String.format("%.2f", processed / seconds));
    }

    private static final class Progress {
        private final HeightRange range;
        private final Instant startedAt;
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong lastHeight = new AtomicLong(-1);

        private Progress(HeightRange range, Instant startedAt) {
            this.range = range;
            this.startedAt = startedAt;
        }
    }
}

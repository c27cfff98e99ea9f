package com.ordinalcomparator.cli;

import com.ordinalcomparator.domain.RunConfig;
import com.ordinalcomparator.reconcile.config.ComparatorRunProperties;
import com.ordinalcomparator.reconcile.config.EngineProperties;
import com.ordinalcomparator.reconcile.engine.EngineState;
import com.ordinalcomparator.reconcile.engine.ReconciliationEngine;
import com.ordinalcomparator.reconcile.engine.RunSummary;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one reconciliation on startup and turns its terminal state into the process exit code:
 * COMPLETED 0, FAILED 1, CANCELLED 130. On JVM shutdown (Ctrl-C) the run is cancelled and shutdown
 * waits for the checkpoint to be persisted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "comparator.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ComparatorRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CANCELLED = 130;

    /** Extra time on top of the grace period for the summary and the last checkpoint write. */
    private static final long SHUTDOWN_SLACK_MS = 5_000;

    private final ReconciliationEngine engine;
    private final ComparatorRunProperties runProperties;
    private final EngineProperties engineProperties;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;
    private volatile int exitCode = EXIT_COMPLETED;

    @Override
    public void run(ApplicationArguments args) {
        RunConfig config = runProperties.toRunConfig();
        running = true;
        try {
            RunSummary summary = engine.run(config);
            exitCode = exitCodeFor(summary.state());
            if (summary.divergenceFound()) {
                log.warn("Divergences found between {} and {}", config.primaryEndpoint(), config.secondaryEndpoint());
            }
        } finally {
            running = false;
            finished.countDown();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(EngineState state) {
        return switch (state) {
            case COMPLETED -> EXIT_COMPLETED;
            case CANCELLED -> EXIT_CANCELLED;
            default -> EXIT_FAILED;
        };
    }

    @PreDestroy
    public void onShutdown() {
        if (!running) {
            return;
        }
        log.warn("Shutdown requested, cancelling reconciliation");
        engine.cancel();
        long waitMs = engineProperties.getShutdownGracePeriodMs() + SHUTDOWN_SLACK_MS;
        try {
            if (!finished.await(waitMs, TimeUnit.MILLISECONDS)) {
                log.error("Reconciliation did not stop within {} ms", waitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for reconciliation to stop");
        }
    }
}

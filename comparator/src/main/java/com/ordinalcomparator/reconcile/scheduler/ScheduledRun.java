package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.BlockStatus;
import com.ordinalcomparator.reconcile.endpoint.FetchAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Ordered stream of block results for one range. Closing it aborts outstanding work and shuts the
 * run's thread pools down.
 */
@Slf4j
public class ScheduledRun implements Iterator<BlockResult>, AutoCloseable {

    private final ReorderBuffer buffer;
    private final BlockTask task;
    private final ThreadPoolTaskExecutor workers;
    private final ThreadPoolTaskExecutor fetchers;

    private BlockResult peeked;
    private boolean exhausted;

    ScheduledRun(ReorderBuffer buffer, BlockTask task, int threadCount) {
        this.buffer = buffer;
        this.task = task;
        this.workers = pool("reconcile-worker-", threadCount);
        this.fetchers = pool("reconcile-fetch-", threadCount * 2);
        for (int i = 0; i < threadCount; i++) {
            workers.execute(this::workLoop);
        }
    }

    @Override
    public boolean hasNext() {
        if (peeked != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            Optional<BlockResult> next = buffer.next();
            if (next.isEmpty()) {
                exhausted = true;
                return false;
            }
            peeked = next.get();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for height {}", buffer.nextToRelease());
            exhausted = true;
            return false;
        }
    }

    @Override
    public BlockResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        BlockResult result = peeked;
        peeked = null;
        return result;
    }

    /**
     * Stops dispatch and lets in-flight heights finish for up to {@code grace}; the stream then ends at
     * the first height without a result.
     */
    public void cancel(Duration grace) {
        buffer.cancel(grace);
    }

    @Override
    public void close() {
        buffer.cancel(Duration.ZERO);
        workers.shutdown();
        fetchers.shutdown();
    }

    private void workLoop() {
        while (true) {
            OptionalLong claimed;
            try {
                claimed = buffer.claim();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (claimed.isEmpty()) {
                return;
            }
            long height = claimed.getAsLong();
            BlockResult result;
            try {
                result = task.execute(height, fetchers, buffer::isAbortRequested);
            } catch (FetchAbortedException e) {
                log.debug("Height {} abandoned: {}", height, e.getMessage());
                buffer.abandon(height);
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected failure at height {}", height, e);
                result = BlockResult.fatal(height, "unexpected failure: " + e);
            }
            if (result.status() == BlockStatus.FATAL) {
                buffer.stopDispatch();
            }
            buffer.complete(result);
        }
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int size) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix(prefix);
        e.setDaemon(true);
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}

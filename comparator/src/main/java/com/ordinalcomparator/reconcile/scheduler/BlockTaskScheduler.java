package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.HeightRange;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a {@link BlockTask} for every height of a range on a fixed worker pool and yields the results
 * in strictly increasing height order.
 */
@Slf4j
public class BlockTaskScheduler {

    private final BlockTask task;
    private final int reorderWindowFactor;

    public BlockTaskScheduler(BlockTask task, int reorderWindowFactor) {
        this.task = task;
        this.reorderWindowFactor = Math.max(1, reorderWindowFactor);
    }

    public ScheduledRun run(HeightRange range, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        long capacity = (long) threadCount * reorderWindowFactor;
        log.debug("Scheduling {} with {} workers, reorder window {}", range, threadCount, capacity);
        return new ScheduledRun(new ReorderBuffer(range, capacity), task, threadCount);
    }
}

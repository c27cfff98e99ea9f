package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.HeightRange;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out heights to workers and releases their results strictly in height order.
 * <p>
 * A worker may not claim a height while {@code claimed - released >= capacity}, which bounds memory
 * held by results parked behind a slow height. The released stream ends early when dispatch was stopped
 * and the next height was never claimed, when the next height was abandoned, or when the cancel deadline passes.
 */
class ReorderBuffer {

    private final ReentrantLock lock = new ReentrantLock();
    /** Signalled when the released watermark moves or dispatch stops. */
    private final Condition released = lock.newCondition();
    /** Signalled when a result or an abandonment arrives, or dispatch stops. */
    private final Condition arrived = lock.newCondition();

    private final long end;
    private final long capacity;
    private final TreeMap<Long, BlockResult> pending = new TreeMap<>();
    private final Set<Long> abandoned = new HashSet<>();

    private long nextToClaim;
    private long nextToRelease;
    private boolean dispatchStopped;
    private volatile boolean abortRequested;
    private long deadlineNanos;
    private boolean deadlineSet;
    private boolean finished;

    ReorderBuffer(HeightRange range, long capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.end = range.end();
        this.capacity = capacity;
        this.nextToClaim = range.start();
        this.nextToRelease = range.start();
    }

    /**
     * Next undispatched height, blocking while the window is full. Empty once dispatch stopped or
     * every height has been claimed.
     */
    OptionalLong claim() throws InterruptedException {
        lock.lock();
        try {
            while (!dispatchStopped && nextToClaim <= end && nextToClaim - nextToRelease >= capacity) {
                released.await();
            }
            if (dispatchStopped || nextToClaim > end) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(nextToClaim++);
        } finally {
            lock.unlock();
        }
    }

    void complete(BlockResult result) {
        lock.lock();
        try {
            pending.put(result.height(), result);
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** The task for {@code height} stopped without a result; the released stream ends before it. */
    void abandon(long height) {
        lock.lock();
        try {
            abandoned.add(height);
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** No further heights are handed out; in-flight heights still complete and are released. */
    void stopDispatch() {
        lock.lock();
        try {
            dispatchStopped = true;
            released.signalAll();
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops dispatch and asks in-flight tasks to abort at their next retry boundary. Results that arrive
     * within {@code grace} are still released in order.
     */
    void cancel(Duration grace) {
        lock.lock();
        try {
            abortRequested = true;
            dispatchStopped = true;
            long candidate = System.nanoTime() + Math.max(0L, grace.toNanos());
            if (!deadlineSet || candidate - deadlineNanos < 0) {
                deadlineNanos = candidate;
                deadlineSet = true;
            }
            released.signalAll();
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isAbortRequested() {
        return abortRequested;
    }

    /**
     * Next result in height order, blocking until it is available. Empty when the stream has ended.
     */
    Optional<BlockResult> next() throws InterruptedException {
        lock.lock();
        try {
            while (!finished) {
                if (nextToRelease > end) {
                    finished = true;
                    break;
                }
                BlockResult result = pending.remove(nextToRelease);
                if (result != null) {
                    nextToRelease++;
                    released.signalAll();
                    return Optional.of(result);
                }
                if (abandoned.contains(nextToRelease) || (dispatchStopped && nextToRelease >= nextToClaim)) {
                    finished = true;
                    break;
                }
                if (deadlineSet) {
                    long remaining = deadlineNanos - System.nanoTime();
                    if (remaining <= 0) {
                        finished = true;
                        break;
                    }
                    arrived.awaitNanos(remaining);
                } else {
                    arrived.await();
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    long nextToRelease() {
        lock.lock();
        try {
            return nextToRelease;
        } finally {
            lock.unlock();
        }
    }
}

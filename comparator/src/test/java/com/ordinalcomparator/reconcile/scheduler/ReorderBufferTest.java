package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.HeightRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ReorderBufferTest {

    @Test
    @DisplayName("results completed out of order are released in height order")
    void releasesInOrder() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(10, 12), 10);
        assertThat(buffer.claim()).isEqualTo(OptionalLong.of(10));
        assertThat(buffer.claim()).isEqualTo(OptionalLong.of(11));
        assertThat(buffer.claim()).isEqualTo(OptionalLong.of(12));
        assertThat(buffer.claim()).isEmpty();

        buffer.complete(BlockResult.ok(12, List.of()));
        buffer.complete(BlockResult.ok(11, List.of()));
        buffer.complete(BlockResult.ok(10, List.of()));

        assertThat(buffer.next()).map(BlockResult::height).contains(10L);
        assertThat(buffer.next()).map(BlockResult::height).contains(11L);
        assertThat(buffer.next()).map(BlockResult::height).contains(12L);
        assertThat(buffer.next()).isEmpty();
    }

    @Test
    @DisplayName("a worker cannot claim past the window until the lowest height is released")
    void claimBlocksWhenWindowFull() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(0, 10), 2);
        buffer.claim();
        buffer.claim();

        CompletableFuture<OptionalLong> third = CompletableFuture.supplyAsync(() -> {
            try {
                return buffer.claim();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        buffer.complete(BlockResult.ok(1, List.of()));
        Thread.sleep(100);
        assertThat(third).isNotDone();

        buffer.complete(BlockResult.ok(0, List.of()));
        assertThat(buffer.next()).map(BlockResult::height).contains(0L);
        assertThat(third.get(2, TimeUnit.SECONDS)).isEqualTo(OptionalLong.of(2));
    }

    @Test
    @DisplayName("the stream ends before an abandoned height")
    void abandonedHeightEndsStream() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(0, 5), 10);
        buffer.claim();
        buffer.claim();
        buffer.claim();
        buffer.complete(BlockResult.ok(0, List.of()));
        buffer.abandon(1);
        buffer.complete(BlockResult.ok(2, List.of()));

        assertThat(buffer.next()).map(BlockResult::height).contains(0L);
        assertThat(buffer.next()).isEmpty();
        assertThat(buffer.next()).isEmpty();
    }

    @Test
    void stopDispatch_drainsClaimedHeightsThenEnds() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(0, 100), 10);
        buffer.claim();
        buffer.claim();
        buffer.stopDispatch();

        assertThat(buffer.claim()).isEmpty();
        buffer.complete(BlockResult.ok(1, List.of()));
        buffer.complete(BlockResult.ok(0, List.of()));

        assertThat(buffer.next()).map(BlockResult::height).contains(0L);
        assertThat(buffer.next()).map(BlockResult::height).contains(1L);
        assertThat(buffer.next()).isEmpty();
    }

    @Test
    @DisplayName("cancel gives in-flight heights the grace period, then ends the stream")
    void cancel_waitsForGracePeriodOnly() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(0, 100), 10);
        buffer.claim();
        buffer.cancel(Duration.ofMillis(100));

        assertThat(buffer.isAbortRequested()).isTrue();
        long started = System.nanoTime();
        Optional<BlockResult> next = buffer.next();

        assertThat(next).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }

    @Test
    void emptyRange_endsImmediately() throws Exception {
        ReorderBuffer buffer = new ReorderBuffer(new HeightRange(5, 4), 4);

        assertThat(buffer.claim()).isEmpty();
        assertThat(buffer.next()).isEmpty();
    }
}

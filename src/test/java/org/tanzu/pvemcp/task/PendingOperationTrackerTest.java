package org.tanzu.pvemcp.task;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PendingOperationTrackerTest {

    private final TargetIdentity vm = TargetIdentity.vm("lab", "pve1", 101);

    @Test
    void setPendingIsAnUpsert() {
        PendingOperationTracker tracker = new PendingOperationTracker();

        tracker.setPending(vm, "Start");
        tracker.setPending(vm, "Stop");

        assertEquals(Optional.of("Stop"), tracker.isPending(vm));
        assertEquals(1, tracker.size());
    }

    @Test
    void markIfAbsentOnlyWinsOnce() {
        PendingOperationTracker tracker = new PendingOperationTracker();

        assertTrue(tracker.markIfAbsent(vm, "Start"));
        assertFalse(tracker.markIfAbsent(vm, "Stop"));
        assertEquals(Optional.of("Start"), tracker.isPending(vm));
    }

    @Test
    void clearPendingOfUnknownTargetIsNoOp() {
        PendingOperationTracker tracker = new PendingOperationTracker();

        tracker.clearPending(vm);

        assertFalse(tracker.hasAny());
        assertEquals(Optional.empty(), tracker.isPending(vm));
    }

    @Test
    void hasAnyFollowsMarkers() {
        PendingOperationTracker tracker = new PendingOperationTracker();
        assertFalse(tracker.hasAny());

        tracker.setPending(vm, "Reboot");
        assertTrue(tracker.hasAny());

        tracker.clearPending(vm);
        assertFalse(tracker.hasAny());
    }

    @Test
    void snapshotIsACopy() {
        PendingOperationTracker tracker = new PendingOperationTracker();
        tracker.setPending(vm, "Start");

        Map<TargetIdentity, String> snapshot = tracker.snapshot();
        tracker.clearPending(vm);

        assertEquals("Start", snapshot.get(vm));
        assertFalse(tracker.hasAny());
    }

    @Test
    void concurrentMarkIfAbsentHasOneWinner() throws Exception {
        PendingOperationTracker tracker = new PendingOperationTracker();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < 32; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (tracker.markIfAbsent(vm, "Start")) {
                    winners.incrementAndGet();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, winners.get());
    }
}

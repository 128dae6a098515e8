package org.tanzu.pvemcp.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Holds a target's pending marker until its observed state matches the state
 * an operation should have produced, then releases it.
 *
 * A finished remote call does not mean the cluster already reports the new
 * state (a migrated guest may take a while to show up on its new node). Instead
 * of sleeping for a fixed time, the monitor polls a {@link StateProbe} until it
 * reports the expected state or the maximum wait elapses. The pending marker is
 * cleared in both cases.
 */
public class StabilizationMonitor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StabilizationMonitor.class);

    /**
     * Checks whether a target has reached its expected post-operation state.
     */
    @FunctionalInterface
    public interface StateProbe {

        /**
         * @return true once the expected state is observed
         * @throws Exception if the state could not be read; treated as "not yet"
         */
        boolean isSettled() throws Exception;
    }

    private final PendingOperationTracker pendingTracker;
    private final ScheduledExecutorService scheduler;

    public StabilizationMonitor(PendingOperationTracker pendingTracker) {
        this(pendingTracker, Executors.newScheduledThreadPool(2, new CustomizableThreadFactory("pve-stabilize-")));
    }

    public StabilizationMonitor(PendingOperationTracker pendingTracker, ScheduledExecutorService scheduler) {
        this.pendingTracker = Objects.requireNonNull(pendingTracker, "pendingTracker");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Starts polling the probe and clears the target's pending marker when done.
     *
     * @param target The target whose pending marker is held
     * @param description What is being waited for, used in logs
     * @param probe The state check
     * @param pollInterval Delay between checks, also the delay before the first one
     * @param maxWait Upper bound on the wait
     * @return Future completed with true if the state settled, false on timeout,
     *         after the pending marker was cleared
     */
    public CompletableFuture<Boolean> awaitAsync(TargetIdentity target, String description, StateProbe probe,
                                                 Duration pollInterval, Duration maxWait) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(probe, "probe");
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + maxWait.toNanos();

        CompletableFuture<Boolean> released = result.whenComplete((settled, error) -> {
            pendingTracker.clearPending(target);
            if (Boolean.TRUE.equals(settled)) {
                logger.info("{} settled for {}", description, target);
            } else {
                logger.warn("{} did not settle for {} within {}s; pending state released anyway",
                        description, target, maxWait.getSeconds());
            }
        });

        schedule(() -> poll(target, description, probe, pollInterval, deadline, result), pollInterval, result);
        return released;
    }

    /**
     * Clears the pending marker right away, for operations that failed and so
     * have no state to wait for.
     */
    public void releaseNow(TargetIdentity target) {
        pendingTracker.clearPending(target);
    }

    private void poll(TargetIdentity target, String description, StateProbe probe,
                      Duration pollInterval, long deadline, CompletableFuture<Boolean> result) {
        if (result.isDone()) {
            return;
        }
        try {
            if (probe.isSettled()) {
                result.complete(true);
                return;
            }
        } catch (Exception e) {
            logger.debug("State probe for {} failed, will retry: {}", target, e.getMessage());
        }
        if (System.nanoTime() - deadline >= 0) {
            result.complete(false);
            return;
        }
        logger.debug("Waiting for {} on {}", description, target);
        schedule(() -> poll(target, description, probe, pollInterval, deadline, result), pollInterval, result);
    }

    private void schedule(Runnable check, Duration delay, CompletableFuture<Boolean> result) {
        try {
            scheduler.schedule(check, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Stabilization scheduler is shut down: {}", e.getMessage());
            result.complete(false);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

package org.tanzu.pvemcp.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous operation queue that serializes conflicting operations per target.
 *
 * At most one task per {@link TargetIdentity} is queued or running at any time;
 * a submission for a target that already has an active task, or still carries a
 * pending marker from an earlier one, is rejected with a conflict result. Tasks
 * for distinct targets run fully in parallel, each on its own worker thread.
 *
 * Every accepted task ends in COMPLETED or FAILED and its completion callback
 * runs exactly once, also when the operation throws. The queue marks a target
 * pending on acceptance but never clears the marker: callers release it once the
 * remote state has settled, see {@link StabilizationMonitor}.
 *
 * The queue lock only guards the in-memory bookkeeping. Operations, callbacks and
 * listeners always run outside of it.
 */
public class TaskQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);

    /** Default number of finished tasks kept for display */
    public static final int DEFAULT_HISTORY_SIZE = 50;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final PendingOperationTracker pendingTracker;
    private final ExecutorService executor;
    private final int historySize;

    private final Object lock = new Object();
    private final Map<TargetIdentity, Task> activeTasks = new LinkedHashMap<>();
    private final Deque<Task> history = new ArrayDeque<>();
    private final List<Runnable> updateListeners = new CopyOnWriteArrayList<>();
    private boolean closed;

    /**
     * Creates a queue with an unbounded cached worker pool.
     *
     * @param pendingTracker Tracker shared with the rest of the application
     * @param historySize Number of finished tasks to retain
     */
    public TaskQueue(PendingOperationTracker pendingTracker, int historySize) {
        this(pendingTracker, Executors.newCachedThreadPool(new CustomizableThreadFactory("pve-task-")), historySize);
    }

    public TaskQueue(PendingOperationTracker pendingTracker, ExecutorService executor, int historySize) {
        this.pendingTracker = Objects.requireNonNull(pendingTracker, "pendingTracker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.historySize = historySize > 0 ? historySize : DEFAULT_HISTORY_SIZE;
        logger.info("TaskQueue initialized (history size {})", this.historySize);
    }

    /**
     * Submits a task.
     *
     * On acceptance the target is marked pending with the task type as label and
     * the task is scheduled immediately. On rejection nothing changes: the existing
     * task keeps running and the result explains why the submission was refused.
     *
     * @param task A task that has not been submitted before
     * @return The acceptance result
     */
    public EnqueueResult enqueue(Task task) {
        Objects.requireNonNull(task, "task");
        TargetIdentity target = task.getTarget();
        EnqueueResult result;

        synchronized (lock) {
            if (task.getStatus() != null) {
                throw new IllegalStateException("Task " + task.getId() + " was already submitted");
            }
            if (closed) {
                result = EnqueueResult.closed(task);
            } else {
                Task existing = activeTasks.get(target);
                if (existing != null) {
                    result = EnqueueResult.conflict(task, existing, null);
                } else if (!pendingTracker.markIfAbsent(target, task.getType())) {
                    result = EnqueueResult.conflict(task, null, pendingTracker.isPending(target).orElse(""));
                } else {
                    task.markQueued(Instant.now());
                    activeTasks.put(target, task);
                    result = EnqueueResult.accepted(task);
                }
            }
        }

        if (!result.isAccepted()) {
            logger.info("Rejected task {} ({}): {}", task.getId(), result.getReason(), result.getMessage());
            return result;
        }

        logger.info("Queued task {} '{}' for {}", task.getId(), task.getType(), target);
        try {
            executor.execute(() -> runTask(task));
        } catch (RejectedExecutionException e) {
            logger.error("Worker pool refused task {}: {}", task.getId(), e.getMessage(), e);
            finish(task, TaskStatus.FAILED, null, new TaskExecutionException(task, e));
            return result;
        }
        notifyListeners();
        return result;
    }

    /**
     * Submits a batch of independent tasks. Each task is accepted or rejected on
     * its own; none waits for another.
     *
     * @param tasks Tasks for distinct targets
     * @return One summary for the whole batch
     */
    public BatchSubmissionSummary submitBatch(List<Task> tasks) {
        BatchSubmissionSummary summary = new BatchSubmissionSummary();
        for (Task task : tasks) {
            if (task == null) {
                summary.recordSkipped(null, "missing task");
                continue;
            }
            summary.record(task.getTarget(), enqueue(task));
        }
        logger.info("Batch submission: {}", summary);
        return summary;
    }

    private void runTask(Task task) {
        synchronized (lock) {
            task.markRunning(Instant.now());
        }
        logger.debug("Running task {} '{}' for {}", task.getId(), task.getType(), task.getTarget());
        notifyListeners();

        String resultLabel = null;
        Throwable failure = null;
        try {
            resultLabel = task.getOperation().execute();
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failure = new TaskExecutionException(task, t);
        }
        finish(task, failure == null ? TaskStatus.COMPLETED : TaskStatus.FAILED, resultLabel, failure);
    }

    private void finish(Task task, TaskStatus terminal, String resultLabel, Throwable failure) {
        synchronized (lock) {
            task.markFinished(terminal, resultLabel, failure, Instant.now());
            activeTasks.remove(task.getTarget(), task);
            history.addFirst(task);
            while (history.size() > historySize) {
                history.removeLast();
            }
        }

        if (failure != null) {
            logger.warn("Task {} '{}' failed for {}: {}", task.getId(), task.getType(), task.getTarget(), failure.getMessage());
        } else {
            logger.info("Task {} '{}' completed for {} ({})", task.getId(), task.getType(), task.getTarget(), resultLabel);
        }

        try {
            task.invokeCallbackOnce();
        } catch (Throwable t) {
            logger.error("Completion callback of task {} threw: {}", task.getId(), t.getMessage(), t);
        }
        notifyListeners();
    }

    /**
     * @return the queued or running task for the target, if any
     */
    public Optional<Task> getActiveTask(TargetIdentity target) {
        synchronized (lock) {
            return Optional.ofNullable(activeTasks.get(target));
        }
    }

    /**
     * Looks up the queued or running task of a guest.
     *
     * @param profileName Profile the guest belongs to
     * @param nodeName Node hosting the guest
     * @param vmid Guest id
     * @return The active task, if any
     */
    public Optional<Task> getActiveTaskForVM(String profileName, String nodeName, int vmid) {
        return getActiveTask(TargetIdentity.vm(profileName, nodeName, vmid));
    }

    /**
     * @return active tasks followed by finished tasks, most recent first
     */
    public List<Task> getAllTasks() {
        synchronized (lock) {
            List<Task> tasks = new ArrayList<>(activeTasks.size() + history.size());
            tasks.addAll(activeTasks.values());
            tasks.addAll(history);
            return tasks;
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return activeTasks.size();
        }
    }

    public PendingOperationTracker getPendingTracker() {
        return pendingTracker;
    }

    /**
     * Registers a listener notified after every task state change.
     * Listeners run on the thread that caused the change and must not block.
     */
    public void addUpdateListener(Runnable listener) {
        updateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void notifyListeners() {
        for (Runnable listener : updateListeners) {
            try {
                listener.run();
            } catch (Throwable t) {
                logger.warn("Task update listener threw: {}", t.getMessage(), t);
            }
        }
    }

    /**
     * Stops accepting tasks and waits a bounded time for running ones.
     * Running operations are not interrupted.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        logger.info("Closing TaskQueue ({} active tasks)", getActiveCount());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Task workers still running after {}s; leaving them to finish", SHUTDOWN_GRACE.getSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for task workers to finish");
        }
    }
}

package org.tanzu.pvemcp.task;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A queued unit of asynchronous work representing one state-changing operation
 * against one {@link TargetIdentity}.
 *
 * A task is owned by the {@link TaskQueue} from submission until it reaches a
 * terminal status. Its status, timestamps, result and error are only written by
 * the queue; everything else is fixed at construction. Readers see the latest
 * written values through the public getters.
 */
public class Task {

    private final String id;
    private final String type;
    private final String description;
    private final TargetIdentity target;
    private final TaskOperation operation;
    private final TaskCompletionCallback onComplete;

    private final AtomicBoolean callbackInvoked = new AtomicBoolean(false);
    private final CompletableFuture<Task> completion = new CompletableFuture<>();

    private volatile TaskStatus status;
    private volatile Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String resultLabel;
    private volatile Throwable error;

    /**
     * Creates a new task.
     *
     * @param type Short operation label shown to users (e.g. "Start", "Migrate")
     * @param description Human readable description
     * @param target The resource the operation changes
     * @param operation The remote work to perform
     * @param onComplete Optional callback invoked exactly once on completion
     */
    public Task(String type, String description, TargetIdentity target,
                TaskOperation operation, TaskCompletionCallback onComplete) {
        this.id = UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(type, "type");
        this.description = description != null ? description : type;
        this.target = Objects.requireNonNull(target, "target");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.onComplete = onComplete;
    }

    public Task(String type, String description, TargetIdentity target, TaskOperation operation) {
        this(type, description, target, operation, null);
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public String getDescription() { return description; }
    public TargetIdentity getTarget() { return target; }
    public TaskStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getResultLabel() { return resultLabel; }
    public Throwable getError() { return error; }

    /**
     * Future completed with this task once it is terminal and its callback has run.
     * Never completed exceptionally; inspect {@link #getStatus()} and {@link #getError()}.
     *
     * @return The completion future
     */
    public CompletableFuture<Task> getCompletion() {
        return completion;
    }

    public boolean isActive() {
        TaskStatus current = status;
        return current != null && current.isActive();
    }

    TaskOperation getOperation() {
        return operation;
    }

    void markQueued(Instant now) {
        this.status = TaskStatus.QUEUED;
        this.createdAt = now;
    }

    void markRunning(Instant now) {
        this.status = TaskStatus.RUNNING;
        this.startedAt = now;
    }

    void markFinished(TaskStatus terminal, String resultLabel, Throwable error, Instant now) {
        this.resultLabel = resultLabel;
        this.error = error;
        this.finishedAt = now;
        this.status = terminal;
    }

    /**
     * Runs the completion callback unless it already ran.
     *
     * @return true if this call was the one that ran it
     */
    boolean invokeCallbackOnce() {
        if (!callbackInvoked.compareAndSet(false, true)) {
            return false;
        }
        try {
            if (onComplete != null) {
                onComplete.onComplete(error);
            }
        } finally {
            completion.complete(this);
        }
        return true;
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', target=" + target +
               ", status=" + status + (error != null ? ", error='" + error.getMessage() + "'" : "") + "}";
    }
}

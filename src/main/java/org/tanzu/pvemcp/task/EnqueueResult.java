package org.tanzu.pvemcp.task;

/**
 * Outcome of {@link TaskQueue#enqueue(Task)}.
 *
 * A rejected submission carries a reason: {@value #REASON_CONFLICT} when the
 * target already has an active task or pending marker, {@value #REASON_CLOSED}
 * when the queue no longer accepts work.
 */
public class EnqueueResult {

    public static final String REASON_ACCEPTED = "accepted";
    public static final String REASON_CONFLICT = "conflict";
    public static final String REASON_CLOSED = "closed";

    private final boolean accepted;
    private final String reason;
    private final Task task;
    private final String message;

    private EnqueueResult(boolean accepted, String reason, Task task, String message) {
        this.accepted = accepted;
        this.reason = reason;
        this.task = task;
        this.message = message;
    }

    static EnqueueResult accepted(Task task) {
        return new EnqueueResult(true, REASON_ACCEPTED, task, task.getType() + " queued for " + task.getTarget());
    }

    static EnqueueResult conflict(Task submitted, Task existing, String pendingLabel) {
        String detail;
        if (existing != null) {
            detail = "task '" + existing.getType() + "' (" + existing.getStatus() + ") already active";
        } else {
            detail = "operation '" + pendingLabel + "' still pending";
        }
        return new EnqueueResult(false, REASON_CONFLICT, existing,
                submitted.getType() + " rejected for " + submitted.getTarget() + ": " + detail);
    }

    static EnqueueResult closed(Task submitted) {
        return new EnqueueResult(false, REASON_CLOSED, null,
                submitted.getType() + " rejected for " + submitted.getTarget() + ": task queue is closed");
    }

    public boolean isAccepted() { return accepted; }
    public String getReason() { return reason; }
    public String getMessage() { return message; }

    /**
     * @return the accepted task, or the conflicting active task when known, otherwise null
     */
    public Task getTask() { return task; }

    public boolean isConflict() {
        return REASON_CONFLICT.equals(reason);
    }

    @Override
    public String toString() {
        return "EnqueueResult{accepted=" + accepted + ", reason='" + reason + "', message='" + message + "'}";
    }
}

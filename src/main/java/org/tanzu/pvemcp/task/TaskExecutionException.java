package org.tanzu.pvemcp.task;

/**
 * Failure of a task's operation, attributed to the task and its target.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskId;
    private final TargetIdentity target;

    public TaskExecutionException(Task task, Throwable cause) {
        super(task.getType() + " failed for " + task.getTarget() + ": " + describe(cause), cause);
        this.taskId = task.getId();
        this.target = task.getTarget();
    }

    public String getTaskId() { return taskId; }
    public TargetIdentity getTarget() { return target; }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}

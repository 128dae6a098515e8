package org.tanzu.pvemcp.task;

/**
 * Callback invoked exactly once when a task reaches a terminal status.
 */
@FunctionalInterface
public interface TaskCompletionCallback {

    /**
     * @param error null when the task completed successfully, otherwise the failure
     */
    void onComplete(Throwable error);
}

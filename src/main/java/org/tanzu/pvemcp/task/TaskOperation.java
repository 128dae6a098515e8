package org.tanzu.pvemcp.task;

/**
 * The unit of remote work a {@link Task} performs.
 *
 * Implementations invoke blocking calls on a cluster API client and return a
 * short result label (typically the remote task's exit status). Any exception
 * thrown is reported as the task's failure.
 */
@FunctionalInterface
public interface TaskOperation {

    /**
     * Executes the operation. Called exactly once per accepted task.
     *
     * @return A short label describing the result, may be null
     * @throws Exception if the operation failed
     */
    String execute() throws Exception;
}

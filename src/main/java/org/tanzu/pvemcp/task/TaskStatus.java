package org.tanzu.pvemcp.task;

/**
 * Lifecycle status of a {@link Task}.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    /**
     * @return true for QUEUED and RUNNING
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }
}

/**
 * Per-target operation queue.
 *
 * <p>{@link org.tanzu.pvemcp.task.TaskQueue} runs state-changing operations concurrently while
 * keeping at most one active task per {@link org.tanzu.pvemcp.task.TargetIdentity}.
 * {@link org.tanzu.pvemcp.task.PendingOperationTracker} records which targets have an outstanding
 * operation and {@link org.tanzu.pvemcp.task.StabilizationMonitor} releases those markers once the
 * cluster reports the expected state.
 */
package org.tanzu.pvemcp.task;

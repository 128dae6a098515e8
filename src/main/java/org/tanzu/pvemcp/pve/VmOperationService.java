package org.tanzu.pvemcp.pve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.tanzu.pvemcp.aggregator.ClusterAggregator;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.task.BatchSubmissionSummary;
import org.tanzu.pvemcp.task.EnqueueResult;
import org.tanzu.pvemcp.task.PendingOperationTracker;
import org.tanzu.pvemcp.task.StabilizationMonitor;
import org.tanzu.pvemcp.task.StabilizationMonitor.StateProbe;
import org.tanzu.pvemcp.task.TargetIdentity;
import org.tanzu.pvemcp.task.Task;
import org.tanzu.pvemcp.task.TaskCompletionCallback;
import org.tanzu.pvemcp.task.TaskOperation;
import org.tanzu.pvemcp.task.TaskQueue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds guest and node operations and submits them to the {@link TaskQueue}.
 *
 * Every operation runs as a task that resolves the profile's client through the
 * {@link ClusterAggregator}, issues the lifecycle call and waits for the
 * Proxmox task it started. The target's pending marker, set by the queue on
 * acceptance, is kept after a successful task until the
 * {@link StabilizationMonitor} observes the expected state:
 * - Start: guest running
 * - Stop, Shutdown: guest stopped
 * - Reboot, Reset: guest running with an uptime that restarted
 * - Migrate: guest listed on the target node (and running if it was running)
 * - Delete: guest no longer listed
 *
 * A failed task releases the marker right away.
 */
@Service
public class VmOperationService {

    private static final Logger logger = LoggerFactory.getLogger(VmOperationService.class);

    private final TaskQueue taskQueue;
    private final ClusterAggregator aggregator;
    private final StabilizationMonitor stabilizationMonitor;
    private final RemoteTaskAwaiter remoteTaskAwaiter;
    private final Duration pollInterval;
    private final Duration maxWait;

    @Autowired
    public VmOperationService(TaskQueue taskQueue, ClusterAggregator aggregator,
                              StabilizationMonitor stabilizationMonitor, RemoteTaskAwaiter remoteTaskAwaiter,
                              PveProperties pveProperties) {
        this(taskQueue, aggregator, stabilizationMonitor, remoteTaskAwaiter,
                pveProperties.getStabilization().getPollInterval(),
                pveProperties.getStabilization().getMaxWait());
    }

    public VmOperationService(TaskQueue taskQueue, ClusterAggregator aggregator,
                              StabilizationMonitor stabilizationMonitor, RemoteTaskAwaiter remoteTaskAwaiter,
                              Duration pollInterval, Duration maxWait) {
        this.taskQueue = taskQueue;
        this.aggregator = aggregator;
        this.stabilizationMonitor = stabilizationMonitor;
        this.remoteTaskAwaiter = remoteTaskAwaiter;
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
    }

    public EnqueueResult submitVmOperation(VmOperationType type, VmInfo vm) {
        return submitVmOperation(type, vm, null);
    }

    /**
     * Submits one guest operation.
     *
     * @param type The operation
     * @param vm The guest, as listed by the aggregator (source profile set)
     * @param options Migration target; required for {@link VmOperationType#MIGRATE}, ignored otherwise
     * @return The queue's decision; a conflict means another operation on the guest is in flight
     * @throws IllegalArgumentException if migration options are missing or point to the guest's own node
     */
    public EnqueueResult submitVmOperation(VmOperationType type, VmInfo vm, MigrationOptions options) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(vm, "vm");
        if (type == VmOperationType.MIGRATE) {
            if (options == null || options.getTargetNode() == null || options.getTargetNode().isEmpty()) {
                throw new IllegalArgumentException("Migration requires a target node");
            }
            if (options.getTargetNode().equals(vm.getNode())) {
                throw new IllegalArgumentException("VM " + vm.getId() + " is already on node " + vm.getNode());
            }
        }

        TargetIdentity target = vm.toTarget();
        String profileName = vm.getSourceProfile();
        String description = describe(type, vm, options);
        Instant submittedAt = Instant.now();

        TaskOperation operation = () -> {
            PveClient client = clientFor(profileName);
            String upid = invoke(type, client, vm, options);
            return remoteTaskAwaiter.await(client, vm.getNode(), upid);
        };
        TaskCompletionCallback onComplete = error -> {
            if (error != null) {
                stabilizationMonitor.releaseNow(target);
                return;
            }
            stabilizationMonitor.awaitAsync(target, description, probeFor(type, vm, options, submittedAt),
                    pollInterval, maxWait);
        };

        logger.info("=== VM OPERATION: {} ===", description);
        return taskQueue.enqueue(new Task(type.getLabel(), description, target, operation, onComplete));
    }

    /**
     * Submits a node power operation. The call returns once Proxmox accepted
     * the request; the pending marker is held until the node is seen restarted
     * (reboot) or offline (shutdown).
     */
    public EnqueueResult submitNodeOperation(NodeOperationType type, String profileName, String nodeName) {
        Objects.requireNonNull(type, "type");
        TargetIdentity target = TargetIdentity.node(profileName, nodeName);
        String description = type.getLabel() + " " + nodeName + " [" + profileName + "]";
        Instant submittedAt = Instant.now();

        TaskOperation operation = () -> {
            PveClient client = clientFor(profileName);
            String upid = type == NodeOperationType.REBOOT
                    ? client.rebootNode(nodeName)
                    : client.shutdownNode(nodeName);
            return upid == null || upid.isEmpty() ? RemoteTaskAwaiter.SYNCHRONOUS_OK : upid;
        };
        TaskCompletionCallback onComplete = error -> {
            if (error != null) {
                stabilizationMonitor.releaseNow(target);
                return;
            }
            StateProbe probe = type == NodeOperationType.REBOOT
                    ? () -> findNode(profileName, nodeName)
                            .map(node -> node.isOnline() && node.getUptime() <= secondsSince(submittedAt))
                            .orElse(false)
                    : () -> findNode(profileName, nodeName)
                            .map(node -> !node.isOnline())
                            .orElse(true);
            stabilizationMonitor.awaitAsync(target, description, probe, pollInterval, maxWait);
        };

        logger.info("=== NODE OPERATION: {} ===", description);
        return taskQueue.enqueue(new Task(type.getLabel(), description, target, operation, onComplete));
    }

    public BatchSubmissionSummary submitBatch(VmOperationType type, List<VmInfo> vms, boolean exclusive) {
        return submitBatch(type, vms, null, exclusive);
    }

    /**
     * Submits the same operation for several guests. Guests the operation does
     * not apply to are skipped, as are guests with an operation in flight.
     *
     * @param exclusive Refuse the whole batch while any operation is pending
     * @throws IllegalStateException if {@code exclusive} is set and operations are pending
     */
    public BatchSubmissionSummary submitBatch(VmOperationType type, List<VmInfo> vms, MigrationOptions options,
                                              boolean exclusive) {
        PendingOperationTracker tracker = taskQueue.getPendingTracker();
        if (exclusive && tracker.hasAny()) {
            throw new IllegalStateException("Batch refused: " + tracker.size() + " operation(s) still pending");
        }

        BatchSubmissionSummary summary = new BatchSubmissionSummary();
        for (VmInfo vm : vms) {
            TargetIdentity target = vm.toTarget();
            if (!type.isEligible(vm)) {
                summary.recordSkipped(target, type.getLabel() + " not applicable to " + vm.getType()
                        + " in state " + vm.getStatus());
                continue;
            }
            try {
                summary.record(target, submitVmOperation(type, vm, options));
            } catch (IllegalArgumentException e) {
                summary.recordFailed(target, e.getMessage());
            }
        }
        logger.info("Batch {} for {} VM(s): {}", type.getLabel(), vms.size(), summary);
        return summary;
    }

    private PveClient clientFor(String profileName) {
        return aggregator.getClient(profileName)
            .orElseThrow(() -> new PveApiException(profileName, "Profile is not connected"));
    }

    private static String invoke(VmOperationType type, PveClient client, VmInfo vm, MigrationOptions options) {
        switch (type) {
            case START:
                return client.startVm(vm);
            case STOP:
                return client.stopVm(vm);
            case SHUTDOWN:
                return client.shutdownVm(vm);
            case REBOOT:
                return client.rebootVm(vm);
            case RESET:
                return client.resetVm(vm);
            case MIGRATE:
                return client.migrateVm(vm, options);
            case DELETE:
                return client.deleteVm(vm);
            default:
                throw new IllegalArgumentException("Unsupported operation: " + type);
        }
    }

    private StateProbe probeFor(VmOperationType type, VmInfo vm, MigrationOptions options, Instant submittedAt) {
        String profileName = vm.getSourceProfile();
        switch (type) {
            case START:
                return () -> fetch(vm, vm.getNode()).isRunning();
            case STOP:
            case SHUTDOWN:
                return () -> VmInfo.STATUS_STOPPED.equals(fetch(vm, vm.getNode()).getStatus());
            case REBOOT:
            case RESET:
                return () -> {
                    VmInfo current = fetch(vm, vm.getNode());
                    return current.isRunning() && current.getUptime() < vm.getUptime() + secondsSince(submittedAt);
                };
            case MIGRATE:
                return () -> {
                    VmInfo moved = fetch(vm, options.getTargetNode());
                    return !vm.isRunning() || moved.isRunning();
                };
            case DELETE:
                return () -> clientFor(profileName).getClusterResources().getVms().stream()
                    .noneMatch(listed -> listed.getId() == vm.getId());
            default:
                return () -> true;
        }
    }

    private VmInfo fetch(VmInfo vm, String node) {
        return aggregator.fetchVm(vm.getSourceProfile(), node, vm.getType(), vm.getId());
    }

    private Optional<NodeInfo> findNode(String profileName, String nodeName) {
        return clientFor(profileName).getClusterResources().getNodes().stream()
            .filter(node -> nodeName.equals(node.getName()))
            .findFirst();
    }

    private static long secondsSince(Instant start) {
        return Duration.between(start, Instant.now()).getSeconds();
    }

    private static String describe(VmOperationType type, VmInfo vm, MigrationOptions options) {
        StringBuilder description = new StringBuilder()
            .append(type.getLabel()).append(' ')
            .append(vm.getType()).append(' ').append(vm.getId());
        if (vm.getName() != null && !vm.getName().isEmpty()) {
            description.append(" (").append(vm.getName()).append(')');
        }
        description.append(" on ").append(vm.getNode());
        if (type == VmOperationType.MIGRATE) {
            description.append(" to ").append(options.getTargetNode())
                .append(options.isOnlineFor(vm) ? " (online)" : " (offline)");
        }
        return description.append(" [").append(vm.getSourceProfile()).append(']').toString();
    }
}

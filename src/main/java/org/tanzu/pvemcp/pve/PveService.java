package org.tanzu.pvemcp.pve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.pvemcp.aggregator.AggregatedView;
import org.tanzu.pvemcp.aggregator.ClusterAggregator;
import org.tanzu.pvemcp.aggregator.ConnectionSummary;
import org.tanzu.pvemcp.task.BatchSubmissionSummary;
import org.tanzu.pvemcp.task.EnqueueResult;
import org.tanzu.pvemcp.task.PendingOperationTracker;
import org.tanzu.pvemcp.task.TargetIdentity;
import org.tanzu.pvemcp.task.Task;
import org.tanzu.pvemcp.task.TaskQueue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service class that provides MCP (Model Context Protocol) tools for Proxmox VE.
 *
 * This service is the bridge between the MCP server and the operation core. Read
 * tools answer from the {@link ClusterAggregator}'s merged view; state-changing
 * tools submit tasks through the {@link VmOperationService} and return right
 * away with the queue's decision. Progress can then be followed with the task
 * and pending-operation tools.
 *
 * Guests are addressed by (profile, node, vmid) because guest ids are only
 * unique within one cluster.
 */
@Service
public class PveService {

    private static final Logger logger = LoggerFactory.getLogger(PveService.class);

    private final ClusterAggregator aggregator;
    private final VmOperationService vmOperationService;
    private final TaskQueue taskQueue;

    public PveService(ClusterAggregator aggregator, VmOperationService vmOperationService, TaskQueue taskQueue) {
        this.aggregator = aggregator;
        this.vmOperationService = vmOperationService;
        this.taskQueue = taskQueue;
        logger.info("PveService initialized");
    }

    @Tool(description = "Get the connection status of every configured Proxmox VE profile (cluster): connected, degraded and failed counts with per-profile errors")
    public ConnectionSummary getConnectionSummary() {
        logger.info("=== MCP TOOL CALLED: getConnectionSummary() ===");
        return aggregator.getConnectionSummary();
    }

    /**
     * MCP tool: Lists cluster nodes across all connected profiles.
     *
     * Uses the last refreshed view; the first call triggers a refresh.
     *
     * @param profile Optional profile name to filter on
     * @return Nodes ordered by profile and name
     */
    @Tool(description = "List Proxmox VE nodes across all connected clusters, optionally only those of one profile")
    public List<NodeInfo> listNodes(
            @ToolParam(description = "Profile name to filter on; omit for all profiles", required = false) String profile) {
        logger.info("=== MCP TOOL CALLED: listNodes({}) ===", profile);
        try {
            return currentView().getNodes().stream()
                .filter(node -> profile == null || profile.isEmpty() || profile.equals(node.getSourceProfile()))
                .collect(Collectors.toList());
        } catch (Exception e) {
            logger.error("Failed to list nodes: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list nodes: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: Lists guests (QEMU VMs and LXC containers) across all connected profiles.
     *
     * @param profile Optional profile name to filter on
     * @return Guests ordered by profile, node and id; stale entries come from a profile that missed the last refresh
     */
    @Tool(description = "List virtual machines and containers across all connected Proxmox VE clusters, optionally only those of one profile")
    public List<VmInfo> listVms(
            @ToolParam(description = "Profile name to filter on; omit for all profiles", required = false) String profile) {
        logger.info("=== MCP TOOL CALLED: listVms({}) ===", profile);
        try {
            AggregatedView view = currentView();
            return profile == null || profile.isEmpty() ? view.getVms() : view.getVmsForProfile(profile);
        } catch (Exception e) {
            logger.error("Failed to list VMs: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list VMs: " + e.getMessage(), e);
        }
    }

    @Tool(description = "Refresh nodes and VMs from every connected Proxmox VE cluster and return the counts")
    public RefreshResult refreshResources() {
        logger.info("=== MCP TOOL CALLED: refreshResources() ===");
        try {
            AggregatedView view = aggregator.getGroupClusterResources();
            return new RefreshResult(view.getNodes().size(), view.getVms().size(), view.getRefreshedAt(),
                    view.getRefreshFailures());
        } catch (Exception e) {
            logger.error("Failed to refresh resources: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to refresh resources: " + e.getMessage(), e);
        }
    }

    @Tool(description = "Start a stopped VM or container. The operation runs in the background; use getActiveTask to follow it")
    public OperationResult startVm(@ToolParam(description = "Profile name") String profile,
                                   @ToolParam(description = "Node the guest is on") String node,
                                   @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.START, profile, node, vmid, null);
    }

    @Tool(description = "Stop (power off) a running VM or container immediately")
    public OperationResult stopVm(@ToolParam(description = "Profile name") String profile,
                                  @ToolParam(description = "Node the guest is on") String node,
                                  @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.STOP, profile, node, vmid, null);
    }

    @Tool(description = "Gracefully shut down a running VM or container")
    public OperationResult shutdownVm(@ToolParam(description = "Profile name") String profile,
                                      @ToolParam(description = "Node the guest is on") String node,
                                      @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.SHUTDOWN, profile, node, vmid, null);
    }

    @Tool(description = "Reboot a running VM or container")
    public OperationResult rebootVm(@ToolParam(description = "Profile name") String profile,
                                    @ToolParam(description = "Node the guest is on") String node,
                                    @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.REBOOT, profile, node, vmid, null);
    }

    @Tool(description = "Hard reset a running QEMU VM (not available for containers)")
    public OperationResult resetVm(@ToolParam(description = "Profile name") String profile,
                                   @ToolParam(description = "Node the guest is on") String node,
                                   @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.RESET, profile, node, vmid, null);
    }

    @Tool(description = "Delete a stopped VM or container permanently")
    public OperationResult deleteVm(@ToolParam(description = "Profile name") String profile,
                                    @ToolParam(description = "Node the guest is on") String node,
                                    @ToolParam(description = "Guest id") int vmid) {
        return vmOperation(VmOperationType.DELETE, profile, node, vmid, null);
    }

    @Tool(description = "Migrate a VM or container to another node of the same cluster. Running QEMU VMs migrate online unless online=false; containers are restarted on the target")
    public OperationResult migrateVm(@ToolParam(description = "Profile name") String profile,
                                     @ToolParam(description = "Node the guest is on") String node,
                                     @ToolParam(description = "Guest id") int vmid,
                                     @ToolParam(description = "Target node") String targetNode,
                                     @ToolParam(description = "Live migration for QEMU VMs; defaults to true for running VMs", required = false) Boolean online) {
        return vmOperation(VmOperationType.MIGRATE, profile, node, vmid, new MigrationOptions(targetNode, online));
    }

    /**
     * MCP tool: Runs one operation on several guests. Guests in the wrong state
     * or with an operation in flight are skipped.
     */
    @Tool(description = "Run the same operation (start, stop, shutdown, reboot, reset, migrate, delete) on several guests by id. Guests in the wrong state are skipped")
    public BatchResult batchVmOperation(
            @ToolParam(description = "Operation name: start, stop, shutdown, reboot, reset, migrate or delete") String operation,
            @ToolParam(description = "Guest ids") List<Integer> vmids,
            @ToolParam(description = "Profile name; required when an id exists in more than one profile", required = false) String profile,
            @ToolParam(description = "Target node, for migrate only", required = false) String targetNode,
            @ToolParam(description = "Refuse the batch while other operations are pending", required = false) Boolean exclusive) {
        logger.info("=== MCP TOOL CALLED: batchVmOperation({}, {}, {}) ===", operation, vmids, profile);
        try {
            VmOperationType type = VmOperationType.fromName(operation);
            AggregatedView view = currentView();
            List<VmInfo> selected = new ArrayList<>();
            Map<String, String> unresolved = new LinkedHashMap<>();
            for (Integer vmid : vmids) {
                List<VmInfo> matches = view.findVmsById(vmid).stream()
                    .filter(vm -> profile == null || profile.isEmpty() || profile.equals(vm.getSourceProfile()))
                    .collect(Collectors.toList());
                if (matches.size() == 1) {
                    selected.add(matches.get(0));
                } else {
                    unresolved.put(String.valueOf(vmid), matches.isEmpty()
                            ? "not found"
                            : "exists in several profiles; pass a profile");
                }
            }

            MigrationOptions options = type == VmOperationType.MIGRATE ? new MigrationOptions(targetNode, null) : null;
            BatchSubmissionSummary summary = vmOperationService.submitBatch(type, selected, options,
                    Boolean.TRUE.equals(exclusive));
            return BatchResult.from(summary, unresolved);
        } catch (Exception e) {
            logger.error("Failed to run batch {}: {}", operation, e.getMessage(), e);
            throw new RuntimeException("Failed to run batch " + operation + ": " + e.getMessage(), e);
        }
    }

    @Tool(description = "Reboot a Proxmox VE node")
    public OperationResult rebootNode(@ToolParam(description = "Profile name") String profile,
                                      @ToolParam(description = "Node name") String node) {
        return nodeOperation(NodeOperationType.REBOOT, profile, node);
    }

    @Tool(description = "Shut down a Proxmox VE node")
    public OperationResult shutdownNode(@ToolParam(description = "Profile name") String profile,
                                        @ToolParam(description = "Node name") String node) {
        return nodeOperation(NodeOperationType.SHUTDOWN, profile, node);
    }

    @Tool(description = "List queued and running operations followed by recently finished ones, most recent first")
    public List<TaskView> listTasks() {
        logger.info("=== MCP TOOL CALLED: listTasks() ===");
        return taskQueue.getAllTasks().stream().map(TaskView::from).collect(Collectors.toList());
    }

    /**
     * MCP tool: Lists the Proxmox task logs of all connected clusters.
     *
     * These are the tasks Proxmox itself records, including ones started outside
     * this server; {@link #listTasks()} shows the operations queued here.
     *
     * @param profile Optional profile name to filter on
     * @return Tasks tagged with their profile, newest first
     */
    @Tool(description = "List recent Proxmox VE cluster tasks (the task log of each cluster, including tasks started elsewhere) across all connected clusters, newest first")
    public List<ClusterTask> listClusterTasks(
            @ToolParam(description = "Profile name to filter on; omit for all profiles", required = false) String profile) {
        logger.info("=== MCP TOOL CALLED: listClusterTasks({}) ===", profile);
        try {
            return aggregator.getAggregatedTasks().stream()
                .filter(task -> profile == null || profile.isEmpty() || profile.equals(task.getSourceProfile()))
                .collect(Collectors.toList());
        } catch (Exception e) {
            logger.error("Failed to list cluster tasks: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list cluster tasks: " + e.getMessage(), e);
        }
    }

    @Tool(description = "Get the queued or running operation of one guest, if any")
    public TaskView getActiveTask(@ToolParam(description = "Profile name") String profile,
                                  @ToolParam(description = "Node the guest is on") String node,
                                  @ToolParam(description = "Guest id") int vmid) {
        logger.info("=== MCP TOOL CALLED: getActiveTask({}, {}, {}) ===", profile, node, vmid);
        return taskQueue.getActiveTaskForVM(profile, node, vmid).map(TaskView::from).orElse(null);
    }

    @Tool(description = "List guests and nodes with an operation in flight or still settling into their new state")
    public List<PendingView> listPendingOperations() {
        logger.info("=== MCP TOOL CALLED: listPendingOperations() ===");
        PendingOperationTracker tracker = taskQueue.getPendingTracker();
        List<PendingView> result = new ArrayList<>();
        for (Map.Entry<TargetIdentity, String> entry : tracker.snapshot().entrySet()) {
            result.add(new PendingView(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    @Tool(description = "Retry connecting every profile whose connection failed and return the new connection status")
    public ConnectionSummary reconnectFailedProfiles() {
        logger.info("=== MCP TOOL CALLED: reconnectFailedProfiles() ===");
        try {
            return aggregator.reconnectFailed();
        } catch (Exception e) {
            logger.error("Failed to reconnect profiles: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to reconnect profiles: " + e.getMessage(), e);
        }
    }

    private OperationResult vmOperation(VmOperationType type, String profile, String node, int vmid,
                                        MigrationOptions options) {
        logger.info("=== MCP TOOL CALLED: {}({}, {}, {}) ===", type.getLabel(), profile, node, vmid);
        try {
            VmInfo vm = resolveVm(profile, node, vmid);
            return OperationResult.from(vmOperationService.submitVmOperation(type, vm, options));
        } catch (Exception e) {
            logger.error("Failed to submit {} for VM {} on {}/{}: {}", type.getLabel(), vmid, profile, node,
                    e.getMessage(), e);
            throw new RuntimeException("Failed to submit " + type.getLabel() + " for VM " + vmid + ": "
                    + e.getMessage(), e);
        }
    }

    private OperationResult nodeOperation(NodeOperationType type, String profile, String node) {
        logger.info("=== MCP TOOL CALLED: {}({}, {}) ===", type.getLabel(), profile, node);
        try {
            return OperationResult.from(vmOperationService.submitNodeOperation(type, profile, node));
        } catch (Exception e) {
            logger.error("Failed to submit {} for {}/{}: {}", type.getLabel(), profile, node, e.getMessage(), e);
            throw new RuntimeException("Failed to submit " + type.getLabel() + " for node " + node + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Finds a guest in the current view, falling back to a live status read.
     */
    private VmInfo resolveVm(String profile, String node, int vmid) {
        Optional<VmInfo> listed = aggregator.findVm(TargetIdentity.vm(profile, node, vmid));
        if (listed.isPresent()) {
            return listed.get();
        }
        logger.debug("VM {} not in current view, reading {}/{} directly", vmid, profile, node);
        try {
            return aggregator.fetchVm(profile, node, VmInfo.TYPE_QEMU, vmid);
        } catch (PveApiException e) {
            return aggregator.fetchVm(profile, node, VmInfo.TYPE_LXC, vmid);
        }
    }

    private AggregatedView currentView() {
        AggregatedView view = aggregator.getCurrentView();
        if (view.getRefreshedAt() == null) {
            view = aggregator.getGroupClusterResources();
        }
        return view;
    }

    /**
     * Outcome of submitting one operation.
     */
    public static class OperationResult {
        private final boolean accepted;
        private final String reason;
        private final String message;
        private final String taskId;

        public OperationResult(boolean accepted, String reason, String message, String taskId) {
            this.accepted = accepted;
            this.reason = reason;
            this.message = message;
            this.taskId = taskId;
        }

        static OperationResult from(EnqueueResult result) {
            return new OperationResult(result.isAccepted(), result.getReason(), result.getMessage(),
                    result.isAccepted() ? result.getTask().getId() : null);
        }

        public boolean isAccepted() { return accepted; }
        public String getReason() { return reason; }
        public String getMessage() { return message; }
        public String getTaskId() { return taskId; }

        @Override
        public String toString() {
            return "OperationResult{accepted=" + accepted + ", reason='" + reason + "', message='" + message +
                   "', taskId='" + taskId + "'}";
        }
    }

    /**
     * Outcome of a batch submission, keyed by readable target names.
     */
    public static class BatchResult {
        private final int submitted;
        private final int skipped;
        private final int failed;
        private final Map<String, String> reasons;

        public BatchResult(int submitted, int skipped, int failed, Map<String, String> reasons) {
            this.submitted = submitted;
            this.skipped = skipped;
            this.failed = failed;
            this.reasons = reasons;
        }

        static BatchResult from(BatchSubmissionSummary summary, Map<String, String> unresolved) {
            Map<String, String> reasons = new LinkedHashMap<>();
            summary.getReasons().forEach((target, reason) -> reasons.put(String.valueOf(target), reason));
            unresolved.forEach((vmid, reason) -> reasons.put("vmid " + vmid, reason));
            return new BatchResult(summary.getSubmitted(), summary.getSkipped(),
                    summary.getFailed() + unresolved.size(), reasons);
        }

        public int getSubmitted() { return submitted; }
        public int getSkipped() { return skipped; }
        public int getFailed() { return failed; }
        public Map<String, String> getReasons() { return reasons; }

        @Override
        public String toString() {
            return "BatchResult{submitted=" + submitted + ", skipped=" + skipped + ", failed=" + failed +
                   ", reasons=" + reasons + "}";
        }
    }

    /**
     * Result of a resource refresh.
     */
    public static class RefreshResult {
        private final int nodes;
        private final int vms;
        private final Instant refreshedAt;
        private final Map<String, String> failures;

        public RefreshResult(int nodes, int vms, Instant refreshedAt, Map<String, String> failures) {
            this.nodes = nodes;
            this.vms = vms;
            this.refreshedAt = refreshedAt;
            this.failures = failures;
        }

        public int getNodes() { return nodes; }
        public int getVms() { return vms; }
        public Instant getRefreshedAt() { return refreshedAt; }
        public Map<String, String> getFailures() { return failures; }

        @Override
        public String toString() {
            return "RefreshResult{nodes=" + nodes + ", vms=" + vms + ", refreshedAt=" + refreshedAt +
                   ", failures=" + failures + "}";
        }
    }

    /**
     * Display form of a task.
     */
    public static class TaskView {
        private final String id;
        private final String type;
        private final String description;
        private final String target;
        private final String status;
        private final Instant createdAt;
        private final Instant startedAt;
        private final Instant finishedAt;
        private final String result;
        private final String error;

        public TaskView(String id, String type, String description, String target, String status,
                        Instant createdAt, Instant startedAt, Instant finishedAt, String result, String error) {
            this.id = id;
            this.type = type;
            this.description = description;
            this.target = target;
            this.status = status;
            this.createdAt = createdAt;
            this.startedAt = startedAt;
            this.finishedAt = finishedAt;
            this.result = result;
            this.error = error;
        }

        static TaskView from(Task task) {
            return new TaskView(task.getId(), task.getType(), task.getDescription(),
                    String.valueOf(task.getTarget()), String.valueOf(task.getStatus()),
                    task.getCreatedAt(), task.getStartedAt(), task.getFinishedAt(), task.getResultLabel(),
                    task.getError() != null ? task.getError().getMessage() : null);
        }

        public String getId() { return id; }
        public String getType() { return type; }
        public String getDescription() { return description; }
        public String getTarget() { return target; }
        public String getStatus() { return status; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getStartedAt() { return startedAt; }
        public Instant getFinishedAt() { return finishedAt; }
        public String getResult() { return result; }
        public String getError() { return error; }

        @Override
        public String toString() {
            return "TaskView{id='" + id + "', type='" + type + "', target='" + target + "', status='" + status +
                   "', result='" + result + "', error='" + error + "'}";
        }
    }

    /**
     * A target with an operation in flight.
     */
    public static class PendingView {
        private final String profile;
        private final String node;
        private final int resourceId;
        private final String kind;
        private final String operation;

        public PendingView(TargetIdentity target, String operation) {
            this.profile = target.getProfileName();
            this.node = target.getNodeName();
            this.resourceId = target.getResourceId();
            this.kind = target.getKind().name();
            this.operation = operation;
        }

        public String getProfile() { return profile; }
        public String getNode() { return node; }
        public int getResourceId() { return resourceId; }
        public String getKind() { return kind; }
        public String getOperation() { return operation; }

        @Override
        public String toString() {
            return "PendingView{profile='" + profile + "', node='" + node + "', resourceId=" + resourceId +
                   ", kind='" + kind + "', operation='" + operation + "'}";
        }
    }
}

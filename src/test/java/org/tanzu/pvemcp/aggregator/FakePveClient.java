package org.tanzu.pvemcp.aggregator;

import org.tanzu.pvemcp.pve.ClusterSnapshot;
import org.tanzu.pvemcp.pve.ClusterTask;
import org.tanzu.pvemcp.pve.MigrationOptions;
import org.tanzu.pvemcp.pve.NodeInfo;
import org.tanzu.pvemcp.pve.PveApiException;
import org.tanzu.pvemcp.pve.PveClient;
import org.tanzu.pvemcp.pve.RemoteTaskStatus;
import org.tanzu.pvemcp.pve.VmInfo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory client serving a fixed resource listing.
 */
class FakePveClient implements PveClient {

    private final String profileName;
    private volatile List<NodeInfo> nodes = new ArrayList<>();
    private volatile List<VmInfo> vms = new ArrayList<>();
    private volatile List<ClusterTask> tasks = new ArrayList<>();
    private volatile RuntimeException refreshFailure;
    private volatile RuntimeException taskFailure;
    private volatile CountDownLatch refreshEntered;
    private volatile CountDownLatch refreshGate;
    private volatile boolean closed;

    FakePveClient(String profileName) {
        this.profileName = profileName;
    }

    FakePveClient withNodes(String... names) {
        List<NodeInfo> listed = new ArrayList<>();
        for (String name : names) {
            listed.add(new NodeInfo(name, true, 0.1, 8, 1L << 30, 1L << 34, 3600, null, false));
        }
        this.nodes = listed;
        return this;
    }

    FakePveClient withVm(int vmid, String node, String status) {
        List<VmInfo> listed = new ArrayList<>(vms);
        listed.add(new VmInfo(vmid, "vm" + vmid, node, VmInfo.TYPE_QEMU, status, 100, 0.0, 2,
                1L << 29, 1L << 31, false, null, false));
        this.vms = listed;
        return this;
    }

    FakePveClient withTask(String upid, String type, long startTime) {
        List<ClusterTask> listed = new ArrayList<>(tasks);
        listed.add(new ClusterTask(upid, "n1", type, "", "root@pam", "OK", startTime, startTime + 5, null));
        this.tasks = listed;
        return this;
    }

    void failRefreshWith(RuntimeException failure) {
        this.refreshFailure = failure;
    }

    void failTasksWith(RuntimeException failure) {
        this.taskFailure = failure;
    }

    /**
     * Makes the next resource listings wait for {@code gate}; {@code entered} is
     * counted down when a listing starts waiting.
     */
    void holdRefresh(CountDownLatch entered, CountDownLatch gate) {
        this.refreshEntered = entered;
        this.refreshGate = gate;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public String getProfileName() {
        return profileName;
    }

    @Override
    public String getVersion() {
        return "8.2.4";
    }

    @Override
    public ClusterSnapshot getClusterResources() {
        CountDownLatch gate = refreshGate;
        if (gate != null) {
            refreshEntered.countDown();
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        RuntimeException failure = refreshFailure;
        if (failure != null) {
            throw failure;
        }
        return new ClusterSnapshot(nodes, vms, Instant.now());
    }

    @Override
    public VmInfo getVmStatus(String node, String type, int vmid) {
        return vms.stream()
            .filter(vm -> vm.getId() == vmid && vm.getNode().equals(node))
            .findFirst()
            .orElseThrow(() -> new PveApiException(profileName, "VM " + vmid + " not found on " + node));
    }

    @Override
    public String startVm(VmInfo vm) { return ""; }

    @Override
    public String stopVm(VmInfo vm) { return ""; }

    @Override
    public String shutdownVm(VmInfo vm) { return ""; }

    @Override
    public String rebootVm(VmInfo vm) { return ""; }

    @Override
    public String resetVm(VmInfo vm) { return ""; }

    @Override
    public String migrateVm(VmInfo vm, MigrationOptions options) { return ""; }

    @Override
    public String deleteVm(VmInfo vm) { return ""; }

    @Override
    public String rebootNode(String node) { return ""; }

    @Override
    public String shutdownNode(String node) { return ""; }

    @Override
    public RemoteTaskStatus getTaskStatus(String node, String upid) {
        return new RemoteTaskStatus(upid, "stopped", "OK");
    }

    @Override
    public List<ClusterTask> getClusterTasks() {
        RuntimeException failure = taskFailure;
        if (failure != null) {
            throw failure;
        }
        return tasks;
    }

    @Override
    public void close() {
        closed = true;
    }
}

package org.tanzu.pvemcp.pve;

import java.util.List;

/**
 * Blocking client for one Proxmox VE cluster.
 *
 * One instance exists per connected profile. All methods block until the API
 * answers and throw {@link PveApiException} on failure. Lifecycle calls return
 * the UPID of the task Proxmox started for them; see {@link RemoteTaskAwaiter}.
 */
public interface PveClient extends AutoCloseable {

    /**
     * @return the name of the profile this client was created for
     */
    String getProfileName();

    /**
     * @return the API version string, used as a connectivity check
     */
    String getVersion();

    /**
     * @return a point-in-time listing of the cluster's nodes and guests
     */
    ClusterSnapshot getClusterResources();

    /**
     * Reads the current status of one guest.
     *
     * @param node Node the guest is expected on
     * @param type "qemu" or "lxc"
     * @param vmid Guest id
     * @return The guest as currently reported, without source profile
     */
    VmInfo getVmStatus(String node, String type, int vmid);

    String startVm(VmInfo vm);

    String stopVm(VmInfo vm);

    String shutdownVm(VmInfo vm);

    String rebootVm(VmInfo vm);

    String resetVm(VmInfo vm);

    String migrateVm(VmInfo vm, MigrationOptions options);

    String deleteVm(VmInfo vm);

    String rebootNode(String node);

    String shutdownNode(String node);

    RemoteTaskStatus getTaskStatus(String node, String upid);

    /**
     * @return the cluster's recent tasks, as listed by Proxmox, without source profile
     */
    List<ClusterTask> getClusterTasks();

    /**
     * Releases the client's session. Never throws.
     */
    @Override
    void close();
}

package org.tanzu.pvemcp.pve;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time listing of one cluster's nodes and guests.
 */
public class ClusterSnapshot {

    private final List<NodeInfo> nodes;
    private final List<VmInfo> vms;
    private final Instant fetchedAt;

    public ClusterSnapshot(List<NodeInfo> nodes, List<VmInfo> vms, Instant fetchedAt) {
        this.nodes = List.copyOf(nodes);
        this.vms = List.copyOf(vms);
        this.fetchedAt = fetchedAt;
    }

    public List<NodeInfo> getNodes() { return nodes; }
    public List<VmInfo> getVms() { return vms; }
    public Instant getFetchedAt() { return fetchedAt; }

    @Override
    public String toString() {
        return "ClusterSnapshot{nodes=" + nodes.size() + ", vms=" + vms.size() + ", fetchedAt=" + fetchedAt + "}";
    }
}

package org.tanzu.pvemcp.aggregator;

import org.tanzu.pvemcp.pve.NodeInfo;
import org.tanzu.pvemcp.pve.VmInfo;
import org.tanzu.pvemcp.task.ResourceKind;
import org.tanzu.pvemcp.task.TargetIdentity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable merged resource view across all profiles of a group.
 *
 * Every item carries its source profile. Nodes are ordered by (profile, name)
 * and guests by (profile, node, id). Items copied from a degraded profile's
 * last known snapshot are flagged stale.
 */
public class AggregatedView {

    private static final AggregatedView EMPTY = new AggregatedView(List.of(), List.of(), null, Map.of());

    private final List<NodeInfo> nodes;
    private final List<VmInfo> vms;
    private final Instant refreshedAt;
    private final Map<String, String> refreshFailures;

    public AggregatedView(List<NodeInfo> nodes, List<VmInfo> vms, Instant refreshedAt,
                          Map<String, String> refreshFailures) {
        this.nodes = List.copyOf(nodes);
        this.vms = List.copyOf(vms);
        this.refreshedAt = refreshedAt;
        this.refreshFailures = Collections.unmodifiableMap(new LinkedHashMap<>(refreshFailures));
    }

    /**
     * @return the view held before the first refresh
     */
    public static AggregatedView empty() {
        return EMPTY;
    }

    public List<NodeInfo> getNodes() { return nodes; }
    public List<VmInfo> getVms() { return vms; }

    /**
     * @return time of the refresh that produced this view, null before the first one
     */
    public Instant getRefreshedAt() { return refreshedAt; }

    /**
     * @return refresh error per profile that did not answer this time
     */
    public Map<String, String> getRefreshFailures() { return refreshFailures; }

    public List<VmInfo> getVmsForProfile(String profileName) {
        return vms.stream()
            .filter(vm -> profileName.equals(vm.getSourceProfile()))
            .collect(Collectors.toList());
    }

    /**
     * Looks a guest up by its target identity.
     */
    public Optional<VmInfo> findVm(TargetIdentity target) {
        if (target.getKind() != ResourceKind.VM) {
            return Optional.empty();
        }
        return vms.stream()
            .filter(vm -> vm.getId() == target.getResourceId()
                    && target.getNodeName().equals(vm.getNode())
                    && target.getProfileName().equals(vm.getSourceProfile()))
            .findFirst();
    }

    /**
     * Looks guests up by id alone. Ids are only unique per cluster, so several
     * profiles may return a match.
     */
    public List<VmInfo> findVmsById(int vmid) {
        return vms.stream()
            .filter(vm -> vm.getId() == vmid)
            .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "AggregatedView{" +
                "nodes=" + nodes.size() +
                ", vms=" + vms.size() +
                ", refreshedAt=" + refreshedAt +
                ", refreshFailures=" + refreshFailures +
                '}';
    }
}

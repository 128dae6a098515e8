package org.tanzu.pvemcp.task;

import java.util.Objects;

/**
 * Unique key for any manageable resource across all aggregated clusters.
 *
 * A target is identified by the profile (cluster connection) it belongs to, the
 * node it lives on, its resource id and its kind. Equality is field-wise, so two
 * targets whose names would collide when joined into a single string (for example
 * profile "a-b" with node "c" versus profile "a" with node "b-c") stay distinct.
 *
 * Node targets use a resource id of 0.
 */
public final class TargetIdentity {

    private final String profileName;
    private final String nodeName;
    private final int resourceId;
    private final ResourceKind kind;

    public TargetIdentity(String profileName, String nodeName, int resourceId, ResourceKind kind) {
        this.profileName = Objects.requireNonNull(profileName, "profileName");
        this.nodeName = Objects.requireNonNull(nodeName, "nodeName");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == ResourceKind.NODE && resourceId != 0) {
            throw new IllegalArgumentException("Node targets must use resource id 0, got " + resourceId);
        }
        this.resourceId = resourceId;
    }

    /**
     * Creates the identity of a guest (QEMU VM or LXC container).
     *
     * @param profileName The profile the guest was listed from
     * @param nodeName The node currently hosting the guest
     * @param vmid The Proxmox guest id
     * @return The guest's target identity
     */
    public static TargetIdentity vm(String profileName, String nodeName, int vmid) {
        return new TargetIdentity(profileName, nodeName, vmid, ResourceKind.VM);
    }

    /**
     * Creates the identity of a cluster node.
     *
     * @param profileName The profile the node was listed from
     * @param nodeName The node name
     * @return The node's target identity
     */
    public static TargetIdentity node(String profileName, String nodeName) {
        return new TargetIdentity(profileName, nodeName, 0, ResourceKind.NODE);
    }

    public String getProfileName() { return profileName; }
    public String getNodeName() { return nodeName; }
    public int getResourceId() { return resourceId; }
    public ResourceKind getKind() { return kind; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetIdentity)) {
            return false;
        }
        TargetIdentity that = (TargetIdentity) o;
        return resourceId == that.resourceId
                && profileName.equals(that.profileName)
                && nodeName.equals(that.nodeName)
                && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(profileName, nodeName, resourceId, kind);
    }

    @Override
    public String toString() {
        if (kind == ResourceKind.NODE) {
            return "TargetIdentity{profile='" + profileName + "', node='" + nodeName + "', kind=NODE}";
        }
        return "TargetIdentity{profile='" + profileName + "', node='" + nodeName + "', id=" + resourceId + ", kind=VM}";
    }
}

package org.tanzu.pvemcp.pve;

import java.util.Objects;

/**
 * Options for migrating a guest to another node of the same cluster.
 *
 * Online migration only applies to QEMU VMs; containers are always migrated in
 * restart mode. When {@code online} is null it defaults to true for running QEMU
 * VMs and false otherwise.
 */
public class MigrationOptions {

    private final String targetNode;
    private final Boolean online;

    public MigrationOptions(String targetNode, Boolean online) {
        this.targetNode = Objects.requireNonNull(targetNode, "targetNode");
        this.online = online;
    }

    public String getTargetNode() { return targetNode; }
    public Boolean getOnline() { return online; }

    /**
     * Resolves whether the migration of the given guest will be live.
     */
    public boolean isOnlineFor(VmInfo vm) {
        if (!vm.isQemu()) {
            return false;
        }
        return online != null ? online : vm.isRunning();
    }

    @Override
    public String toString() {
        return "MigrationOptions{targetNode='" + targetNode + "', online=" + online + "}";
    }
}

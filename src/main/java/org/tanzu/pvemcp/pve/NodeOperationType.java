package org.tanzu.pvemcp.pve;

/**
 * Power operations on a cluster node.
 */
public enum NodeOperationType {
    REBOOT("Reboot node"),
    SHUTDOWN("Shutdown node");

    private final String label;

    NodeOperationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

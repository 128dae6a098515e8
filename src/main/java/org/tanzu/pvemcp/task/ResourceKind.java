package org.tanzu.pvemcp.task;

/**
 * Kind of resource a {@link TargetIdentity} addresses.
 */
public enum ResourceKind {
    NODE,
    VM
}

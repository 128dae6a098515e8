package org.tanzu.pvemcp.pve;

import org.tanzu.pvemcp.task.TargetIdentity;

/**
 * Data structure representing a Proxmox cluster node.
 */
public class NodeInfo {

    private final String name;
    private final boolean online;
    private final double cpu;
    private final int maxCpu;
    private final long mem;
    private final long maxMem;
    private final long uptime;
    private final String sourceProfile;
    private final boolean stale;

    public NodeInfo(String name, boolean online, double cpu, int maxCpu, long mem, long maxMem,
                    long uptime, String sourceProfile, boolean stale) {
        this.name = name;
        this.online = online;
        this.cpu = cpu;
        this.maxCpu = maxCpu;
        this.mem = mem;
        this.maxMem = maxMem;
        this.uptime = uptime;
        this.sourceProfile = sourceProfile;
        this.stale = stale;
    }

    public String getName() { return name; }
    public boolean isOnline() { return online; }
    public double getCpu() { return cpu; }
    public int getMaxCpu() { return maxCpu; }
    public long getMem() { return mem; }
    public long getMaxMem() { return maxMem; }
    public long getUptime() { return uptime; }
    public String getSourceProfile() { return sourceProfile; }
    public boolean isStale() { return stale; }

    public NodeInfo withSourceProfile(String profile) {
        return new NodeInfo(name, online, cpu, maxCpu, mem, maxMem, uptime, profile, stale);
    }

    public NodeInfo withStale(boolean staleFlag) {
        return new NodeInfo(name, online, cpu, maxCpu, mem, maxMem, uptime, sourceProfile, staleFlag);
    }

    public TargetIdentity toTarget() {
        if (sourceProfile == null) {
            throw new IllegalStateException("Node " + name + " has no source profile");
        }
        return TargetIdentity.node(sourceProfile, name);
    }

    @Override
    public String toString() {
        return "NodeInfo{name='" + name + "', online=" + online + ", sourceProfile='" + sourceProfile + "'" +
               (stale ? ", stale" : "") + "}";
    }
}

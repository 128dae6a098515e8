package org.tanzu.pvemcp.pve;

import org.tanzu.pvemcp.task.TargetIdentity;

/**
 * Data structure representing a Proxmox guest (QEMU VM or LXC container).
 *
 * Instances are immutable. The aggregator stamps the profile a guest was listed
 * from through {@link #withSourceProfile(String)}, and flags guests taken from a
 * profile's last-known-good snapshot through {@link #withStale(boolean)}.
 */
public class VmInfo {

    public static final String TYPE_QEMU = "qemu";
    public static final String TYPE_LXC = "lxc";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_STOPPED = "stopped";

    private final int id;
    private final String name;
    private final String node;
    private final String type;
    private final String status;
    private final long uptime;
    private final double cpu;
    private final int maxCpu;
    private final long mem;
    private final long maxMem;
    private final boolean template;
    private final String sourceProfile;
    private final boolean stale;

    public VmInfo(int id, String name, String node, String type, String status, long uptime,
                  double cpu, int maxCpu, long mem, long maxMem, boolean template,
                  String sourceProfile, boolean stale) {
        this.id = id;
        this.name = name;
        this.node = node;
        this.type = type;
        this.status = status;
        this.uptime = uptime;
        this.cpu = cpu;
        this.maxCpu = maxCpu;
        this.mem = mem;
        this.maxMem = maxMem;
        this.template = template;
        this.sourceProfile = sourceProfile;
        this.stale = stale;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public String getNode() { return node; }
    public String getType() { return type; }
    public String getStatus() { return status; }
    public long getUptime() { return uptime; }
    public double getCpu() { return cpu; }
    public int getMaxCpu() { return maxCpu; }
    public long getMem() { return mem; }
    public long getMaxMem() { return maxMem; }
    public boolean isTemplate() { return template; }
    public String getSourceProfile() { return sourceProfile; }
    public boolean isStale() { return stale; }

    public boolean isRunning() { return STATUS_RUNNING.equals(status); }
    public boolean isQemu() { return TYPE_QEMU.equals(type); }

    public VmInfo withSourceProfile(String profile) {
        return new VmInfo(id, name, node, type, status, uptime, cpu, maxCpu, mem, maxMem, template, profile, stale);
    }

    public VmInfo withStale(boolean staleFlag) {
        return new VmInfo(id, name, node, type, status, uptime, cpu, maxCpu, mem, maxMem, template, sourceProfile, staleFlag);
    }

    /**
     * @return the target identity of this guest; requires a source profile
     */
    public TargetIdentity toTarget() {
        if (sourceProfile == null) {
            throw new IllegalStateException("VM " + id + " has no source profile");
        }
        return TargetIdentity.vm(sourceProfile, node, id);
    }

    @Override
    public String toString() {
        return "VmInfo{id=" + id + ", name='" + name + "', node='" + node + "', type='" + type +
               "', status='" + status + "', sourceProfile='" + sourceProfile + "'" + (stale ? ", stale" : "") + "}";
    }
}

package org.tanzu.pvemcp.pve;

/**
 * One entry of a cluster's recent task log ({@code /cluster/tasks}).
 *
 * Running tasks have no end time and no status; finished tasks carry "OK" or
 * the error text as status.
 */
public class ClusterTask {

    private final String upid;
    private final String node;
    private final String type;
    private final String id;
    private final String user;
    private final String status;
    private final long startTime;
    private final long endTime;
    private final String sourceProfile;

    public ClusterTask(String upid, String node, String type, String id, String user, String status,
                       long startTime, long endTime, String sourceProfile) {
        this.upid = upid;
        this.node = node;
        this.type = type;
        this.id = id;
        this.user = user;
        this.status = status;
        this.startTime = startTime;
        this.endTime = endTime;
        this.sourceProfile = sourceProfile;
    }

    public String getUpid() { return upid; }
    public String getNode() { return node; }
    public String getType() { return type; }
    public String getId() { return id; }
    public String getUser() { return user; }
    public String getStatus() { return status; }
    /** Epoch seconds */
    public long getStartTime() { return startTime; }
    /** Epoch seconds, 0 while running */
    public long getEndTime() { return endTime; }
    public String getSourceProfile() { return sourceProfile; }

    public boolean isRunning() {
        return endTime == 0;
    }

    public boolean isSuccessful() {
        return !isRunning() && "OK".equals(status);
    }

    public ClusterTask withSourceProfile(String profileName) {
        return new ClusterTask(upid, node, type, id, user, status, startTime, endTime, profileName);
    }

    @Override
    public String toString() {
        return "ClusterTask{" +
                "upid='" + upid + '\'' +
                ", type='" + type + '\'' +
                ", id='" + id + '\'' +
                ", node='" + node + '\'' +
                ", status='" + status + '\'' +
                ", startTime=" + startTime +
                ", sourceProfile='" + sourceProfile + '\'' +
                '}';
    }
}

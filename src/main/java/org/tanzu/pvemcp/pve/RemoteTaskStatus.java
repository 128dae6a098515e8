package org.tanzu.pvemcp.pve;

/**
 * Status of a Proxmox task identified by its UPID.
 *
 * A task is finished once its status is "stopped"; it succeeded if the exit
 * status is "OK".
 */
public class RemoteTaskStatus {

    private final String upid;
    private final String status;
    private final String exitStatus;

    public RemoteTaskStatus(String upid, String status, String exitStatus) {
        this.upid = upid;
        this.status = status;
        this.exitStatus = exitStatus;
    }

    public String getUpid() { return upid; }
    public String getStatus() { return status; }
    public String getExitStatus() { return exitStatus; }

    public boolean isStopped() {
        return "stopped".equals(status);
    }

    public boolean isSuccessful() {
        return isStopped() && "OK".equals(exitStatus);
    }

    @Override
    public String toString() {
        return "RemoteTaskStatus{upid='" + upid + "', status='" + status + "', exitStatus='" + exitStatus + "'}";
    }
}

package org.tanzu.pvemcp.aggregator;

import org.tanzu.pvemcp.config.Profile;
import org.tanzu.pvemcp.pve.ClusterSnapshot;
import org.tanzu.pvemcp.pve.PveClient;

/**
 * Connection state of one profile inside the {@link ClusterAggregator}.
 *
 * All access is synchronized on the instance. Transitions that arrive after
 * the connection was disconnected are ignored, so a refresh or reconnect that
 * finishes after {@code close()} cannot revive it.
 */
public class ProfileConnection {

    private final Profile profile;
    private PveClient client;
    private ProfileConnectionStatus status = ProfileConnectionStatus.PENDING;
    private String connectError;
    private String lastRefreshError;
    private ClusterSnapshot snapshot;

    public ProfileConnection(Profile profile) {
        this.profile = profile;
    }

    public Profile getProfile() {
        return profile;
    }

    public String getProfileName() {
        return profile.getName();
    }

    public synchronized PveClient getClient() { return client; }
    public synchronized ProfileConnectionStatus getStatus() { return status; }
    public synchronized String getConnectError() { return connectError; }
    public synchronized String getLastRefreshError() { return lastRefreshError; }
    public synchronized ClusterSnapshot getSnapshot() { return snapshot; }

    /**
     * Installs a connected client.
     *
     * @return false if the connection was disconnected meanwhile; the caller
     *         then owns the client and must close it
     */
    synchronized boolean markConnected(PveClient connected) {
        if (status == ProfileConnectionStatus.DISCONNECTED) {
            return false;
        }
        this.client = connected;
        this.status = ProfileConnectionStatus.CONNECTED;
        this.connectError = null;
        this.lastRefreshError = null;
        return true;
    }

    synchronized void markFailed(String error) {
        if (status == ProfileConnectionStatus.DISCONNECTED || status.hasClient()) {
            return;
        }
        this.status = ProfileConnectionStatus.FAILED;
        this.connectError = error;
    }

    synchronized void recordRefresh(ClusterSnapshot fresh) {
        if (!status.hasClient()) {
            return;
        }
        this.snapshot = fresh;
        this.lastRefreshError = null;
        this.status = ProfileConnectionStatus.CONNECTED;
    }

    synchronized void recordRefreshFailure(String error) {
        if (!status.hasClient()) {
            return;
        }
        this.lastRefreshError = error;
        this.status = ProfileConnectionStatus.DEGRADED;
    }

    /**
     * Moves to DISCONNECTED and hands back the client for closing.
     *
     * @return the client, or null if there was none
     */
    synchronized PveClient disconnect() {
        PveClient released = client;
        this.client = null;
        this.status = ProfileConnectionStatus.DISCONNECTED;
        return released;
    }

    @Override
    public synchronized String toString() {
        return "ProfileConnection{" +
                "profile='" + profile.getName() + '\'' +
                ", status=" + status +
                ", connectError='" + connectError + '\'' +
                ", lastRefreshError='" + lastRefreshError + '\'' +
                '}';
    }
}

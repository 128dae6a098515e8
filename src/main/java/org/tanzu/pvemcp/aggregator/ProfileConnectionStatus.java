package org.tanzu.pvemcp.aggregator;

/**
 * Lifecycle state of one profile's connection.
 *
 * PENDING moves to CONNECTED or FAILED once the connect attempt settles.
 * CONNECTED drops to DEGRADED when a refresh fails and returns on the next
 * successful refresh. FAILED becomes CONNECTED through a reconnect. Every state
 * ends in DISCONNECTED when the aggregator is closed or re-initialized.
 */
public enum ProfileConnectionStatus {
    PENDING,
    CONNECTED,
    DEGRADED,
    FAILED,
    DISCONNECTED;

    /**
     * @return true if the connection holds a usable client
     */
    public boolean hasClient() {
        return this == CONNECTED || this == DEGRADED;
    }
}

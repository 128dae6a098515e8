package org.tanzu.pvemcp.aggregator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only overview of the aggregator's profile connections.
 *
 * Degraded profiles still hold a client and count as connected;
 * {@code degradedCount} tells how many of them failed their last refresh.
 * {@code errorCount} counts profiles whose connect attempt failed.
 */
public class ConnectionSummary {

    private final String groupName;
    private final int totalProfiles;
    private final int connectedCount;
    private final int degradedCount;
    private final int errorCount;
    private final Map<String, String> profileErrors;
    private final Map<String, String> refreshErrors;
    private final Map<String, ProfileConnectionStatus> profileStatus;

    public ConnectionSummary(String groupName, int totalProfiles, int connectedCount, int degradedCount,
                             int errorCount, Map<String, String> profileErrors, Map<String, String> refreshErrors,
                             Map<String, ProfileConnectionStatus> profileStatus) {
        this.groupName = groupName;
        this.totalProfiles = totalProfiles;
        this.connectedCount = connectedCount;
        this.degradedCount = degradedCount;
        this.errorCount = errorCount;
        this.profileErrors = Collections.unmodifiableMap(new LinkedHashMap<>(profileErrors));
        this.refreshErrors = Collections.unmodifiableMap(new LinkedHashMap<>(refreshErrors));
        this.profileStatus = Collections.unmodifiableMap(new LinkedHashMap<>(profileStatus));
    }

    public String getGroupName() { return groupName; }
    public int getTotalProfiles() { return totalProfiles; }
    public int getConnectedCount() { return connectedCount; }
    public int getDegradedCount() { return degradedCount; }
    public int getErrorCount() { return errorCount; }
    public Map<String, String> getProfileErrors() { return profileErrors; }
    public Map<String, String> getRefreshErrors() { return refreshErrors; }
    public Map<String, ProfileConnectionStatus> getProfileStatus() { return profileStatus; }

    @Override
    public String toString() {
        return "ConnectionSummary{" +
                "groupName='" + groupName + '\'' +
                ", totalProfiles=" + totalProfiles +
                ", connectedCount=" + connectedCount +
                ", degradedCount=" + degradedCount +
                ", errorCount=" + errorCount +
                ", profileErrors=" + profileErrors +
                ", refreshErrors=" + refreshErrors +
                ", profileStatus=" + profileStatus +
                '}';
    }
}

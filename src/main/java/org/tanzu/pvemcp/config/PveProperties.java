package org.tanzu.pvemcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for Proxmox VE connections and the operation core.
 *
 * Bound from application.properties, environment variables or any other Spring
 * property source using the "pve" prefix, for example:
 *
 * <pre>
 * pve.group=homelab
 * pve.profiles.lab.addr=https://pve1.lab:8006
 * pve.profiles.lab.user=root
 * pve.profiles.lab.password=secret
 * pve.profiles.lab.groups=homelab
 * </pre>
 *
 * Profiles are validated and turned into {@link Profile} instances by
 * {@link ProfileConfigProcessor}.
 */
@Component
@ConfigurationProperties(prefix = "pve")
public class PveProperties {

    /** Connection profiles keyed by profile name */
    private Map<String, ProfileProperties> profiles = new LinkedHashMap<>();

    /** Group (or single profile) to connect at startup; empty connects every profile */
    private String group;

    /** Whether to connect the selected profiles when the application starts */
    private boolean connectOnStartup = true;

    /** Timeout for one profile's connect attempt */
    private Duration connectTimeout = Duration.ofSeconds(15);

    /** Timeout for one resource refresh fan-out */
    private Duration refreshTimeout = Duration.ofSeconds(30);

    /** Timeout for a single HTTP exchange with a cluster */
    private Duration requestTimeout = Duration.ofSeconds(20);

    private final Tasks tasks = new Tasks();

    private final Stabilization stabilization = new Stabilization();

    public Map<String, ProfileProperties> getProfiles() { return profiles; }
    public void setProfiles(Map<String, ProfileProperties> profiles) { this.profiles = profiles; }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }

    public boolean isConnectOnStartup() { return connectOnStartup; }
    public void setConnectOnStartup(boolean connectOnStartup) { this.connectOnStartup = connectOnStartup; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getRefreshTimeout() { return refreshTimeout; }
    public void setRefreshTimeout(Duration refreshTimeout) { this.refreshTimeout = refreshTimeout; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Tasks getTasks() { return tasks; }

    public Stabilization getStabilization() { return stabilization; }

    /**
     * Settings of one connection profile.
     */
    public static class ProfileProperties {

        /** Cluster address, e.g. https://pve1.example.com:8006 */
        private String addr;

        /** User name, with or without @realm */
        private String user;

        /** Authentication realm (default: pam) */
        private String realm;

        /** Password for ticket authentication */
        private String password;

        /** API token id for token authentication */
        private String tokenId;

        /** API token secret for token authentication */
        private String tokenSecret;

        /** Whether to skip TLS certificate validation (default: false) */
        private boolean insecure = false;

        /** Aggregate groups this profile belongs to */
        private List<String> groups = new ArrayList<>();

        public String getAddr() { return addr; }
        public void setAddr(String addr) { this.addr = addr; }

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }

        public String getRealm() { return realm; }
        public void setRealm(String realm) { this.realm = realm; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getTokenId() { return tokenId; }
        public void setTokenId(String tokenId) { this.tokenId = tokenId; }

        public String getTokenSecret() { return tokenSecret; }
        public void setTokenSecret(String tokenSecret) { this.tokenSecret = tokenSecret; }

        public boolean isInsecure() { return insecure; }
        public void setInsecure(boolean insecure) { this.insecure = insecure; }

        public List<String> getGroups() { return groups; }
        public void setGroups(List<String> groups) { this.groups = groups; }

        /**
         * Password and token secret are hidden so the settings can be logged.
         */
        @Override
        public String toString() {
            return "ProfileProperties{" +
                    "addr='" + addr + '\'' +
                    ", user='" + user + '\'' +
                    ", realm='" + realm + '\'' +
                    ", password='" + (password != null ? "[HIDDEN]" : "null") + '\'' +
                    ", tokenId='" + tokenId + '\'' +
                    ", tokenSecret='" + (tokenSecret != null ? "[HIDDEN]" : "null") + '\'' +
                    ", insecure=" + insecure +
                    ", groups=" + groups +
                    '}';
        }
    }

    /**
     * Task queue settings.
     */
    public static class Tasks {

        /** Number of finished tasks kept for display */
        private int historySize = 50;

        /** Delay between status reads of a remote Proxmox task */
        private Duration remotePollInterval = Duration.ofSeconds(2);

        /** Upper bound on waiting for a remote Proxmox task */
        private Duration remoteMaxWait = Duration.ofMinutes(10);

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public Duration getRemotePollInterval() { return remotePollInterval; }
        public void setRemotePollInterval(Duration remotePollInterval) { this.remotePollInterval = remotePollInterval; }

        public Duration getRemoteMaxWait() { return remoteMaxWait; }
        public void setRemoteMaxWait(Duration remoteMaxWait) { this.remoteMaxWait = remoteMaxWait; }
    }

    /**
     * Settings for waiting until a target reports its post-operation state.
     */
    public static class Stabilization {

        /** Delay between state checks */
        private Duration pollInterval = Duration.ofSeconds(3);

        /** Upper bound on the wait; the pending state is released afterwards regardless */
        private Duration maxWait = Duration.ofMinutes(5);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Duration getMaxWait() { return maxWait; }
        public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
    }

    @Override
    public String toString() {
        return "PveProperties{" +
                "profiles=" + profiles.keySet() +
                ", group='" + group + '\'' +
                ", connectOnStartup=" + connectOnStartup +
                ", connectTimeout=" + connectTimeout +
                ", refreshTimeout=" + refreshTimeout +
                ", requestTimeout=" + requestTimeout +
                '}';
    }
}

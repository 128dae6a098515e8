package org.tanzu.pvemcp.aggregator;

/**
 * A single profile could not be connected.
 *
 * Recorded on the profile's connection and reported through the connection
 * summary; never aborts initialization on its own.
 */
public class ClusterConnectException extends RuntimeException {

    private final String profileName;

    public ClusterConnectException(String profileName, String message) {
        super("Failed to connect profile '" + profileName + "': " + message);
        this.profileName = profileName;
    }

    public ClusterConnectException(String profileName, Throwable cause) {
        super("Failed to connect profile '" + profileName + "': " + cause.getMessage(), cause);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}

package org.tanzu.pvemcp.pve;

/**
 * Failure of a call against a Proxmox VE API, naming the profile and the call.
 */
public class PveApiException extends RuntimeException {

    private final String profileName;

    public PveApiException(String profileName, String message) {
        super("[" + profileName + "] " + message);
        this.profileName = profileName;
    }

    public PveApiException(String profileName, String message, Throwable cause) {
        super("[" + profileName + "] " + message, cause);
        this.profileName = profileName;
    }

    public String getProfileName() { return profileName; }
}

package org.tanzu.pvemcp.config;

import java.util.List;
import java.util.Objects;

/**
 * A named, independently authenticated connection to one Proxmox VE cluster.
 *
 * Profiles are built and validated by {@link ProfileConfigProcessor} from the
 * {@code pve.profiles} configuration and are read-only afterwards. A profile
 * authenticates either with a password (ticket login) or with an API token,
 * never both.
 */
public final class Profile {

    private final String name;
    private final String address;
    private final String user;
    private final String realm;
    private final String password;
    private final String tokenId;
    private final String tokenSecret;
    private final boolean insecure;
    private final List<String> groups;

    public Profile(String name, String address, String user, String realm, String password,
                   String tokenId, String tokenSecret, boolean insecure, List<String> groups) {
        this.name = Objects.requireNonNull(name, "name");
        this.address = Objects.requireNonNull(address, "address");
        this.user = Objects.requireNonNull(user, "user");
        this.realm = realm != null ? realm : "pam";
        this.password = password;
        this.tokenId = tokenId;
        this.tokenSecret = tokenSecret;
        this.insecure = insecure;
        this.groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public String getName() { return name; }
    public String getAddress() { return address; }
    public String getUser() { return user; }
    public String getRealm() { return realm; }
    public String getPassword() { return password; }
    public String getTokenId() { return tokenId; }
    public String getTokenSecret() { return tokenSecret; }
    public boolean isInsecure() { return insecure; }
    public List<String> getGroups() { return groups; }

    /**
     * @return user@realm as expected by the Proxmox API
     */
    public String getQualifiedUser() {
        return user.contains("@") ? user : user + "@" + realm;
    }

    public boolean usesToken() {
        return tokenId != null && !tokenId.isEmpty();
    }

    /**
     * Password and token secret are hidden.
     */
    @Override
    public String toString() {
        return "Profile{" +
                "name='" + name + '\'' +
                ", address='" + address + '\'' +
                ", user='" + getQualifiedUser() + '\'' +
                ", auth=" + (usesToken() ? "token" : "password") +
                ", insecure=" + insecure +
                ", groups=" + groups +
                '}';
    }
}

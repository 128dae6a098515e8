package org.tanzu.pvemcp.pve;

import org.tanzu.pvemcp.config.Profile;

/**
 * Creates connected clients, one per profile.
 */
@FunctionalInterface
public interface PveClientFactory {

    /**
     * Creates a client for the profile, authenticates it and verifies the
     * connection. Blocks until done.
     *
     * @param profile The profile to connect
     * @return A ready client
     * @throws PveApiException if the cluster cannot be reached or rejects the credentials
     */
    PveClient connect(Profile profile);
}

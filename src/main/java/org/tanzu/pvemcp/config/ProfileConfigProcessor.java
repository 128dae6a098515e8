package org.tanzu.pvemcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validates the configured connection profiles and resolves aggregate groups.
 *
 * The processor runs after the properties are bound, using the @PostConstruct
 * annotation. Each entry of {@code pve.profiles} is checked and turned into a
 * {@link Profile}:
 * - addr is required; trailing slashes are removed
 * - user is required
 * - exactly one of password or token-id/token-secret must be set
 * - realm defaults to "pam"
 *
 * Values that still contain an unresolved placeholder (${...}) count as
 * missing. Invalid profiles are logged and left out; they never stop the
 * application from starting.
 *
 * Groups are collected from the profiles' {@code groups} lists. A group name
 * may not be equal to a profile name.
 */
@Component
public class ProfileConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ProfileConfigProcessor.class);

    private final PveProperties pveProperties;

    private final Map<String, Profile> profiles = new LinkedHashMap<>();
    private final Map<String, List<String>> groups = new TreeMap<>();
    private final Map<String, String> configurationErrors = new LinkedHashMap<>();

    public ProfileConfigProcessor(PveProperties pveProperties) {
        this.pveProperties = pveProperties;
    }

    /**
     * Processes the bound {@code pve.profiles} configuration.
     */
    @PostConstruct
    public void processProfiles() {
        logger.info("Processing Proxmox VE profile configuration...");
        profiles.clear();
        groups.clear();
        configurationErrors.clear();

        for (Map.Entry<String, PveProperties.ProfileProperties> entry : pveProperties.getProfiles().entrySet()) {
            String name = entry.getKey();
            logger.debug("Profile '{}': {}", name, entry.getValue());
            try {
                Profile profile = toProfile(name, entry.getValue());
                profiles.put(name, profile);
                logger.info("Loaded profile {}", profile);
            } catch (IllegalArgumentException e) {
                configurationErrors.put(name, e.getMessage());
                logger.error("Ignoring invalid profile '{}': {}", name, e.getMessage());
            }
        }

        for (Profile profile : profiles.values()) {
            for (String group : profile.getGroups()) {
                if (profiles.containsKey(group)) {
                    String message = "Group name '" + group + "' conflicts with a profile name";
                    configurationErrors.put(profile.getName(), message);
                    logger.error(message);
                    continue;
                }
                groups.computeIfAbsent(group, g -> new ArrayList<>()).add(profile.getName());
            }
        }

        logger.info("Profile configuration processed: {} profile(s), {} group(s), {} error(s)",
                profiles.size(), groups.size(), configurationErrors.size());
    }

    /**
     * Validates one profile entry.
     *
     * @param name The profile name
     * @param properties The bound settings
     * @return The validated profile
     * @throws IllegalArgumentException describing the first problem found
     */
    static Profile toProfile(String name, PveProperties.ProfileProperties properties) {
        if (!isSet(name)) {
            throw new IllegalArgumentException("profile name is required");
        }
        if (properties == null) {
            throw new IllegalArgumentException("profile has no settings");
        }
        if (!isSet(properties.getAddr())) {
            throw new IllegalArgumentException("addr is required");
        }
        if (!isSet(properties.getUser())) {
            throw new IllegalArgumentException("user is required");
        }

        boolean hasPassword = isSet(properties.getPassword());
        boolean hasToken = isSet(properties.getTokenId()) || isSet(properties.getTokenSecret());
        if (hasPassword && hasToken) {
            throw new IllegalArgumentException("set either password or token-id/token-secret, not both");
        }
        if (!hasPassword && !hasToken) {
            throw new IllegalArgumentException("password or token-id/token-secret is required");
        }
        if (hasToken && !(isSet(properties.getTokenId()) && isSet(properties.getTokenSecret()))) {
            throw new IllegalArgumentException("token-id and token-secret must both be set");
        }

        String addr = properties.getAddr().trim();
        while (addr.endsWith("/")) {
            addr = addr.substring(0, addr.length() - 1);
        }
        String realm = isSet(properties.getRealm()) ? properties.getRealm().trim() : "pam";

        List<String> memberOf = new ArrayList<>();
        if (properties.getGroups() != null) {
            for (String group : properties.getGroups()) {
                if (isSet(group) && !memberOf.contains(group.trim())) {
                    memberOf.add(group.trim());
                }
            }
        }

        return new Profile(name, addr, properties.getUser().trim(), realm,
                hasPassword ? properties.getPassword() : null,
                hasToken ? properties.getTokenId().trim() : null,
                hasToken ? properties.getTokenSecret() : null,
                properties.isInsecure(), memberOf);
    }

    /**
     * A value is set if it is not null, not blank and not an unresolved placeholder.
     */
    static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }

    /**
     * Resolves a group or profile name to the profiles to connect.
     *
     * @param selection A group name, a profile name, or null/blank for all profiles
     * @return The selected profiles in configuration order
     * @throws IllegalArgumentException if the name matches neither a group nor a profile
     */
    public List<Profile> resolve(String selection) {
        if (!isSet(selection)) {
            return new ArrayList<>(profiles.values());
        }
        String name = selection.trim();
        if (profiles.containsKey(name)) {
            return List.of(profiles.get(name));
        }
        List<String> members = groups.get(name);
        if (members == null) {
            throw new IllegalArgumentException("No profile or group named '" + name + "'");
        }
        List<Profile> resolved = new ArrayList<>();
        for (String member : members) {
            resolved.add(profiles.get(member));
        }
        return resolved;
    }

    public Map<String, Profile> getProfiles() {
        return Collections.unmodifiableMap(profiles);
    }

    /**
     * @return member profile names per group, groups sorted by name
     */
    public Map<String, List<String>> getGroups() {
        return Collections.unmodifiableMap(groups);
    }

    /**
     * @return validation errors keyed by profile name
     */
    public Map<String, String> getConfigurationErrors() {
        return Collections.unmodifiableMap(configurationErrors);
    }
}

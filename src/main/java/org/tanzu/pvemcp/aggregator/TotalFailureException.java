package org.tanzu.pvemcp.aggregator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * No profile could be used: every connect attempt failed, or no profile
 * returned resources on a refresh.
 */
public class TotalFailureException extends RuntimeException {

    private final Map<String, String> profileErrors;

    public TotalFailureException(String message, Map<String, String> profileErrors) {
        super(message + (profileErrors.isEmpty() ? "" : ": " + profileErrors));
        this.profileErrors = Collections.unmodifiableMap(new LinkedHashMap<>(profileErrors));
    }

    /**
     * @return error message per profile name
     */
    public Map<String, String> getProfileErrors() {
        return profileErrors;
    }
}

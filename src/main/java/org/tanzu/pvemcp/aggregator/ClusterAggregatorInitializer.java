package org.tanzu.pvemcp.aggregator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.config.Profile;
import org.tanzu.pvemcp.config.ProfileConfigProcessor;
import org.tanzu.pvemcp.config.PveProperties;

import java.util.List;

/**
 * Connects the configured group once the application is ready.
 *
 * Connection problems are logged and leave the server running, so profiles
 * can be reconnected later through the reconnect tool.
 */
@Component
public class ClusterAggregatorInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ClusterAggregatorInitializer.class);

    private final ClusterAggregator aggregator;
    private final ProfileConfigProcessor profileConfigProcessor;
    private final PveProperties pveProperties;

    public ClusterAggregatorInitializer(ClusterAggregator aggregator, ProfileConfigProcessor profileConfigProcessor,
                                        PveProperties pveProperties) {
        this.aggregator = aggregator;
        this.profileConfigProcessor = profileConfigProcessor;
        this.pveProperties = pveProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectOnStartup() {
        if (!pveProperties.isConnectOnStartup()) {
            logger.info("Startup connection disabled (pve.connect-on-startup=false)");
            return;
        }
        connect();
    }

    /**
     * Connects the group selected by {@code pve.group}, or every profile.
     *
     * @return true if at least one profile connected
     */
    public boolean connect() {
        List<Profile> profiles;
        try {
            profiles = profileConfigProcessor.resolve(pveProperties.getGroup());
        } catch (IllegalArgumentException e) {
            logger.error("Cannot select profiles to connect: {}", e.getMessage());
            return false;
        }
        if (profiles.isEmpty()) {
            logger.warn("No Proxmox VE profiles configured; nothing to connect");
            return false;
        }

        try {
            aggregator.initialize(pveProperties.getGroup(), profiles, pveProperties.getConnectTimeout());
            aggregator.getGroupClusterResources();
            return true;
        } catch (TotalFailureException e) {
            logger.error("Proxmox VE connection failed: {}", e.getMessage());
            return false;
        }
    }
}

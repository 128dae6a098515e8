package org.tanzu.pvemcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configuration of the WebClient used to talk to Proxmox VE clusters.
 *
 * The builder defined here carries the settings shared by every profile: JSON
 * accept header and a codec buffer large enough for the cluster resource
 * listing of a big cluster. TLS is applied per profile by
 * {@link org.tanzu.pvemcp.pve.PveRestClientFactory}, because each profile
 * decides on its own whether certificates are validated.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /** Maximum size of a buffered response body */
    static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Creates the base WebClient.Builder for Proxmox API communication.
     *
     * Callers must clone the builder before applying profile specific settings.
     *
     * @return A builder with default headers and codec limits
     */
    @Bean
    public WebClient.Builder pveWebClientBuilder() {
        logger.info("Configuring base WebClient.Builder for Proxmox API (max buffer {} bytes)", MAX_IN_MEMORY_SIZE);
        return WebClient.builder()
            .defaultHeader("Accept", "application/json")
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }
}

package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.pvemcp.config.Profile;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.time.Duration;

/**
 * Creates {@link PveRestClient} instances, one per profile.
 *
 * Each client gets its own copy of the shared WebClient.Builder with the
 * profile's TLS policy applied. When a profile is marked insecure, an SSL
 * context that trusts all certificates is installed; this is meant for
 * clusters with self-signed certificates.
 *
 * {@link #connect(Profile)} authenticates and checks {@code GET /version}
 * before handing out the client, so a returned client is known to work.
 */
public class PveRestClientFactory implements PveClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(PveRestClientFactory.class);

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public PveRestClientFactory(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, Duration requestTimeout) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public PveClient connect(Profile profile) {
        logger.info("Connecting profile '{}' at {}", profile.getName(), profile.getAddress());
        PveRestClient client = new PveRestClient(profile, builderFor(profile), objectMapper, requestTimeout);
        try {
            client.login();
            String version = client.getVersion();
            logger.info("Profile '{}' connected (Proxmox VE {})", profile.getName(), version);
            return client;
        } catch (RuntimeException e) {
            client.close();
            logger.warn("Profile '{}' failed to connect: {}", profile.getName(), e.getMessage());
            throw e;
        }
    }

    private WebClient.Builder builderFor(Profile profile) {
        WebClient.Builder builder = webClientBuilder.clone();
        if (!profile.isInsecure()) {
            logger.debug("Using default SSL validation for profile '{}'", profile.getName());
            return builder;
        }

        logger.warn("SSL validation is DISABLED for profile '{}' (insecure=true)", profile.getName());
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            HttpClient httpClient = HttpClient.create()
                .secure(spec -> spec.sslContext(sslContext));
            return builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        } catch (SSLException e) {
            logger.error("Failed to configure insecure SSL context for profile '{}': {}",
                    profile.getName(), e.getMessage(), e);
            throw new PveApiException(profile.getName(), "Failed to configure insecure SSL context", e);
        }
    }
}

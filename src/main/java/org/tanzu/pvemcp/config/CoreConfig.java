package org.tanzu.pvemcp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.pvemcp.aggregator.ClusterAggregator;
import org.tanzu.pvemcp.pve.PveClientFactory;
import org.tanzu.pvemcp.pve.PveRestClientFactory;
import org.tanzu.pvemcp.pve.RemoteTaskAwaiter;
import org.tanzu.pvemcp.task.PendingOperationTracker;
import org.tanzu.pvemcp.task.StabilizationMonitor;
import org.tanzu.pvemcp.task.TaskQueue;

/**
 * Wires the operation core: one pending tracker shared by the task queue and
 * the stabilization monitor, the cluster aggregator and the REST client factory.
 */
@Configuration
public class CoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public PendingOperationTracker pendingOperationTracker() {
        return new PendingOperationTracker();
    }

    @Bean(destroyMethod = "close")
    public TaskQueue taskQueue(PendingOperationTracker pendingOperationTracker, PveProperties pveProperties) {
        logger.info("Creating task queue (history size {})", pveProperties.getTasks().getHistorySize());
        return new TaskQueue(pendingOperationTracker, pveProperties.getTasks().getHistorySize());
    }

    @Bean(destroyMethod = "close")
    public StabilizationMonitor stabilizationMonitor(PendingOperationTracker pendingOperationTracker) {
        return new StabilizationMonitor(pendingOperationTracker);
    }

    @Bean
    public PveClientFactory pveClientFactory(WebClient.Builder pveWebClientBuilder, ObjectMapper objectMapper,
                                             PveProperties pveProperties) {
        return new PveRestClientFactory(pveWebClientBuilder, objectMapper, pveProperties.getRequestTimeout());
    }

    @Bean(destroyMethod = "close")
    public ClusterAggregator clusterAggregator(PveClientFactory pveClientFactory, PveProperties pveProperties) {
        logger.info("Creating cluster aggregator (connect timeout {}, refresh timeout {})",
                pveProperties.getConnectTimeout(), pveProperties.getRefreshTimeout());
        return new ClusterAggregator(pveClientFactory, pveProperties.getConnectTimeout(),
                pveProperties.getRefreshTimeout());
    }

    @Bean
    public RemoteTaskAwaiter remoteTaskAwaiter(PveProperties pveProperties) {
        return new RemoteTaskAwaiter(pveProperties.getTasks().getRemotePollInterval(),
                pveProperties.getTasks().getRemoteMaxWait());
    }
}

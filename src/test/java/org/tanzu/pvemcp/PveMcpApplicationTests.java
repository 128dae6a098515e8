package org.tanzu.pvemcp;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.tanzu.pvemcp.aggregator.ClusterAggregator;
import org.tanzu.pvemcp.config.ProfileConfigProcessor;
import org.tanzu.pvemcp.pve.PveService;
import org.tanzu.pvemcp.task.TaskQueue;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "spring.ai.mcp.server.enabled=false",
    "pve.connect-on-startup=false",
    "pve.profiles.lab.addr=https://pve1.lab.example.com:8006/",
    "pve.profiles.lab.user=root",
    "pve.profiles.lab.password=test-password",
    "pve.profiles.lab.insecure=true",
    "pve.profiles.lab.groups=homelab",
    "pve.tasks.history-size=10"
})
class PveMcpApplicationTests {

    @Autowired
    private PveService pveService;

    @Autowired
    private ProfileConfigProcessor profileConfigProcessor;

    @Autowired
    private ClusterAggregator clusterAggregator;

    @Autowired
    private TaskQueue taskQueue;

    @Test
    void contextLoads() {
        assertNotNull(pveService);
        assertNotNull(taskQueue);
    }

    @Test
    void profilesAreBoundAndValidated() {
        assertEquals("https://pve1.lab.example.com:8006",
                profileConfigProcessor.getProfiles().get("lab").getAddress());
        assertEquals(1, profileConfigProcessor.resolve("homelab").size());
    }

    @Test
    void nothingIsConnectedWhenStartupConnectionIsDisabled() {
        assertEquals(0, pveService.getConnectionSummary().getTotalProfiles());
        assertTrue(pveService.listTasks().isEmpty());
        assertTrue(pveService.listPendingOperations().isEmpty());
        assertTrue(clusterAggregator.getClient("lab").isEmpty());
    }
}

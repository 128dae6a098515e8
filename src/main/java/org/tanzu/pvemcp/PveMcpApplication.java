package org.tanzu.pvemcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.pvemcp.pve.PveService;

import java.util.List;

/**
 * Main Spring Boot application class for the Proxmox VE MCP (Model Context Protocol) Server.
 *
 * The server connects to one or more Proxmox VE clusters, each described by a
 * connection profile, and presents them as a single resource universe. Guest
 * and node operations are exposed as MCP tools and run in the background, at
 * most one at a time per guest or node.
 *
 * Key features:
 * - Concurrent connection of several clusters, tolerant of unreachable ones
 * - Merged node and VM listing across clusters
 * - Background VM lifecycle and node power operations with conflict detection
 * - Configuration through Spring Boot properties
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PveMcpApplication {

    public static void main(String[] args) {
        System.setProperty("spring.application.name", "pve-mcp");
        System.setProperty("spring.ai.mcp.server.name", "pve-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(PveMcpApplication.class, args);
    }

    /**
     * Registers the Proxmox VE tools with the MCP server.
     *
     * @param pveService The service containing the tool methods
     * @return ToolCallback objects for every tool method
     */
    @Bean
    public List<ToolCallback> registerTools(PveService pveService) {
        return List.of(ToolCallbacks.from(pveService));
    }
}

/**
 * Configuration for the Proxmox VE MCP server.
 *
 * <p>Provides connection profiles and timeouts ({@link org.tanzu.pvemcp.config.PveProperties}),
 * profile validation ({@link org.tanzu.pvemcp.config.ProfileConfigProcessor}),
 * the shared WebClient builder ({@link org.tanzu.pvemcp.config.WebClientConfig})
 * and the wiring of the operation core ({@link org.tanzu.pvemcp.config.CoreConfig}).
 */
package org.tanzu.pvemcp.config;

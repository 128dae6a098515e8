/**
 * Proxmox VE access and VM operations.
 *
 * <p>Contains the REST adapter ({@link org.tanzu.pvemcp.pve.PveRestClient}), the operations
 * submitted to the task queue ({@link org.tanzu.pvemcp.pve.VmOperationService}) and the MCP
 * tools exposed to AI assistants ({@link org.tanzu.pvemcp.pve.PveService}).
 */
package org.tanzu.pvemcp.pve;

/**
 * Multi-cluster aggregation.
 *
 * <p>{@link org.tanzu.pvemcp.aggregator.ClusterAggregator} connects one client per profile,
 * tolerates profiles that fail, and merges their resources into an
 * {@link org.tanzu.pvemcp.aggregator.AggregatedView}.
 */
package org.tanzu.pvemcp.aggregator;

package com.vidnyan.attackpath.domain.metrics;

/**
 * Which part of the graph betweenness centrality is computed over.
 */
public enum CentralityScope {
    /** Every node and edge as declared. */
    FULL_GRAPH,
    /**
     * AND gates are removed before computing; channels and AND gates score 0,
     * so criticality reflects rule nodes only.
     */
    RULE_NODES
}

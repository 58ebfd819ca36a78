package com.vidnyan.attackpath.domain.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Betweenness centrality per node id, normalized to [0, 1].
 * Computed once per analysis run and read-only afterwards.
 */
public final class CentralityTable {

    private final Map<String, Double> values;

    public CentralityTable(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Centrality of a node; 0 for ids the table does not know.
     */
    public double get(String nodeId) {
        return values.getOrDefault(nodeId, 0.0);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "CentralityTable" + values;
    }
}

package com.vidnyan.attackpath.domain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed causal link. Identified by its declaration index so that
 * parallel edges between the same pair stay distinct.
 *
 * @param scored false when the edge carries no weight of its own and is left out
 *               of path cost and stealth, e.g. the inputs of a gate
 */
public record Edge(
    int index,
    String source,
    String target,
    double cost,
    double stealth,
    EdgeType type,
    boolean explicitWeights,
    boolean scored,
    Map<String, String> properties
) {

    public Edge {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Format as {@code source -> target}.
     */
    public String format() {
        return source + " -> " + target;
    }
}

package com.vidnyan.attackpath.domain.metrics;

import java.util.List;

/**
 * Scored attack path. Immutable.
 *
 * @param averageStealth mean edge stealth; higher means less likely to be noticed
 * @param length number of edges traversed
 */
public record PathScore(
    String pathId,
    List<String> nodeIds,
    double cost,
    double averageStealth,
    int length,
    double criticality
) {

    public PathScore {
        nodeIds = List.copyOf(nodeIds);
    }

    public String formattedNodes() {
        return String.join(" -> ", nodeIds);
    }
}

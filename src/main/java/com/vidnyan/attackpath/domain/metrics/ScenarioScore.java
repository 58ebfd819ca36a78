package com.vidnyan.attackpath.domain.metrics;

import java.util.List;

/**
 * Composite score of an attack scenario. Shared hops are counted once.
 *
 * @param length edges on the longest member path
 */
public record ScenarioScore(
    String scenarioId,
    List<String> pathIds,
    double cost,
    double averageStealth,
    int length,
    double criticality
) {

    public ScenarioScore {
        pathIds = List.copyOf(pathIds);
    }
}

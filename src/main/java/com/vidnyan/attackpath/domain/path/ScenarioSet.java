package com.vidnyan.attackpath.domain.path;

import java.util.List;

/**
 * Scenarios assembled from one target's paths.
 * {@code truncated} is set when more combinations existed than the limit allowed.
 */
public record ScenarioSet(
    String target,
    List<AttackScenario> scenarios,
    boolean truncated
) {

    public ScenarioSet {
        scenarios = List.copyOf(scenarios);
    }

    public static ScenarioSet empty(String target) {
        return new ScenarioSet(target, List.of(), false);
    }

    public int size() {
        return scenarios.size();
    }
}

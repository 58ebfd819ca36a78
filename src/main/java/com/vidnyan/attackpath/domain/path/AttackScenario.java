package com.vidnyan.attackpath.domain.path;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of paths that together realise one way of reaching the target.
 *
 * Every AND gate the member paths pass through has each of its inputs covered by
 * some member; at every other join exactly one input is taken. Paths that only
 * make sense together (the branches of one AND gate) therefore always share a scenario.
 */
public record AttackScenario(
    String id,
    List<AttackPath> paths
) {

    public AttackScenario {
        paths = List.copyOf(paths);
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("A scenario needs at least one path");
        }
    }

    public List<String> pathIds() {
        return paths.stream().map(AttackPath::id).toList();
    }

    /**
     * Edges of the scenario tree, each once, in member order.
     */
    public List<Integer> edgeIndices() {
        Set<Integer> edges = new LinkedHashSet<>();
        paths.forEach(p -> edges.addAll(p.edgeIndices()));
        return List.copyOf(edges);
    }

    /**
     * Nodes of the scenario tree, each once, in member order.
     */
    public List<String> nodeIds() {
        Set<String> nodes = new LinkedHashSet<>();
        paths.forEach(p -> nodes.addAll(p.nodeIds()));
        return List.copyOf(nodes);
    }

    /**
     * Longest member path, in edges.
     */
    public int depth() {
        return paths.stream().mapToInt(AttackPath::length).max().orElse(0);
    }
}

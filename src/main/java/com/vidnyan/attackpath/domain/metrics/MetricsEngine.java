package com.vidnyan.attackpath.domain.metrics;

import com.vidnyan.attackpath.domain.graph.Edge;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.path.AttackPath;
import com.vidnyan.attackpath.domain.path.AttackScenario;
import com.vidnyan.attackpath.domain.path.PathSet;
import com.vidnyan.attackpath.domain.path.ScenarioSet;

import java.util.List;
import java.util.Objects;

/**
 * Computes graph centrality and per-path scores.
 * Reads the graph and the enumerated paths; mutates neither.
 */
public class MetricsEngine {

    private final CriticalityMode criticalityMode;
    private final CentralityScope centralityScope;

    public MetricsEngine(CriticalityMode criticalityMode, CentralityScope centralityScope) {
        this.criticalityMode = Objects.requireNonNull(criticalityMode, "criticalityMode");
        this.centralityScope = Objects.requireNonNull(centralityScope, "centralityScope");
    }

    public CriticalityMode criticalityMode() {
        return criticalityMode;
    }

    public CentralityTable centrality(GraphModel graph) {
        return BetweennessCentrality.compute(graph, centralityScope);
    }

    /**
     * Score one path: summed edge cost, mean edge stealth, edge count and the
     * aggregated centrality of every node on it. Unscored edges count towards
     * the length only.
     */
    public PathScore score(GraphModel graph, AttackPath path, CentralityTable centrality) {
        double cost = 0.0;
        double stealth = 0.0;
        int scoredEdges = 0;
        for (int edgeIndex : path.edgeIndices()) {
            Edge edge = graph.edge(edgeIndex);
            if (!edge.scored()) {
                continue;
            }
            cost += edge.cost();
            stealth += edge.stealth();
            scoredEdges++;
        }
        double averageStealth = scoredEdges > 0 ? stealth / scoredEdges : 0.0;

        List<Double> centralities = path.nodeIds().stream()
                .map(centrality::get)
                .toList();

        return new PathScore(
                path.id(),
                path.nodeIds(),
                cost,
                averageStealth,
                path.length(),
                criticalityMode.aggregate(centralities)
        );
    }

    /**
     * Score a scenario over its tree: every distinct edge once for cost and stealth,
     * the deepest member for length and every distinct node for criticality.
     */
    public ScenarioScore score(GraphModel graph, AttackScenario scenario, CentralityTable centrality) {
        double cost = 0.0;
        double stealth = 0.0;
        int scoredEdges = 0;
        for (int edgeIndex : scenario.edgeIndices()) {
            Edge edge = graph.edge(edgeIndex);
            if (edge.scored()) {
                cost += edge.cost();
                stealth += edge.stealth();
                scoredEdges++;
            }
        }
        List<Double> centralities = scenario.nodeIds().stream()
                .map(centrality::get)
                .toList();

        return new ScenarioScore(
                scenario.id(),
                scenario.pathIds(),
                cost,
                scoredEdges > 0 ? stealth / scoredEdges : 0.0,
                scenario.depth(),
                criticalityMode.aggregate(centralities)
        );
    }

    public List<ScenarioScore> scoreAll(GraphModel graph, ScenarioSet scenarios, CentralityTable centrality) {
        return scenarios.scenarios().stream()
                .map(s -> score(graph, s, centrality))
                .toList();
    }

    public List<PathScore> scoreAll(GraphModel graph, PathSet paths, CentralityTable centrality) {
        return paths.paths().stream()
                .map(p -> score(graph, p, centrality))
                .toList();
    }
}

package com.vidnyan.attackpath.domain.metrics;

import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class BetweennessCentralityTest {

    private static final double EPSILON = 1e-12;

    @Test
    void compute_ShouldScoreMiddleOfChain() {
        // Arrange
        GraphModel graph = GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("b", NodeKind.ACTION)
                .node("c", NodeKind.ACTION)
                .edge("a", "b")
                .edge("b", "c")
                .build();

        // Act
        CentralityTable table = BetweennessCentrality.compute(graph, CentralityScope.FULL_GRAPH);

        // Assert
        assertEquals(0.0, table.get("a"));
        assertEquals(0.5, table.get("b"), EPSILON);
        assertEquals(0.0, table.get("c"));
        assertEquals(0.0, table.get("unknown"));
    }

    @Test
    void compute_ShouldIgnoreParallelEdgesAndSelfLoops() {
        // Arrange
        GraphModel graph = GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("b", NodeKind.ACTION)
                .node("c", NodeKind.ACTION)
                .edge("a", "b")
                .edge("a", "b")
                .edge("b", "b")
                .edge("b", "c")
                .build();

        // Act
        CentralityTable table = BetweennessCentrality.compute(graph, CentralityScope.FULL_GRAPH);

        // Assert
        assertEquals(0.5, table.get("b"), EPSILON);
    }

    @Test
    void compute_ShouldReturnZerosForTinyGraphs() {
        GraphModel graph = GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("b", NodeKind.ACTION)
                .edge("a", "b")
                .build();

        CentralityTable table = BetweennessCentrality.compute(graph, CentralityScope.FULL_GRAPH);

        assertEquals(Map.of("a", 0.0, "b", 0.0), table.asMap());
    }

    @Test
    void compute_ShouldZeroChannelsAndAndGatesInRuleNodeScope() {
        // Arrange: a -> ch -> b -> c
        GraphModel graph = GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("ch", NodeKind.CHANNEL)
                .node("b", NodeKind.ACTION)
                .node("c", NodeKind.ACTION)
                .edge("a", "ch")
                .edge("ch", "b")
                .edge("b", "c")
                .build();

        // Act
        CentralityTable full = BetweennessCentrality.compute(graph, CentralityScope.FULL_GRAPH);
        CentralityTable rules = BetweennessCentrality.compute(graph, CentralityScope.RULE_NODES);

        // Assert
        assertEquals(1.0 / 3.0, full.get("ch"), EPSILON);
        assertEquals(1.0 / 3.0, full.get("b"), EPSILON);
        assertEquals(0.0, rules.get("ch"));
        assertEquals(1.0 / 3.0, rules.get("b"), EPSILON);
    }

    @Test
    void compute_ShouldDropAndGatesBeforeScoringInRuleNodeScope() {
        // Arrange: a -> g(AND) -> c, b -> g
        GraphModel graph = GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("b", NodeKind.TRIGGER)
                .node("g", NodeKind.LOGIC_AND)
                .node("c", NodeKind.ACTION)
                .edge("a", "g")
                .edge("b", "g")
                .edge("g", "c")
                .build();

        // Act
        CentralityTable full = BetweennessCentrality.compute(graph, CentralityScope.FULL_GRAPH);
        CentralityTable rules = BetweennessCentrality.compute(graph, CentralityScope.RULE_NODES);

        // Assert
        assertEquals(1.0 / 3.0, full.get("g"), EPSILON);
        assertEquals(0.0, rules.get("g"));
        assertEquals(4, rules.size());
    }

    @Test
    void compute_ShouldNotDependOnDeclarationOrder() {
        Random random = new Random(11);
        for (int round = 0; round < 20; round++) {
            // Arrange
            int nodeCount = 3 + random.nextInt(8);
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < nodeCount; i++) {
                ids.add("n" + i);
            }
            List<String[]> edges = new ArrayList<>();
            for (int e = 0; e < nodeCount * 2; e++) {
                edges.add(new String[]{
                        ids.get(random.nextInt(nodeCount)), ids.get(random.nextInt(nodeCount))});
            }
            List<String> shuffledIds = new ArrayList<>(ids);
            List<String[]> shuffledEdges = new ArrayList<>(edges);
            Collections.shuffle(shuffledIds, random);
            Collections.shuffle(shuffledEdges, random);

            // Act
            CentralityTable original = BetweennessCentrality.compute(build(ids, edges), CentralityScope.FULL_GRAPH);
            CentralityTable permuted = BetweennessCentrality.compute(
                    build(shuffledIds, shuffledEdges), CentralityScope.FULL_GRAPH);

            // Assert
            for (String id : ids) {
                assertEquals(original.get(id), permuted.get(id), "centrality of " + id);
                assertTrue(original.get(id) >= 0.0 && original.get(id) <= 1.0 + EPSILON);
            }
        }
    }

    private static GraphModel build(List<String> ids, List<String[]> edges) {
        GraphModel.Builder builder = GraphModel.builder();
        ids.forEach(id -> builder.node(id, NodeKind.ACTION));
        edges.forEach(e -> builder.edge(e[0], e[1]));
        return builder.build();
    }
}

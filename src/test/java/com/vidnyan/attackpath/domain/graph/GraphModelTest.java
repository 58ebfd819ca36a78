package com.vidnyan.attackpath.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphModelTest {

    private static GraphModel diamond() {
        return GraphModel.builder()
                .node("s", NodeKind.TRIGGER)
                .node("a", NodeKind.ACTION)
                .node("b", NodeKind.ACTION)
                .node("g", NodeKind.LOGIC_OR)
                .edge("s", "a")
                .edge("s", "b")
                .edge("a", "g")
                .edge("b", "g")
                .edge("a", "g")
                .build();
    }

    @Test
    void neighbors_ShouldFollowDeclarationOrderAndCollapseParallelEdges() {
        // Arrange
        GraphModel graph = diamond();

        // Act & Assert
        assertEquals(List.of("a", "b"), graph.neighbors("g", Direction.INCOMING));
        assertEquals(List.of("a", "b"), graph.neighbors("s", Direction.OUTGOING));
        assertEquals(List.of("g"), graph.neighbors("a", Direction.OUTGOING));
        assertEquals(List.of(), graph.neighbors("s", Direction.INCOMING));
        assertEquals(3, graph.incomingEdges("g").size());
    }

    @Test
    void build_ShouldFillMissingEdgeWeightsFromProfile() {
        // Act
        GraphModel graph = diamond();

        // Assert
        for (Edge edge : graph.edges()) {
            assertEquals(0.0, edge.cost());
            assertEquals(1.0, edge.stealth());
        }
    }

    @Test
    void sourcesAndStats_ShouldDescribeStructure() {
        // Arrange
        GraphModel graph = diamond();

        // Act & Assert
        assertEquals(List.of("s"), graph.sources().stream().map(Node::id).toList());
        assertEquals(new GraphModel.Stats(4, 5, 1), graph.stats());
        assertEquals(List.of("g"), graph.nodesOfKind(NodeKind.LOGIC_OR).stream().map(Node::id).toList());
    }

    @Test
    void requireNode_ShouldRejectUnknownId() {
        GraphModel graph = diamond();

        assertThrows(IllegalArgumentException.class, () -> graph.requireNode("nope"));
        assertTrue(graph.node("nope").isEmpty());
        assertFalse(graph.contains("nope"));
    }

    @Test
    void build_ShouldRejectNodeWithoutKind() {
        GraphModel.Builder builder = GraphModel.builder()
                .node("x", null, Map.of(), Map.of("color", "red"), 4);

        MalformedGraphException e = assertThrows(MalformedGraphException.class, builder::build);
        assertEquals(4, e.line());
    }

    @Test
    void nodesAndEdges_ShouldBeImmutable() {
        GraphModel graph = diamond();

        assertThrows(UnsupportedOperationException.class, () -> graph.nodes().clear());
        assertThrows(UnsupportedOperationException.class, () -> graph.edges().clear());
        assertThrows(UnsupportedOperationException.class, () -> graph.requireNode("g").incoming().clear());
    }
}

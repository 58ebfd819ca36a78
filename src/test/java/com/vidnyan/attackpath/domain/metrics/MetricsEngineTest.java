package com.vidnyan.attackpath.domain.metrics;

import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import com.vidnyan.attackpath.domain.graph.WeightProfile;
import com.vidnyan.attackpath.domain.path.AttackPath;
import com.vidnyan.attackpath.domain.path.PathSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsEngineTest {

    private static final double EPSILON = 1e-12;

    private static GraphModel chain() {
        return GraphModel.builder()
                .node("a", NodeKind.TRIGGER)
                .node("b", NodeKind.CHANNEL)
                .node("c", NodeKind.ACTION)
                .edge("a", "b", 1.0, 0.5)
                .edge("b", "c", 2.0, 1.0)
                .build();
    }

    private static final AttackPath PATH = new AttackPath("P1", List.of("a", "b", "c"), List.of(0, 1));

    @Test
    void score_ShouldSumCostAndAverageStealth() {
        // Arrange
        GraphModel graph = chain();
        MetricsEngine engine = new MetricsEngine(CriticalityMode.MAX, CentralityScope.FULL_GRAPH);

        // Act
        PathScore score = engine.score(graph, PATH, engine.centrality(graph));

        // Assert
        assertEquals("P1", score.pathId());
        assertEquals(List.of("a", "b", "c"), score.nodeIds());
        assertEquals(3.0, score.cost(), EPSILON);
        assertEquals(0.75, score.averageStealth(), EPSILON);
        assertEquals(2, score.length());
        assertEquals(0.5, score.criticality(), EPSILON);
        assertEquals("a -> b -> c", score.formattedNodes());
    }

    @Test
    void score_ShouldLeaveUnscoredGateInputsOutOfCostAndStealth() {
        // Arrange
        GraphModel graph = GraphModel.builder()
                .weightProfile(WeightProfile.CHANNEL_TYPED)
                .node("t1", NodeKind.TRIGGER)
                .node("t2", NodeKind.TRIGGER)
                .node("and", NodeKind.LOGIC_AND)
                .node("a", NodeKind.ACTION)
                .edge("t1", "and")
                .edge("t2", "and")
                .edge("and", "a", 2.0, 0.5)
                .build();
        AttackPath branch = new AttackPath("P1", List.of("t1", "and", "a"), List.of(0, 2));
        MetricsEngine engine = new MetricsEngine(CriticalityMode.MAX, CentralityScope.FULL_GRAPH);

        // Act
        PathScore score = engine.score(graph, branch, engine.centrality(graph));

        // Assert
        assertEquals(2.0, score.cost(), EPSILON);
        assertEquals(0.5, score.averageStealth(), EPSILON);
        assertEquals(2, score.length());
    }

    @Test
    void score_ShouldAverageCentralityInMeanMode() {
        // Arrange
        GraphModel graph = chain();
        MetricsEngine engine = new MetricsEngine(CriticalityMode.MEAN, CentralityScope.FULL_GRAPH);

        // Act
        PathScore score = engine.score(graph, PATH, engine.centrality(graph));

        // Assert
        assertEquals(0.5 / 3.0, score.criticality(), EPSILON);
    }

    @Test
    void scoreAll_ShouldKeepEnumerationOrder() {
        // Arrange
        GraphModel graph = chain();
        MetricsEngine engine = new MetricsEngine(CriticalityMode.MAX, CentralityScope.FULL_GRAPH);
        AttackPath shorter = new AttackPath("P2", List.of("b", "c"), List.of(1));
        PathSet paths = new PathSet("c", List.of(PATH, shorter), false, List.of());

        // Act
        List<PathScore> scores = engine.scoreAll(graph, paths, engine.centrality(graph));

        // Assert
        assertEquals(List.of("P1", "P2"), scores.stream().map(PathScore::pathId).toList());
        assertEquals(2.0, scores.get(1).cost(), EPSILON);
    }

    @Test
    void aggregate_ShouldHandleEmptyInput() {
        assertEquals(0.0, CriticalityMode.MEAN.aggregate(List.of()));
        assertEquals(0.0, CriticalityMode.MAX.aggregate(List.of()));
        assertEquals(CriticalityMode.MEAN, CriticalityMode.parse("Mean"));
    }

    @Test
    void rank_ShouldPreferCriticalityThenStealthThenCostThenLength() {
        // Arrange
        PathScore critical = new PathScore("P4", List.of("x", "t"), 9.0, 0.1, 1, 0.9);
        PathScore stealthy = new PathScore("P3", List.of("x", "t"), 9.0, 0.8, 1, 0.5);
        PathScore cheap = new PathScore("P2", List.of("x", "t"), 1.0, 0.5, 3, 0.5);
        PathScore pricey = new PathScore("P1", List.of("x", "t"), 5.0, 0.5, 1, 0.5);
        PathScore shortCheap = new PathScore("P5", List.of("x", "t"), 1.0, 0.5, 1, 0.5);

        // Act
        List<PathScore> ranked = PathRanking.rank(List.of(pricey, cheap, stealthy, critical, shortCheap));

        // Assert
        assertEquals(List.of("P4", "P3", "P5", "P2", "P1"), ranked.stream().map(PathScore::pathId).toList());
    }

    @Test
    void top_ShouldReturnAllPathsTiedForBest() {
        // Arrange
        PathScore a = new PathScore("P1", List.of("a", "t"), 1.0, 1.0, 1, 0.5);
        PathScore b = new PathScore("P2", List.of("b", "t"), 1.0, 1.0, 1, 0.5);
        PathScore worse = new PathScore("P3", List.of("c", "t"), 1.0, 1.0, 1, 0.2);

        // Act
        List<PathScore> top = PathRanking.top(List.of(worse, b, a));

        // Assert
        assertEquals(List.of("P1", "P2"), top.stream().map(PathScore::pathId).toList());
        assertTrue(PathRanking.top(List.of()).isEmpty());
    }
}

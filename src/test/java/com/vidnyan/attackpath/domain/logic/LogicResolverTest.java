package com.vidnyan.attackpath.domain.logic;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.analysis.WarningType;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogicResolverTest {

    private final LogicResolver strict = new StrictLogicResolver();
    private final LogicResolver lenient = new LenientLogicResolver();

    /**
     * s1, s2 feed AND gate "and2" and OR gate "or2"; s1 alone feeds "and1" and "or1";
     * "and0" has no inputs.
     */
    private static GraphModel gates() {
        return GraphModel.builder()
                .node("s1", NodeKind.TRIGGER)
                .node("s2", NodeKind.TRIGGER)
                .node("and2", NodeKind.LOGIC_AND)
                .node("or2", NodeKind.LOGIC_OR)
                .node("and1", NodeKind.LOGIC_AND)
                .node("or1", NodeKind.LOGIC_OR)
                .node("and0", NodeKind.LOGIC_AND)
                .edge("s1", "and2")
                .edge("s2", "and2")
                .edge("s1", "or2")
                .edge("s2", "or2")
                .edge("s1", "and1")
                .edge("s1", "or1")
                .build();
    }

    @Test
    void classify_ShouldDifferOnlyOnDegenerateAndGates() {
        GraphModel graph = gates();

        assertEquals(GateSemantics.ALL, strict.classify(graph.requireNode("and2")));
        assertEquals(GateSemantics.ANY, strict.classify(graph.requireNode("or2")));
        assertEquals(GateSemantics.PASS_THROUGH, strict.classify(graph.requireNode("s1")));
        assertEquals(GateSemantics.BLOCKED, strict.classify(graph.requireNode("and1")));
        assertEquals(GateSemantics.PASS_THROUGH, strict.classify(graph.requireNode("or1")));
        assertEquals(GateSemantics.BLOCKED, strict.classify(graph.requireNode("and0")));

        assertEquals(GateSemantics.ALL, lenient.classify(graph.requireNode("and2")));
        assertEquals(GateSemantics.PASS_THROUGH, lenient.classify(graph.requireNode("and1")));
        assertEquals(GateSemantics.PASS_THROUGH, lenient.classify(graph.requireNode("or1")));
        assertEquals(GateSemantics.BLOCKED, lenient.classify(graph.requireNode("and0")));
    }

    @Test
    void isTraversable_ShouldRequireEveryInputOfAndGate() {
        Node and = gates().requireNode("and2");

        assertTrue(strict.isTraversable(and, Set.of(0, 1)));
        assertFalse(strict.isTraversable(and, Set.of(0)));
        assertFalse(strict.isTraversable(and, Set.of()));
    }

    @Test
    void isTraversable_ShouldRequireOneInputOfOrGate() {
        Node or = gates().requireNode("or2");

        assertTrue(strict.isTraversable(or, Set.of(2)));
        assertTrue(strict.isTraversable(or, Set.of(3)));
        assertFalse(strict.isTraversable(or, Set.of()));
        assertFalse(strict.isTraversable(or, Set.of(0, 1)), "edges of other nodes do not count");
    }

    @Test
    void isTraversable_ShouldTreatSourcesAsSatisfied() {
        Node source = gates().requireNode("s1");

        assertTrue(strict.isTraversable(source, Set.of()));
    }

    @Test
    void isTraversable_ShouldHonourPolicyForDegenerateAndGate() {
        Node and = gates().requireNode("and1");

        assertFalse(strict.isTraversable(and, Set.of(4)));
        assertTrue(lenient.isTraversable(and, Set.of(4)));
    }

    @Test
    void inspect_ShouldWarnAboutDegenerateGatesOnly() {
        GraphModel graph = gates();

        List<String> flagged = graph.nodes().stream()
                .map(strict::inspect)
                .flatMap(Optional::stream)
                .map(AnalysisWarning::nodeId)
                .toList();

        assertEquals(List.of("and1", "or1", "and0"), flagged);
    }

    @Test
    void inspect_ShouldDescribePolicyTreatment() {
        Node and = gates().requireNode("and1");

        AnalysisWarning strictWarning = strict.inspect(and).orElseThrow();
        AnalysisWarning lenientWarning = lenient.inspect(and).orElseThrow();

        assertEquals(WarningType.DEGENERATE_GATE, strictWarning.type());
        assertTrue(strictWarning.message().contains("no completed path"), strictWarning.message());
        assertTrue(lenientWarning.message().contains("pass-through"), lenientWarning.message());
    }

    @Test
    void forPolicy_ShouldReturnMatchingResolver() {
        assertEquals(GatePolicy.STRICT, LogicResolver.forPolicy(GatePolicy.STRICT).policy());
        assertEquals(GatePolicy.LENIENT, LogicResolver.forPolicy(GatePolicy.LENIENT).policy());
        assertEquals(GatePolicy.LENIENT, GatePolicy.parse(" lenient "));
    }
}

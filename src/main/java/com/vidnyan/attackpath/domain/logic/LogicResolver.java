package com.vidnyan.attackpath.domain.logic;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.graph.NodeKind;

import java.util.Collection;
import java.util.Optional;

/**
 * Interprets AND/OR gating nodes.
 * Implementations differ only in how they treat degenerate gates, so the
 * gating policy can be swapped without touching the path search.
 */
public interface LogicResolver {

    /**
     * Policy implemented by this resolver.
     */
    GatePolicy policy();

    /**
     * Decide the traversal rule for a node.
     */
    GateSemantics classify(Node node);

    /**
     * Check whether a node is entered given the incoming edges (by index) that
     * the paths considered together for one traversal actually use.
     */
    default boolean isTraversable(Node node, Collection<Integer> incomingEdgesUsed) {
        return switch (classify(node)) {
            case BLOCKED -> false;
            case ALL -> !node.incoming().isEmpty() && incomingEdgesUsed.containsAll(node.incoming());
            case ANY -> node.incoming().stream().anyMatch(incomingEdgesUsed::contains);
            case PASS_THROUGH -> node.incoming().isEmpty()
                    || node.incoming().stream().anyMatch(incomingEdgesUsed::contains);
        };
    }

    /**
     * Report a degenerate gate, i.e. an AND/OR node with fewer than two incoming edges.
     */
    default Optional<AnalysisWarning> inspect(Node node) {
        if (!node.isGate() || node.inDegree() >= 2) {
            return Optional.empty();
        }
        String treatment = classify(node) == GateSemantics.BLOCKED
                ? "no completed path may cross it"
                : "treated as a pass-through node";
        return Optional.of(AnalysisWarning.degenerateGate(node.id(), String.format(
                "%s gate has %d incoming edge(s), at least 2 expected; %s (%s policy)",
                node.kind() == NodeKind.LOGIC_AND ? "AND" : "OR",
                node.inDegree(), treatment, policy())));
    }

    /**
     * Resolver for a policy.
     */
    static LogicResolver forPolicy(GatePolicy policy) {
        return switch (policy) {
            case STRICT -> new StrictLogicResolver();
            case LENIENT -> new LenientLogicResolver();
        };
    }
}

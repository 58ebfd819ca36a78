package com.vidnyan.attackpath.domain.path;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.Edge;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import com.vidnyan.attackpath.domain.logic.GateSemantics;
import com.vidnyan.attackpath.domain.logic.LogicResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Enumerates every acyclic path from a source to a target.
 *
 * Works backwards from the target over incoming edges, in declaration order, and
 * composes the predecessor chains forward. Gate semantics come from the
 * {@link LogicResolver}: an AND gate contributes its chains only when every one of
 * its incoming edges produced at least one chain in the same traversal.
 *
 * Stateless between calls; all bookkeeping lives in a {@link TraversalState}
 * created per call, so one enumerator can search several targets concurrently.
 */
@Slf4j
public class PathEnumerator {

    private final LogicResolver resolver;
    private final EnumerationLimits limits;
    private final Set<NodeKind> entryKinds;

    public PathEnumerator(LogicResolver resolver, EnumerationLimits limits) {
        this(resolver, limits, Set.of());
    }

    /**
     * @param entryKinds kinds that may start a path even when they have incoming edges
     */
    public PathEnumerator(LogicResolver resolver, EnumerationLimits limits, Set<NodeKind> entryKinds) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.entryKinds = entryKinds.isEmpty() ? Set.of() : EnumSet.copyOf(entryKinds);
    }

    /**
     * Find all paths that reach the target node.
     * @throws IllegalArgumentException if the target is not part of the graph
     */
    public PathSet findAllPaths(GraphModel graph, String target) {
        Node targetNode = graph.requireNode(target);
        TraversalState state = new TraversalState(target, limits);

        log.debug("Starting reverse path search from '{}'", target);
        List<Chain> chains = targetNode.inDegree() == 0
                ? List.of()
                : expand(graph, targetNode, state, 0);

        List<AttackPath> paths = new ArrayList<>(chains.size());
        for (Chain chain : chains) {
            paths.add(toPath(graph, chain, "P" + (paths.size() + 1)));
        }

        List<AnalysisWarning> warnings = new ArrayList<>(state.warnings());
        if (paths.isEmpty() && !state.truncated()) {
            warnings.add(AnalysisWarning.unreachableTarget(target));
        }

        log.debug("Search for '{}' complete: {} paths, {} expansions{}", target, paths.size(),
                state.expansions(), state.truncated() ? " (truncated)" : "");
        return new PathSet(target, paths, state.truncated(), warnings);
    }

    private List<Chain> expand(GraphModel graph, Node node, TraversalState state, int depth) {
        if (!state.tryExpand()) {
            return List.of();
        }
        GateSemantics semantics = resolver.classify(node);
        if (semantics == GateSemantics.BLOCKED) {
            return List.of();
        }
        if (node.inDegree() == 0) {
            return state.tryStartChain() ? List.of(Chain.START) : List.of();
        }

        List<Chain> result = new ArrayList<>();
        if (depth > 0 && semantics == GateSemantics.PASS_THROUGH
                && entryKinds.contains(node.kind()) && state.tryStartChain()) {
            result.add(Chain.START);
        }

        state.enter(node.id());
        Set<Integer> usedEdges = new HashSet<>();
        List<Chain> branches = new ArrayList<>();
        for (int edgeIndex : node.incoming()) {
            if (state.budgetExhausted()) {
                break;
            }
            Edge edge = graph.edge(edgeIndex);
            if (state.isOnPath(edge.source())) {
                continue; // would close a cycle
            }
            Node predecessor = graph.requireNode(edge.source());
            if (state.atDepthLimit(depth)) {
                if (couldExtend(graph, predecessor, state)) {
                    state.recordDepthCut();
                }
                continue;
            }
            List<Chain> predecessorChains = expand(graph, predecessor, state, depth + 1);
            if (!predecessorChains.isEmpty()) {
                usedEdges.add(edgeIndex);
                for (Chain chain : predecessorChains) {
                    branches.add(chain.append(edgeIndex));
                }
            }
        }
        state.leave(node.id());

        if (resolver.isTraversable(node, usedEdges)) {
            result.addAll(branches);
        } else if (semantics == GateSemantics.ALL && !branches.isEmpty()) {
            log.trace("AND gate '{}' covered {}/{} inputs, dropping {} partial chains",
                    node.id(), usedEdges.size(), node.inDegree(), branches.size());
        }
        return result;
    }

    /**
     * Whether a predecessor refused at the depth limit could have extended a path:
     * it is not blocked and either starts a chain or has an input off the current path.
     */
    private boolean couldExtend(GraphModel graph, Node predecessor, TraversalState state) {
        GateSemantics semantics = resolver.classify(predecessor);
        if (semantics == GateSemantics.BLOCKED) {
            return false;
        }
        if (predecessor.inDegree() == 0
                || (semantics == GateSemantics.PASS_THROUGH && entryKinds.contains(predecessor.kind()))) {
            return true;
        }
        for (int edgeIndex : predecessor.incoming()) {
            String source = graph.edge(edgeIndex).source();
            if (!source.equals(predecessor.id()) && !state.isOnPath(source)) {
                return true;
            }
        }
        return false;
    }

    private static AttackPath toPath(GraphModel graph, Chain chain, String id) {
        List<Integer> edgeIndices = chain.edges();
        List<String> nodeIds = new ArrayList<>(edgeIndices.size() + 1);
        nodeIds.add(graph.edge(edgeIndices.get(0)).source());
        for (int edgeIndex : edgeIndices) {
            nodeIds.add(graph.edge(edgeIndex).target());
        }
        return new AttackPath(id, nodeIds, edgeIndices);
    }

    /**
     * Persistent edge list growing towards the target; START is the empty chain.
     */
    private record Chain(int edgeIndex, Chain prefix) {

        static final Chain START = new Chain(-1, null);

        Chain append(int edge) {
            return new Chain(edge, this);
        }

        List<Integer> edges() {
            Deque<Integer> edges = new ArrayDeque<>();
            for (Chain c = this; c != START; c = c.prefix) {
                edges.addFirst(c.edgeIndex);
            }
            return new ArrayList<>(edges);
        }
    }
}

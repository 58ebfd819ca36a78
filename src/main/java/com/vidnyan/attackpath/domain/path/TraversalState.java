package com.vidnyan.attackpath.domain.path;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable bookkeeping of a single search: the nodes on the current partial path
 * and the budgets spent so far. One instance per {@code findAllPaths} call, never shared.
 */
final class TraversalState {

    private final String target;
    private final EnumerationLimits limits;
    private final Set<String> onPath = new HashSet<>();
    private int chainsStarted;
    private long expansions;
    private boolean budgetExhausted;
    private boolean explorationExhausted;
    private boolean depthCut;

    TraversalState(String target, EnumerationLimits limits) {
        this.target = target;
        this.limits = limits;
    }

    void enter(String nodeId) {
        onPath.add(nodeId);
    }

    void leave(String nodeId) {
        onPath.remove(nodeId);
    }

    boolean isOnPath(String nodeId) {
        return onPath.contains(nodeId);
    }

    /**
     * Spend one unit of the path budget.
     * @return false once the budget is gone; the search must then unwind
     */
    boolean tryStartChain() {
        if (chainsStarted >= limits.maxPaths()) {
            budgetExhausted = true;
            return false;
        }
        chainsStarted++;
        return true;
    }

    /**
     * Spend one unit of the expansion budget.
     * @return false once the budget is gone; the search must then unwind
     */
    boolean tryExpand() {
        if (expansions >= limits.maxExpansions()) {
            explorationExhausted = true;
            return false;
        }
        expansions++;
        return true;
    }

    boolean budgetExhausted() {
        return budgetExhausted || explorationExhausted;
    }

    boolean atDepthLimit(int depth) {
        return depth >= limits.maxDepth();
    }

    void recordDepthCut() {
        depthCut = true;
    }

    long expansions() {
        return expansions;
    }

    boolean truncated() {
        return budgetExhausted() || depthCut;
    }

    List<AnalysisWarning> warnings() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        if (budgetExhausted) {
            warnings.add(AnalysisWarning.pathLimitExceeded(target, limits.maxPaths()));
        }
        if (explorationExhausted) {
            warnings.add(AnalysisWarning.explorationLimitExceeded(target, limits.maxExpansions()));
        }
        if (depthCut) {
            warnings.add(AnalysisWarning.depthLimitReached(target, limits.maxDepth()));
        }
        return warnings;
    }
}

package com.vidnyan.attackpath.domain.analysis;

/**
 * A warning attached to an analysis result. Warnings never abort a run.
 *
 * @param nodeId node the warning concerns, or null for run-wide warnings
 */
public record AnalysisWarning(
    WarningType type,
    String nodeId,
    String message
) {

    public static AnalysisWarning degenerateGate(String nodeId, String message) {
        return new AnalysisWarning(WarningType.DEGENERATE_GATE, nodeId, message);
    }

    public static AnalysisWarning pathLimitExceeded(String targetId, int maxPaths) {
        return new AnalysisWarning(WarningType.PATH_LIMIT_EXCEEDED, targetId, String.format(
                "Path budget of %d exhausted while searching for '%s'; result set is truncated",
                maxPaths, targetId));
    }

    public static AnalysisWarning explorationLimitExceeded(String targetId, long maxExpansions) {
        return new AnalysisWarning(WarningType.PATH_LIMIT_EXCEEDED, targetId, String.format(
                "Search stopped after expanding %d nodes while looking for '%s'; result set is truncated",
                maxExpansions, targetId));
    }

    public static AnalysisWarning depthLimitReached(String targetId, int maxDepth) {
        return new AnalysisWarning(WarningType.DEPTH_LIMIT_REACHED, targetId, String.format(
                "Branches longer than %d edges were cut while searching for '%s'; result set is truncated",
                maxDepth, targetId));
    }

    public static AnalysisWarning unreachableTarget(String targetId) {
        return new AnalysisWarning(WarningType.UNREACHABLE_TARGET, targetId,
                "No path from any source reaches '" + targetId + "'");
    }

    /**
     * Format for log output.
     */
    public String format() {
        return nodeId != null
                ? String.format("[%s] %s: %s", type, nodeId, message)
                : String.format("[%s] %s", type, message);
    }
}

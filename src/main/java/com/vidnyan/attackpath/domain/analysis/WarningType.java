package com.vidnyan.attackpath.domain.analysis;

/**
 * Non-fatal anomalies recorded while analysing a graph.
 */
public enum WarningType {
    /** An AND/OR gate with fewer than two incoming edges. */
    DEGENERATE_GATE,
    /** Enumeration stopped after exhausting its path budget. */
    PATH_LIMIT_EXCEEDED,
    /** At least one branch was cut at the maximum depth. */
    DEPTH_LIMIT_REACHED,
    /** No path from any source reaches the target. */
    UNREACHABLE_TARGET
}

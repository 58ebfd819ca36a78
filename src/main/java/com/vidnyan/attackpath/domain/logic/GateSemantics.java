package com.vidnyan.attackpath.domain.logic;

/**
 * Traversal rule a resolver assigns to a node.
 */
public enum GateSemantics {
    /** Plain node: entered through any single incoming edge, or a source when it has none. */
    PASS_THROUGH,
    /** OR gate: at least one incoming edge must be satisfied. */
    ANY,
    /** AND gate: every declared incoming edge must be satisfied. */
    ALL,
    /** Unsatisfiable gate: never entered, never a source. */
    BLOCKED
}

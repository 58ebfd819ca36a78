package com.vidnyan.attackpath.domain.logic;

import java.util.Locale;

/**
 * How degenerate AND gates (fewer than two incoming edges) are treated.
 */
public enum GatePolicy {
    /** A degenerate AND gate cannot be satisfied; no completed path crosses it. */
    STRICT,
    /** A degenerate AND gate is crossed as if it were a plain node. */
    LENIENT;

    public static GatePolicy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.vidnyan.attackpath.domain.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a node in the rule interaction graph.
 */
public enum NodeKind {
    TRIGGER,
    ACTION,
    CHANNEL,
    LOGIC_AND,
    LOGIC_OR;

    /**
     * Gating nodes combine their incoming edges with AND/OR semantics.
     */
    public boolean isGate() {
        return this == LOGIC_AND || this == LOGIC_OR;
    }

    /**
     * Parse a kind name as written in a description or on the command line.
     * Accepts the enum names plus the short forms used by the graph generator.
     */
    public static Optional<NodeKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT).replace('-', '_')) {
            case "TRIGGER", "T" -> Optional.of(TRIGGER);
            case "ACTION", "A" -> Optional.of(ACTION);
            case "CHANNEL", "CH", "PHYSICAL_CHANNEL", "SYSTEM_CHANNEL" -> Optional.of(CHANNEL);
            case "AND", "LOGIC_AND" -> Optional.of(LOGIC_AND);
            case "OR", "LOGIC_OR" -> Optional.of(LOGIC_OR);
            default -> Optional.empty();
        };
    }
}

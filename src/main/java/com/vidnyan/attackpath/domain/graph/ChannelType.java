package com.vidnyan.attackpath.domain.graph;

/**
 * Flavour of an implicit channel, taken from the {@code [Physical]} /
 * {@code [System]} suffix the graph generator writes into channel labels.
 */
public enum ChannelType {
    PHYSICAL,
    SYSTEM,
    GENERIC,
    NONE;

    static ChannelType fromLabel(NodeKind kind, String label) {
        if (kind != NodeKind.CHANNEL) {
            return NONE;
        }
        if (label != null && label.contains("[Physical]")) {
            return PHYSICAL;
        }
        if (label != null && label.contains("[System]")) {
            return SYSTEM;
        }
        return GENERIC;
    }
}

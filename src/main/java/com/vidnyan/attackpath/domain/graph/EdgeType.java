package com.vidnyan.attackpath.domain.graph;

/**
 * Causal link classification, derived from the channel types of the edge endpoints.
 */
public enum EdgeType {
    EXPLICIT,
    PHYSICAL_IMPLICIT,
    SYSTEM_IMPLICIT;

    static EdgeType between(Node source, Node target) {
        if (source.channelType() == ChannelType.PHYSICAL || target.channelType() == ChannelType.PHYSICAL) {
            return PHYSICAL_IMPLICIT;
        }
        if (source.channelType() == ChannelType.SYSTEM || target.channelType() == ChannelType.SYSTEM) {
            return SYSTEM_IMPLICIT;
        }
        return EXPLICIT;
    }
}

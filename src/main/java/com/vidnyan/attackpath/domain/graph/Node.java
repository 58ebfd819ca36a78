package com.vidnyan.attackpath.domain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the interaction graph.
 * Immutable; owned by {@link GraphModel}. Edge references are declaration
 * indices into {@link GraphModel#edges()}, kept in declaration order.
 */
public record Node(
    String id,
    NodeKind kind,
    ChannelType channelType,
    String label,
    Map<String, Double> attributes,
    Map<String, String> properties,
    List<Integer> incoming,
    List<Integer> outgoing
) {

    public Node {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        incoming = List.copyOf(incoming);
        outgoing = List.copyOf(outgoing);
    }

    public int inDegree() {
        return incoming.size();
    }

    public int outDegree() {
        return outgoing.size();
    }

    public boolean isGate() {
        return kind.isGate();
    }

    /**
     * Numeric attribute value, or the given default when the node does not carry it.
     */
    public double attribute(String key, double defaultValue) {
        Double value = attributes.get(key);
        return value != null ? value : defaultValue;
    }
}

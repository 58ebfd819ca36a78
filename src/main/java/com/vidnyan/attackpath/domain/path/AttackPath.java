package com.vidnyan.attackpath.domain.path;

import java.util.List;

/**
 * An acyclic path from a source to the target.
 * Holds node ids and edge indices only; the graph owns the nodes and edges.
 * Edge indices tell parallel edges apart, so two paths may share a node sequence.
 */
public record AttackPath(
    String id,
    List<String> nodeIds,
    List<Integer> edgeIndices
) {

    public AttackPath {
        nodeIds = List.copyOf(nodeIds);
        edgeIndices = List.copyOf(edgeIndices);
        if (nodeIds.size() != edgeIndices.size() + 1) {
            throw new IllegalArgumentException(
                    "A path over " + edgeIndices.size() + " edges needs " + (edgeIndices.size() + 1) + " nodes");
        }
    }

    public String source() {
        return nodeIds.get(0);
    }

    public String target() {
        return nodeIds.get(nodeIds.size() - 1);
    }

    /**
     * Number of edges traversed.
     */
    public int length() {
        return edgeIndices.size();
    }

    public boolean contains(String nodeId) {
        return nodeIds.contains(nodeId);
    }

    /**
     * Format the node sequence for display.
     */
    public String formattedNodes() {
        return String.join(" -> ", nodeIds);
    }
}

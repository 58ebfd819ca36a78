package com.vidnyan.attackpath.domain.graph;

import java.util.*;

/**
 * Structural model of a rule interaction graph.
 * Bidirectional index: node → outgoing edges, node → incoming edges.
 * Immutable and thread-safe once built; concurrent searches share one instance.
 */
public final class GraphModel {

    private final Map<String, Node> nodes;
    private final List<Node> nodeList;
    private final List<Edge> edges;

    private GraphModel(Map<String, Node> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.nodeList = List.copyOf(nodes.values());
        this.edges = List.copyOf(edges);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * All nodes in declaration order.
     */
    public List<Node> nodes() {
        return nodeList;
    }

    /**
     * All edges in declaration order; an edge's position equals its index.
     */
    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * Get a node that must exist.
     * @throws IllegalArgumentException if the id is not part of the graph
     */
    public Node requireNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Node '" + nodeId + "' does not exist in the graph");
        }
        return node;
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Edge edge(int index) {
        return edges.get(index);
    }

    public List<Edge> incomingEdges(String nodeId) {
        return requireNode(nodeId).incoming().stream().map(edges::get).toList();
    }

    public List<Edge> outgoingEdges(String nodeId) {
        return requireNode(nodeId).outgoing().stream().map(edges::get).toList();
    }

    /**
     * Distinct neighbour ids in edge declaration order.
     * Parallel edges contribute their neighbour once.
     */
    public List<String> neighbors(String nodeId, Direction direction) {
        Node node = requireNode(nodeId);
        List<Integer> refs = direction == Direction.INCOMING ? node.incoming() : node.outgoing();
        Set<String> result = new LinkedHashSet<>();
        for (int ref : refs) {
            Edge edge = edges.get(ref);
            result.add(direction == Direction.INCOMING ? edge.source() : edge.target());
        }
        return List.copyOf(result);
    }

    /**
     * Numeric node attribute with a fallback value.
     */
    public double attribute(String nodeId, String key, double defaultValue) {
        return requireNode(nodeId).attribute(key, defaultValue);
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodeList.stream().filter(n -> n.kind() == kind).toList();
    }

    /**
     * Nodes without incoming edges.
     */
    public List<Node> sources() {
        return nodeList.stream().filter(n -> n.inDegree() == 0).toList();
    }

    public Stats stats() {
        return new Stats(
                nodeList.size(),
                edges.size(),
                (int) nodeList.stream().filter(Node::isGate).count()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int gateCount) {}

    /**
     * Accumulates node and edge declarations and validates them into a {@link GraphModel}.
     * A node may be declared more than once; declarations merge as long as they do not
     * disagree on kind or on a numeric attribute.
     */
    public static final class Builder {

        private final Map<String, PendingNode> pendingNodes = new LinkedHashMap<>();
        private final List<PendingEdge> pendingEdges = new ArrayList<>();
        private WeightProfile weightProfile = WeightProfile.NEUTRAL;

        private Builder() {
        }

        public Builder weightProfile(WeightProfile profile) {
            this.weightProfile = Objects.requireNonNull(profile, "weightProfile");
            return this;
        }

        public Builder node(String id, NodeKind kind) {
            return node(id, kind, Map.of(), Map.of(), -1);
        }

        /**
         * Declare or re-declare a node.
         * @param kind resolved kind, or null when this declaration does not say
         * @param line source line for error messages, -1 when unknown
         */
        public Builder node(String id, NodeKind kind, Map<String, Double> attributes,
                            Map<String, String> properties, int line) {
            if (id == null || id.isEmpty()) {
                throw new MalformedGraphException("Node declaration without an id", line);
            }
            PendingNode pending = pendingNodes.computeIfAbsent(id, k -> new PendingNode(id, line));
            if (kind != null) {
                if (pending.kind != null && pending.kind != kind) {
                    throw new MalformedGraphException(String.format(
                            "Conflicting kinds for node '%s': %s and %s", id, pending.kind, kind), line);
                }
                pending.kind = kind;
            }
            for (Map.Entry<String, Double> attr : attributes.entrySet()) {
                Double previous = pending.attributes.putIfAbsent(attr.getKey(), attr.getValue());
                if (previous != null && Double.compare(previous, attr.getValue()) != 0) {
                    throw new MalformedGraphException(String.format(
                            "Conflicting values for attribute '%s' of node '%s': %s and %s",
                            attr.getKey(), id, previous, attr.getValue()), line);
                }
            }
            pending.properties.putAll(properties);
            return this;
        }

        public Builder edge(String source, String target) {
            return edge(source, target, null, null, Map.of(), -1);
        }

        public Builder edge(String source, String target, double cost, double stealth) {
            return edge(source, target, cost, stealth, Map.of(), -1);
        }

        /**
         * Declare an edge. Null weights are filled from the weight profile at build time.
         */
        public Builder edge(String source, String target, Double cost, Double stealth,
                            Map<String, String> properties, int line) {
            pendingEdges.add(new PendingEdge(source, target, cost, stealth, new LinkedHashMap<>(properties), line));
            return this;
        }

        public GraphModel build() {
            Map<String, List<Integer>> incoming = new HashMap<>();
            Map<String, List<Integer>> outgoing = new HashMap<>();

            for (PendingNode pending : pendingNodes.values()) {
                if (pending.kind == null) {
                    throw new MalformedGraphException(
                            "Cannot determine the kind of node '" + pending.id + "'", pending.line);
                }
                incoming.put(pending.id, new ArrayList<>());
                outgoing.put(pending.id, new ArrayList<>());
            }

            for (int i = 0; i < pendingEdges.size(); i++) {
                PendingEdge edge = pendingEdges.get(i);
                requireDeclared(edge.source, edge);
                requireDeclared(edge.target, edge);
                outgoing.get(edge.source).add(i);
                incoming.get(edge.target).add(i);
            }

            Map<String, Node> nodes = new LinkedHashMap<>();
            for (PendingNode pending : pendingNodes.values()) {
                String label = pending.properties.getOrDefault("label", pending.id);
                nodes.put(pending.id, new Node(
                        pending.id,
                        pending.kind,
                        ChannelType.fromLabel(pending.kind, label),
                        label,
                        pending.attributes,
                        pending.properties,
                        incoming.get(pending.id),
                        outgoing.get(pending.id)
                ));
            }

            List<Edge> edges = new ArrayList<>(pendingEdges.size());
            for (int i = 0; i < pendingEdges.size(); i++) {
                PendingEdge pending = pendingEdges.get(i);
                Node source = nodes.get(pending.source);
                Node target = nodes.get(pending.target);
                EdgeType type = EdgeType.between(source, target);
                boolean explicit = pending.cost != null || pending.stealth != null;
                boolean scored = explicit || weightProfile.scores(source, target);
                double cost = pending.cost != null ? pending.cost : scored ? weightProfile.defaultCost(type) : 0.0;
                double stealth = pending.stealth != null ? pending.stealth : scored ? weightProfile.defaultStealth(type) : 0.0;
                edges.add(new Edge(i, pending.source, pending.target, cost, stealth, type,
                        explicit, scored, pending.properties));
            }

            return new GraphModel(nodes, edges);
        }

        private void requireDeclared(String nodeId, PendingEdge edge) {
            if (!pendingNodes.containsKey(nodeId)) {
                throw new MalformedGraphException(String.format(
                        "Edge %s -> %s references undeclared node '%s'",
                        edge.source, edge.target, nodeId), edge.line);
            }
        }

        private static final class PendingNode {
            private final String id;
            private final int line;
            private NodeKind kind;
            private final Map<String, Double> attributes = new LinkedHashMap<>();
            private final Map<String, String> properties = new LinkedHashMap<>();

            private PendingNode(String id, int line) {
                this.id = id;
                this.line = line;
            }
        }

        private record PendingEdge(
            String source,
            String target,
            Double cost,
            Double stealth,
            Map<String, String> properties,
            int line
        ) {}
    }
}

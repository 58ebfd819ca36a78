package com.vidnyan.attackpath.adapter.out.parser;

import com.vidnyan.attackpath.domain.graph.MalformedGraphException;
import com.vidnyan.attackpath.domain.graph.NodeKind;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Infers a node's kind from its id, label and shape, following the conventions of
 * the interaction graph generator: {@code T_} triggers, {@code A_} actions,
 * {@code CH_} channels (ellipses), {@code LOGIC_} / {@code IMPLICIT_AND_} diamonds
 * labelled AND or OR. An explicit {@code kind} (or {@code type}) attribute wins.
 */
final class NodeKindResolver {

    static final String KIND_KEY = "kind";
    static final String TYPE_KEY = "type";

    private NodeKindResolver() {
    }

    static Optional<NodeKind> resolve(String id, Map<String, String> attributes, int line) {
        String explicit = attributes.containsKey(KIND_KEY) ? attributes.get(KIND_KEY) : attributes.get(TYPE_KEY);
        if (explicit != null) {
            return Optional.of(NodeKind.parse(explicit).orElseThrow(() -> new MalformedGraphException(
                    "Unknown kind '" + explicit + "' for node '" + id + "'", line)));
        }

        String label = attributes.getOrDefault("label", "");
        String shape = attributes.getOrDefault("shape", "").toLowerCase(Locale.ROOT);

        boolean gateId = id.startsWith("LOGIC_") || id.startsWith("IMPLICIT_AND_");
        boolean diamond = shape.equals("diamond");
        if (gateId || diamond) {
            Optional<NodeKind> gate = gateKind(label);
            if (gate.isEmpty() && gateId) {
                gate = gateKindFromId(id, true);
            }
            if (gate.isPresent()) {
                return gate;
            }
        }
        if (id.startsWith("T_")) {
            return Optional.of(NodeKind.TRIGGER);
        }
        if (id.startsWith("A_")) {
            return Optional.of(NodeKind.ACTION);
        }
        if (id.startsWith("CH_")) {
            return Optional.of(NodeKind.CHANNEL);
        }
        if (label.startsWith("Trigger_")) {
            return Optional.of(NodeKind.TRIGGER);
        }
        if (label.startsWith("Action_")) {
            return Optional.of(NodeKind.ACTION);
        }
        if (shape.equals("ellipse")) {
            return Optional.of(NodeKind.CHANNEL);
        }
        return diamond ? gateKindFromId(id, false) : Optional.empty();
    }

    private static Optional<NodeKind> gateKind(String label) {
        String normalizedLabel = label.trim().toUpperCase(Locale.ROOT);
        if (normalizedLabel.equals("AND")) {
            return Optional.of(NodeKind.LOGIC_AND);
        }
        if (normalizedLabel.equals("OR")) {
            return Optional.of(NodeKind.LOGIC_OR);
        }
        return Optional.empty();
    }

    /**
     * Gate kind from the id alone.
     * @param gateId the id carries a gate prefix; only then is a bare AND/OR substring trusted
     */
    private static Optional<NodeKind> gateKindFromId(String id, boolean gateId) {
        String upperId = id.toUpperCase(Locale.ROOT);
        if (upperId.endsWith("_AND") || upperId.startsWith("IMPLICIT_AND_")) {
            return Optional.of(NodeKind.LOGIC_AND);
        }
        if (upperId.endsWith("_OR")) {
            return Optional.of(NodeKind.LOGIC_OR);
        }
        if (!gateId) {
            return Optional.empty();
        }
        if (upperId.contains("AND")) {
            return Optional.of(NodeKind.LOGIC_AND);
        }
        if (upperId.contains("OR")) {
            return Optional.of(NodeKind.LOGIC_OR);
        }
        return Optional.empty();
    }
}

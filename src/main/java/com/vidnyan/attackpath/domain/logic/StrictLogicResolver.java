package com.vidnyan.attackpath.domain.logic;

import com.vidnyan.attackpath.domain.graph.Node;
import org.springframework.stereotype.Component;

/**
 * Degenerate AND gates are unsatisfiable; an OR gate with a single input passes through.
 * A gate without inputs never fires.
 */
@Component
public class StrictLogicResolver implements LogicResolver {

    @Override
    public GatePolicy policy() {
        return GatePolicy.STRICT;
    }

    @Override
    public GateSemantics classify(Node node) {
        if (node.isGate() && node.inDegree() == 0) {
            return GateSemantics.BLOCKED;
        }
        return switch (node.kind()) {
            case LOGIC_AND -> node.inDegree() >= 2 ? GateSemantics.ALL : GateSemantics.BLOCKED;
            case LOGIC_OR -> node.inDegree() >= 2 ? GateSemantics.ANY : GateSemantics.PASS_THROUGH;
            default -> GateSemantics.PASS_THROUGH;
        };
    }
}

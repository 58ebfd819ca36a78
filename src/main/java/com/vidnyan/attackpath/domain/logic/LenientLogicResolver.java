package com.vidnyan.attackpath.domain.logic;

import com.vidnyan.attackpath.domain.graph.Node;
import org.springframework.stereotype.Component;

/**
 * A gate with a single input is crossed as a plain node; a gate without inputs never fires.
 */
@Component
public class LenientLogicResolver implements LogicResolver {

    @Override
    public GatePolicy policy() {
        return GatePolicy.LENIENT;
    }

    @Override
    public GateSemantics classify(Node node) {
        if (node.isGate() && node.inDegree() == 0) {
            return GateSemantics.BLOCKED;
        }
        return switch (node.kind()) {
            case LOGIC_AND -> node.inDegree() >= 2 ? GateSemantics.ALL : GateSemantics.PASS_THROUGH;
            case LOGIC_OR -> node.inDegree() >= 2 ? GateSemantics.ANY : GateSemantics.PASS_THROUGH;
            default -> GateSemantics.PASS_THROUGH;
        };
    }
}

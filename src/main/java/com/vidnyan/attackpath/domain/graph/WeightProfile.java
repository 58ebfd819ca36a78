package com.vidnyan.attackpath.domain.graph;

/**
 * Supplies cost and stealth for edges whose description carries no weight.
 * Explicit weights in the description always win.
 */
public enum WeightProfile {

    /** Cost 0 and stealth 1.0 for every unweighted edge. */
    NEUTRAL {
        @Override
        public double defaultCost(EdgeType type) {
            return 0.0;
        }

        @Override
        public double defaultStealth(EdgeType type) {
            return 1.0;
        }
    },

    /**
     * Weights by channel flavour: physical channels are the most expensive and the
     * most stealthy hop, system channels sit in between, explicit rule links cost 1.
     * Links into a gate carry no weight; the gate's output link is scored instead.
     */
    CHANNEL_TYPED {
        @Override
        public boolean scores(Node source, Node target) {
            return !target.isGate();
        }

        @Override
        public double defaultCost(EdgeType type) {
            return switch (type) {
                case PHYSICAL_IMPLICIT -> 5.0;
                case SYSTEM_IMPLICIT -> 3.0;
                case EXPLICIT -> 1.0;
            };
        }

        @Override
        public double defaultStealth(EdgeType type) {
            return switch (type) {
                case PHYSICAL_IMPLICIT -> 3.0;
                case SYSTEM_IMPLICIT -> 2.0;
                case EXPLICIT -> 1.0;
            };
        }
    };

    /**
     * Whether an unweighted edge between the two nodes counts towards path scores.
     */
    public boolean scores(Node source, Node target) {
        return true;
    }

    public abstract double defaultCost(EdgeType type);

    public abstract double defaultStealth(EdgeType type);
}

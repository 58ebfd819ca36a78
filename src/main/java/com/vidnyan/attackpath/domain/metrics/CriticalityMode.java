package com.vidnyan.attackpath.domain.metrics;

import java.util.List;
import java.util.Locale;

/**
 * How node centralities along a path are folded into the path's criticality.
 */
public enum CriticalityMode {
    /** Arithmetic mean over every node on the path. */
    MEAN,
    /** Highest centrality of any node on the path. */
    MAX;

    public double aggregate(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return switch (this) {
            case MEAN -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case MAX -> values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        };
    }

    public static CriticalityMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.vidnyan.attackpath.domain.metrics;

import java.util.Comparator;
import java.util.List;

/**
 * Orders scored paths by attack feasibility: most critical first, then the
 * stealthiest, then the cheapest, then the shortest.
 */
public final class PathRanking {

    private static final Comparator<PathScore> BY_FEASIBILITY = Comparator
            .comparingDouble(PathScore::criticality).reversed()
            .thenComparing(Comparator.comparingDouble(PathScore::averageStealth).reversed())
            .thenComparingDouble(PathScore::cost)
            .thenComparingInt(PathScore::length);

    /**
     * Feasibility order with the path id as final tie-break.
     */
    public static final Comparator<PathScore> ORDER = BY_FEASIBILITY.thenComparing(PathScore::pathId);

    private PathRanking() {
    }

    public static List<PathScore> rank(List<PathScore> scores) {
        return scores.stream().sorted(ORDER).toList();
    }

    /**
     * All paths tied for the best feasibility; empty when there are no paths.
     */
    public static List<PathScore> top(List<PathScore> scores) {
        List<PathScore> ranked = rank(scores);
        if (ranked.isEmpty()) {
            return ranked;
        }
        PathScore best = ranked.get(0);
        return ranked.stream()
                .filter(s -> BY_FEASIBILITY.compare(s, best) == 0)
                .toList();
    }
}

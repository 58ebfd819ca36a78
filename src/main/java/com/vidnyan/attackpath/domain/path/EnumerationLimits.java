package com.vidnyan.attackpath.domain.path;

/**
 * Bounds on path exploration. All limits are mandatory.
 *
 * @param maxPaths number of source chains the search may start before it stops
 * @param maxDepth longest path, in edges, the search follows
 * @param maxExpansions number of nodes the search may expand, counted on every visit;
 *                      caps the work on dense graphs where few chains ever reach a source
 */
public record EnumerationLimits(int maxPaths, int maxDepth, long maxExpansions) {

    public static final int DEFAULT_MAX_PATHS = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int EXPANSIONS_PER_PATH = 1_000;

    public EnumerationLimits {
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be at least 1, got " + maxPaths);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (maxExpansions < 1) {
            throw new IllegalArgumentException("maxExpansions must be at least 1, got " + maxExpansions);
        }
    }

    /**
     * Limits with an expansion budget of {@value #EXPANSIONS_PER_PATH} per allowed path.
     */
    public EnumerationLimits(int maxPaths, int maxDepth) {
        this(maxPaths, maxDepth, (long) maxPaths * EXPANSIONS_PER_PATH);
    }

    public static EnumerationLimits defaults() {
        return new EnumerationLimits(DEFAULT_MAX_PATHS, DEFAULT_MAX_DEPTH);
    }
}

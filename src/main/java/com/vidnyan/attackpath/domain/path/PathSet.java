package com.vidnyan.attackpath.domain.path;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;

import java.util.List;

/**
 * Paths found for one target.
 * When {@code truncated} is set the search hit a limit and the paths are a prefix
 * of the complete result, never the complete result.
 */
public record PathSet(
    String target,
    List<AttackPath> paths,
    boolean truncated,
    List<AnalysisWarning> warnings
) {

    public PathSet {
        paths = List.copyOf(paths);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public int size() {
        return paths.size();
    }
}

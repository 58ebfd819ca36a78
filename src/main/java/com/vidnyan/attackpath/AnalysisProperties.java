package com.vidnyan.attackpath;

import com.vidnyan.attackpath.domain.graph.NodeKind;
import com.vidnyan.attackpath.domain.graph.WeightProfile;
import com.vidnyan.attackpath.domain.logic.GatePolicy;
import com.vidnyan.attackpath.domain.metrics.CentralityScope;
import com.vidnyan.attackpath.domain.metrics.CriticalityMode;
import com.vidnyan.attackpath.domain.path.EnumerationLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml;
 * command line options override them per run.
 */
@Data
@Component
@ConfigurationProperties(prefix = "attackpath.analysis")
public class AnalysisProperties {

    /**
     * Upper bound on the number of paths enumerated per target.
     */
    private int maxPaths = EnumerationLimits.DEFAULT_MAX_PATHS;

    /**
     * Upper bound on path length in edges.
     */
    private int maxDepth = EnumerationLimits.DEFAULT_MAX_DEPTH;

    private CriticalityMode criticalityMode = CriticalityMode.MAX;

    private GatePolicy gatePolicy = GatePolicy.STRICT;

    /**
     * Weights for edges whose description carries none.
     */
    private WeightProfile weightProfile = WeightProfile.NEUTRAL;

    private CentralityScope centralityScope = CentralityScope.FULL_GRAPH;

    /**
     * Node attributes read as numbers; all other attributes are styling.
     */
    private List<String> weightKeys = new ArrayList<>(List.of("cost", "stealth"));

    /**
     * Node kinds that may start a path even when they have incoming edges.
     * Default: only nodes without incoming edges start paths.
     */
    private List<NodeKind> entryKinds = new ArrayList<>();

    /**
     * Threads used when several targets are analysed in one run.
     */
    private int parallelism = 4;

    public EnumerationLimits limits() {
        return new EnumerationLimits(maxPaths, maxDepth);
    }
}

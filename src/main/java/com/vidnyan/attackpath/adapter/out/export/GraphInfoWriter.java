package com.vidnyan.attackpath.adapter.out.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.attackpath.application.port.out.ResultExporter.ExportRequest;
import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.*;
import com.vidnyan.attackpath.domain.metrics.CentralityTable;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.PathSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the JSON reports: the graph overview and the per-target summary.
 */
@Component
@RequiredArgsConstructor
public class GraphInfoWriter {

    private final ObjectMapper objectMapper;

    public void writeGraphInfo(GraphModel graph, CentralityTable centrality, Path file) throws IOException {
        List<NodeInfo> nodes = graph.nodes().stream()
                .map(n -> new NodeInfo(
                        n.id(),
                        n.label(),
                        n.kind(),
                        n.channelType(),
                        graph.neighbors(n.id(), Direction.INCOMING),
                        graph.neighbors(n.id(), Direction.OUTGOING),
                        centrality.get(n.id())))
                .toList();
        List<EdgeInfo> edges = graph.edges().stream()
                .map(e -> new EdgeInfo(e.index(), e.source(), e.target(), e.type(),
                        e.scored() ? e.cost() : null, e.scored() ? e.stealth() : null))
                .toList();
        objectMapper.writeValue(file.toFile(), new GraphInfo(nodes, edges));
    }

    /**
     * Per-target summary. Graph-wide warnings come first, then the target's own.
     */
    public void writeSummary(ExportRequest request, Path file) throws IOException {
        PathSet paths = request.paths();
        List<AnalysisWarning> warnings = new ArrayList<>(request.graphWarnings());
        warnings.addAll(paths.warnings());
        TargetSummary summary = new TargetSummary(
                paths.target(),
                paths.size(),
                paths.truncated(),
                request.topPaths().stream().map(PathScore::pathId).toList(),
                request.scenarios().size(),
                request.scenarios().truncated(),
                request.scenarioScores(),
                warnings.size(),
                warnings
        );
        objectMapper.writeValue(file.toFile(), summary);
    }

    record GraphInfo(List<NodeInfo> nodes, List<EdgeInfo> edges) {}

    record NodeInfo(
        String id,
        String label,
        NodeKind kind,
        ChannelType channelType,
        List<String> sources,
        List<String> targets,
        double centrality
    ) {}

    record EdgeInfo(int index, String source, String target, EdgeType type, Double cost, Double stealth) {}

    record TargetSummary(
        String target,
        int pathCount,
        boolean truncated,
        List<String> topPathIds,
        int scenarioCount,
        boolean scenariosTruncated,
        List<ScenarioScore> scenarios,
        int warningCount,
        List<AnalysisWarning> warnings
    ) {}
}

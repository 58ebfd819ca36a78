package com.vidnyan.attackpath.application.port.out;

import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.metrics.CentralityTable;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.PathSet;
import com.vidnyan.attackpath.domain.path.ScenarioSet;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for persisting analysis results.
 * Implemented by adapters (e.g., the file system exporter).
 */
public interface ResultExporter {

    /**
     * Write the path table, rendered subgraphs, scenario forest and summary for one target.
     * @throws ExportIOException if any file cannot be created or written
     */
    ExportReport export(ExportRequest request);

    /**
     * Write the per-node and per-edge overview of the whole graph.
     * @return the written file
     * @throws ExportIOException if the file cannot be created or written
     */
    Path exportGraphInfo(GraphModel graph, CentralityTable centrality, Path outputDirectory);

    /**
     * Everything needed to export one target.
     *
     * @param scores scored paths in enumeration order
     * @param topPaths the paths tied for the best feasibility
     * @param graphWarnings warnings about the graph itself, reported with every target
     */
    record ExportRequest(
        GraphModel graph,
        PathSet paths,
        List<PathScore> scores,
        List<PathScore> topPaths,
        ScenarioSet scenarios,
        List<ScenarioScore> scenarioScores,
        CentralityTable centrality,
        List<AnalysisWarning> graphWarnings,
        Path outputDirectory
    ) {
        public String target() {
            return paths.target();
        }
    }

    /**
     * Files written for one target.
     */
    record ExportReport(
        String target,
        List<Path> files
    ) {}
}

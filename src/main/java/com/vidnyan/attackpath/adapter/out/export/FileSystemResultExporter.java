package com.vidnyan.attackpath.adapter.out.export;

import com.vidnyan.attackpath.application.port.out.ExportIOException;
import com.vidnyan.attackpath.application.port.out.ResultExporter;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.metrics.CentralityTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports analysis results as files under an output directory.
 * Per target: {@code paths_<target>.csv}, {@code subgraph_<target>.dot},
 * {@code highlight_<target>.dot}, {@code forest_<target>.txt} and
 * {@code summary_<target>.json}. Once per run:
 * {@code graphinfo.json}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemResultExporter implements ResultExporter {

    static final String GRAPH_INFO_FILE = "graphinfo.json";

    private final PathTableWriter pathTableWriter;
    private final DotGraphWriter dotGraphWriter;
    private final ScenarioForestWriter scenarioForestWriter;
    private final GraphInfoWriter graphInfoWriter;

    @Override
    public ExportReport export(ExportRequest request) {
        Path directory = prepare(request.outputDirectory());
        String name = fileSafe(request.target());
        List<Path> written = new ArrayList<>();

        Path table = directory.resolve("paths_" + name + ".csv");
        write(table, () -> pathTableWriter.write(request.scores(), table));
        written.add(table);

        Path subgraph = directory.resolve("subgraph_" + name + ".dot");
        write(subgraph, () -> dotGraphWriter.writeSubgraph(
                request.graph(), request.paths(), request.topPaths(), subgraph));
        written.add(subgraph);

        Path highlight = directory.resolve("highlight_" + name + ".dot");
        write(highlight, () -> dotGraphWriter.writeHighlight(
                request.graph(), request.paths(), request.topPaths(), highlight));
        written.add(highlight);

        Path forest = directory.resolve("forest_" + name + ".txt");
        write(forest, () -> scenarioForestWriter.write(request.scenarios(), request.scenarioScores(), forest));
        written.add(forest);

        Path summary = directory.resolve("summary_" + name + ".json");
        write(summary, () -> graphInfoWriter.writeSummary(request, summary));
        written.add(summary);

        log.info("Exported {} paths for '{}' to {}", request.scores().size(), request.target(), directory);
        return new ExportReport(request.target(), written);
    }

    @Override
    public Path exportGraphInfo(GraphModel graph, CentralityTable centrality, Path outputDirectory) {
        Path directory = prepare(outputDirectory);
        Path file = directory.resolve(GRAPH_INFO_FILE);
        write(file, () -> graphInfoWriter.writeGraphInfo(graph, centrality, file));
        log.debug("Wrote graph overview to {}", file);
        return file;
    }

    private static Path prepare(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExportIOException("Cannot create output directory " + directory + ": " + e.getMessage(),
                    directory, e);
        }
    }

    private static void write(Path file, FileWrite action) {
        try {
            action.run();
        } catch (IOException e) {
            throw new ExportIOException("Cannot write " + file + ": " + e.getMessage(), file, e);
        }
    }

    /**
     * Node ids become part of file names; anything outside [A-Za-z0-9._-] is replaced.
     */
    static String fileSafe(String nodeId) {
        return nodeId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @FunctionalInterface
    private interface FileWrite {
        void run() throws IOException;
    }
}

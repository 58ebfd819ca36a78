package com.vidnyan.attackpath.application.port.in;

import com.vidnyan.attackpath.application.port.out.GraphDescriptionParser.ParsingOptions;
import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import com.vidnyan.attackpath.domain.graph.WeightProfile;
import com.vidnyan.attackpath.domain.logic.GatePolicy;
import com.vidnyan.attackpath.domain.metrics.CentralityScope;
import com.vidnyan.attackpath.domain.metrics.CriticalityMode;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.EnumerationLimits;
import com.vidnyan.attackpath.domain.path.PathSet;
import com.vidnyan.attackpath.domain.path.ScenarioSet;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Primary use case: find, score and export every attack path to one or more targets.
 * This is the main entry point to the application.
 */
public interface AnalyzeGraphUseCase {

    /**
     * Analyze a graph description and export the results.
     * @param request Analysis request parameters
     * @return Analysis result with scored paths, warnings and metadata
     * @throws com.vidnyan.attackpath.domain.graph.MalformedGraphException if the description is invalid
     * @throws com.vidnyan.attackpath.application.port.out.ExportIOException if the results cannot be written
     * @throws IllegalArgumentException if a target is not part of the graph
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path graphPath,
        List<String> targets,
        Path outputDirectory,
        EnumerationLimits limits,
        CriticalityMode criticalityMode,
        GatePolicy gatePolicy,
        WeightProfile weightProfile,
        CentralityScope centralityScope,
        Set<String> weightKeys,
        Set<NodeKind> entryKinds,
        int parallelism
    ) {
        public AnalysisRequest {
            if (targets == null || targets.isEmpty()) {
                throw new IllegalArgumentException("At least one target is required");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
            }
            targets = List.copyOf(targets);
            weightKeys = Set.copyOf(weightKeys);
            entryKinds = Set.copyOf(entryKinds);
        }

        public static AnalysisRequest forTarget(Path graphPath, String target, Path outputDirectory) {
            return new AnalysisRequest(
                    graphPath,
                    List.of(target),
                    outputDirectory,
                    EnumerationLimits.defaults(),
                    CriticalityMode.MAX,
                    GatePolicy.STRICT,
                    WeightProfile.NEUTRAL,
                    CentralityScope.FULL_GRAPH,
                    ParsingOptions.DEFAULT_WEIGHT_KEYS,
                    Set.of(),
                    1
            );
        }

        public ParsingOptions parsingOptions() {
            return new ParsingOptions(weightProfile, weightKeys);
        }
    }

    /**
     * Paths and scores for one target.
     *
     * @param scores scored paths in enumeration order
     * @param topPaths the paths tied for the best feasibility
     * @param scenarioScores composite scores in scenario order
     */
    record TargetResult(
        String target,
        PathSet paths,
        List<PathScore> scores,
        List<PathScore> topPaths,
        ScenarioSet scenarios,
        List<ScenarioScore> scenarioScores,
        List<Path> exportedFiles
    ) {
        public TargetResult {
            scores = List.copyOf(scores);
            topPaths = List.copyOf(topPaths);
            scenarioScores = List.copyOf(scenarioScores);
            exportedFiles = List.copyOf(exportedFiles);
        }

        public boolean truncated() {
            return paths.truncated();
        }

        public List<AnalysisWarning> warnings() {
            return paths.warnings();
        }

        TargetResult withExportedFiles(List<Path> files) {
            return new TargetResult(target, paths, scores, topPaths, scenarios, scenarioScores, files);
        }
    }

    /**
     * Analysis result.
     *
     * @param graphWarnings warnings about the graph itself, independent of any target
     */
    record AnalysisResult(
        List<TargetResult> targets,
        List<AnalysisWarning> graphWarnings,
        List<Path> exportedFiles,
        AnalysisStats stats
    ) {
        public AnalysisResult {
            targets = List.copyOf(targets);
            graphWarnings = List.copyOf(graphWarnings);
            exportedFiles = List.copyOf(exportedFiles);
        }

        public Optional<TargetResult> target(String targetId) {
            return targets.stream().filter(t -> t.target().equals(targetId)).findFirst();
        }

        public int pathCount() {
            return targets.stream().mapToInt(t -> t.paths().size()).sum();
        }

        public boolean anyTruncated() {
            return targets.stream().anyMatch(TargetResult::truncated);
        }

        /**
         * Graph warnings followed by each target's warnings.
         */
        public List<AnalysisWarning> allWarnings() {
            List<AnalysisWarning> all = new ArrayList<>(graphWarnings);
            targets.forEach(t -> all.addAll(t.warnings()));
            return all;
        }

        /**
         * Copy with the files written by the export step.
         * @param filesByTarget files per target, in the order of {@link #targets()}
         * @param sharedFiles files not tied to a single target
         */
        public AnalysisResult withExportedFiles(List<List<Path>> filesByTarget, List<Path> sharedFiles) {
            List<TargetResult> exported = new ArrayList<>(targets.size());
            List<Path> all = new ArrayList<>(sharedFiles);
            for (int i = 0; i < targets.size(); i++) {
                exported.add(targets.get(i).withExportedFiles(filesByTarget.get(i)));
                all.addAll(filesByTarget.get(i));
            }
            return new AnalysisResult(exported, graphWarnings, all, stats);
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int nodeCount,
        int edgeCount,
        int gateCount,
        int targetsAnalyzed,
        int pathsFound,
        long totalDurationMs
    ) {}
}

package com.vidnyan.attackpath.application.service;

import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase;
import com.vidnyan.attackpath.application.port.out.ExportIOException;
import com.vidnyan.attackpath.application.port.out.GraphDescriptionParser;
import com.vidnyan.attackpath.application.port.out.ResultExporter;
import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.logic.GatePolicy;
import com.vidnyan.attackpath.domain.logic.LogicResolver;
import com.vidnyan.attackpath.domain.metrics.CentralityTable;
import com.vidnyan.attackpath.domain.metrics.MetricsEngine;
import com.vidnyan.attackpath.domain.metrics.PathRanking;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.PathEnumerator;
import com.vidnyan.attackpath.domain.path.PathSet;
import com.vidnyan.attackpath.domain.path.ScenarioAssembler;
import com.vidnyan.attackpath.domain.path.ScenarioSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PathAnalysisService implements AnalyzeGraphUseCase {

    private final GraphDescriptionParser graphParser;
    private final ResultExporter resultExporter;
    private final List<LogicResolver> logicResolvers;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting analysis of: {} (targets: {})", request.graphPath(), request.targets());

        // Step 1: Parse the graph description
        log.info("Step 1: Parsing graph description...");
        GraphModel graph = graphParser.parseFile(request.graphPath(), request.parsingOptions());
        GraphModel.Stats graphStats = graph.stats();
        log.info("Parsed: {} nodes, {} edges, {} gates",
                graphStats.nodeCount(), graphStats.edgeCount(), graphStats.gateCount());
        request.targets().forEach(graph::requireNode);

        // Step 2: Inspect gates
        log.info("Step 2: Inspecting logic gates ({} policy)...", request.gatePolicy());
        LogicResolver resolver = findResolver(request.gatePolicy());
        List<AnalysisWarning> graphWarnings = graph.nodes().stream()
                .filter(Node::isGate)
                .map(resolver::inspect)
                .flatMap(Optional::stream)
                .toList();
        graphWarnings.forEach(w -> log.warn("  {}", w.format()));

        // Step 3: Graph centrality
        log.info("Step 3: Computing centrality ({})...", request.centralityScope());
        MetricsEngine metrics = new MetricsEngine(request.criticalityMode(), request.centralityScope());
        CentralityTable centrality = metrics.centrality(graph);

        // Step 4: Enumerate and score paths per target
        log.info("Step 4: Enumerating paths for {} target(s)...", request.targets().size());
        PathEnumerator enumerator = new PathEnumerator(resolver, request.limits(), request.entryKinds());
        ScenarioAssembler assembler = new ScenarioAssembler(request.limits().maxPaths());
        TargetAnalysis analysis = new TargetAnalysis(graph, enumerator, assembler, metrics, centrality);
        List<TargetResult> targets = analyzeTargets(request, analysis);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                graphStats.nodeCount(),
                graphStats.edgeCount(),
                graphStats.gateCount(),
                targets.size(),
                targets.stream().mapToInt(t -> t.paths().size()).sum(),
                totalDuration.toMillis()
        );
        AnalysisResult result = new AnalysisResult(targets, graphWarnings, List.of(), stats);

        // Step 5: Export
        log.info("Step 5: Exporting results to {}...", request.outputDirectory());
        AnalysisResult exported = export(request, graph, centrality, graphWarnings, result);

        log.info("Analysis complete: {} paths, {} warnings in {}ms",
                exported.pathCount(), exported.allWarnings().size(), stats.totalDurationMs());
        return exported;
    }

    private List<TargetResult> analyzeTargets(AnalysisRequest request, TargetAnalysis analysis) {
        if (request.targets().size() == 1 || request.parallelism() == 1) {
            List<TargetResult> results = new ArrayList<>();
            for (String target : request.targets()) {
                results.add(analysis.run(target));
            }
            return results;
        }

        int threads = Math.min(request.parallelism(), request.targets().size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TargetResult>> futures = new ArrayList<>();
            for (String target : request.targets()) {
                futures.add(executor.submit(() -> analysis.run(target)));
            }
            List<TargetResult> results = new ArrayList<>(futures.size());
            for (Future<TargetResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Per-target pipeline over the shared, read-only graph and centrality.
     */
    private record TargetAnalysis(
        GraphModel graph,
        PathEnumerator enumerator,
        ScenarioAssembler assembler,
        MetricsEngine metrics,
        CentralityTable centrality
    ) {

        TargetResult run(String target) {
            log.info("  Processing target: {}", target);
            PathSet paths = enumerator.findAllPaths(graph, target);
            List<PathScore> scores = metrics.scoreAll(graph, paths, centrality);
            List<PathScore> top = PathRanking.top(scores);
            ScenarioSet scenarios = assembler.assemble(graph, paths);
            List<ScenarioScore> scenarioScores = metrics.scoreAll(graph, scenarios, centrality);

            log.info("    Found {} paths in {} scenarios{}", paths.size(), scenarios.size(),
                    paths.truncated() ? " (truncated)" : "");
            if (scenarios.truncated()) {
                log.warn("    Scenario list for '{}' cut at {} entries", target, scenarios.size());
            }
            paths.warnings().forEach(w -> log.warn("    {}", w.format()));
            return new TargetResult(target, paths, scores, top, scenarios, scenarioScores, List.of());
        }
    }

    private AnalysisResult export(AnalysisRequest request, GraphModel graph, CentralityTable centrality,
                                  List<AnalysisWarning> graphWarnings, AnalysisResult result) {
        try {
            Path graphInfo = resultExporter.exportGraphInfo(graph, centrality, request.outputDirectory());
            List<List<Path>> filesByTarget = new ArrayList<>();
            for (TargetResult target : result.targets()) {
                ResultExporter.ExportReport report = resultExporter.export(new ResultExporter.ExportRequest(
                        graph,
                        target.paths(),
                        target.scores(),
                        target.topPaths(),
                        target.scenarios(),
                        target.scenarioScores(),
                        centrality,
                        graphWarnings,
                        request.outputDirectory()
                ));
                filesByTarget.add(report.files());
            }
            return result.withExportedFiles(filesByTarget, List.of(graphInfo));
        } catch (ExportIOException e) {
            log.error("Export failed: {}", e.getMessage());
            throw e.withResult(result);
        }
    }

    private static TargetResult await(Future<TargetResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analysing targets", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Target analysis failed", e.getCause());
        }
    }

    private LogicResolver findResolver(GatePolicy policy) {
        return logicResolvers.stream()
                .filter(r -> r.policy() == policy)
                .findFirst()
                .orElseGet(() -> LogicResolver.forPolicy(policy));
    }
}

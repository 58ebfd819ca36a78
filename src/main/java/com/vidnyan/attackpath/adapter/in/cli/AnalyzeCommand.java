package com.vidnyan.attackpath.adapter.in.cli;

import com.vidnyan.attackpath.AnalysisProperties;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.AnalysisRequest;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.AnalysisResult;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.TargetResult;
import com.vidnyan.attackpath.application.port.out.ExportIOException;
import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.graph.MalformedGraphException;
import com.vidnyan.attackpath.domain.graph.WeightProfile;
import com.vidnyan.attackpath.domain.logic.GatePolicy;
import com.vidnyan.attackpath.domain.metrics.CentralityScope;
import com.vidnyan.attackpath.domain.metrics.CriticalityMode;
import com.vidnyan.attackpath.domain.metrics.PathRanking;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.EnumerationLimits;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * {@code analyze} command: enumerate, score and export attack paths for one or more targets.
 * Options left out fall back to the {@code attackpath.analysis.*} properties.
 */
@Slf4j
@CommandLine.Command(
    name = "analyze",
    description = "Find, score and export every attack path that reaches a target node.",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    static final int MAX_PATHS_LISTED = 100;

    private final AnalyzeGraphUseCase analyzeGraphUseCase;
    private final AnalysisProperties properties;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--graph", required = true, paramLabel = "PATH",
            description = "Graph description in the DOT subset.")
    private Path graph;

    @CommandLine.Option(names = "--target", required = true, arity = "1..*", paramLabel = "NODE_ID",
            description = "Target node id; repeat to analyse several targets.")
    private List<String> targets = new ArrayList<>();

    @CommandLine.Option(names = "--out", required = true, paramLabel = "DIR",
            description = "Output directory for the path table, renderings and reports.")
    private Path out;

    @CommandLine.Option(names = "--max-paths", paramLabel = "N",
            description = "Stop after N paths per target and mark the result truncated.")
    private Integer maxPaths;

    @CommandLine.Option(names = "--max-depth", paramLabel = "N",
            description = "Cut paths longer than N edges and mark the result truncated.")
    private Integer maxDepth;

    @CommandLine.Option(names = "--criticality-mode", paramLabel = "mean|max",
            converter = CriticalityModeConverter.class,
            description = "How node centralities along a path are combined.")
    private CriticalityMode criticalityMode;

    @CommandLine.Option(names = "--gate-policy", paramLabel = "strict|lenient",
            converter = GatePolicyConverter.class,
            description = "Treatment of AND gates with fewer than two inputs.")
    private GatePolicy gatePolicy;

    @CommandLine.Option(names = "--weight-profile", paramLabel = "neutral|channel-typed",
            converter = WeightProfileConverter.class,
            description = "Default weights for edges without cost/stealth attributes.")
    private WeightProfile weightProfile;

    @CommandLine.Option(names = "--centrality-scope", paramLabel = "full|rules",
            converter = CentralityScopeConverter.class,
            description = "Compute centrality over the full graph or over rule nodes only.")
    private CentralityScope centralityScope;

    public AnalyzeCommand(AnalyzeGraphUseCase analyzeGraphUseCase, AnalysisProperties properties) {
        this.analyzeGraphUseCase = analyzeGraphUseCase;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        AnalysisRequest request = buildRequest();

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           Attack Path Engine                                 ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Graph:   {}", truncatePath(graph.toString(), 50));
        log.info("║ Targets: {}", String.join(", ", request.targets()));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        try {
            AnalysisResult result = analyzeGraphUseCase.analyze(request);
            printResults(result);
            log.info("");
            log.info("Results written to {}", out);
            return ExitCodes.OK;
        } catch (MalformedGraphException e) {
            log.error("Malformed graph description {}: {}", graph, e.getMessage());
            return ExitCodes.MALFORMED_GRAPH;
        } catch (ExportIOException e) {
            e.result().ifPresent(this::printResults);
            log.error("Export failed: {}", e.getMessage());
            return ExitCodes.EXPORT_FAILURE;
        } catch (UncheckedIOException e) {
            log.error("{}: {}", e.getMessage(), e.getCause().getMessage());
            return ExitCodes.FAILURE;
        } catch (IllegalArgumentException e) {
            log.error("Invalid request: {}", e.getMessage());
            return ExitCodes.USAGE;
        }
    }

    AnalysisRequest buildRequest() {
        if (!Files.isRegularFile(graph)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Graph description not found: " + graph);
        }
        int paths = maxPaths != null ? maxPaths : properties.getMaxPaths();
        int depth = maxDepth != null ? maxDepth : properties.getMaxDepth();
        if (paths < 1 || depth < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--max-paths and --max-depth must be at least 1");
        }
        List<String> distinctTargets = new ArrayList<>(new LinkedHashSet<>(targets));

        return new AnalysisRequest(
                graph,
                distinctTargets,
                out,
                new EnumerationLimits(paths, depth),
                criticalityMode != null ? criticalityMode : properties.getCriticalityMode(),
                gatePolicy != null ? gatePolicy : properties.getGatePolicy(),
                weightProfile != null ? weightProfile : properties.getWeightProfile(),
                centralityScope != null ? centralityScope : properties.getCentralityScope(),
                new HashSet<>(properties.getWeightKeys()),
                new HashSet<>(properties.getEntryKinds()),
                Math.max(1, properties.getParallelism())
        );
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Nodes:            {}", result.stats().nodeCount());
        log.info(" Edges:            {}", result.stats().edgeCount());
        log.info(" Logic gates:      {}", result.stats().gateCount());
        log.info(" Targets:          {}", result.stats().targetsAnalyzed());
        log.info(" Paths found:      {}", result.stats().pathsFound());
        log.info(" Warnings:         {}", result.allWarnings().size());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (!result.graphWarnings().isEmpty()) {
            log.info(" GRAPH WARNINGS:");
            result.graphWarnings().forEach(w -> log.info("   ⚠️  {}", w.format()));
        }

        for (TargetResult target : result.targets()) {
            printTarget(target);
        }
    }

    private void printTarget(TargetResult target) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" TARGET {}: {} paths in {} scenarios{}", target.target(), target.paths().size(),
                target.scenarios().size(), target.truncated() ? " (TRUNCATED, result is incomplete)" : "");
        log.info("═══════════════════════════════════════════════════════════════");
        for (AnalysisWarning warning : target.warnings()) {
            log.info("   ⚠️  {}", warning.format());
        }
        if (target.scores().isEmpty()) {
            return;
        }

        Set<String> top = new HashSet<>();
        target.topPaths().forEach(s -> top.add(s.pathId()));

        int count = 0;
        for (PathScore score : PathRanking.rank(target.scores())) {
            count++;
            if (count > MAX_PATHS_LISTED) {
                log.info(" ... and {} more paths (see the exported table)", target.scores().size() - MAX_PATHS_LISTED);
                break;
            }
            log.info("");
            log.info(" {} [{}]", top.contains(score.pathId()) ? "🔴 TOP" : "•", score.pathId());
            log.info(" Path:        {}", score.formattedNodes());
            log.info(" Cost:        {}", score.cost());
            log.info(" Stealth:     {}", score.averageStealth());
            log.info(" Length:      {}", score.length());
            log.info(" Criticality: {}", score.criticality());
        }

        for (ScenarioScore scenario : target.scenarioScores()) {
            if (scenario.pathIds().size() < 2) {
                continue;
            }
            log.info("");
            log.info(" ⛓  [{}] joint paths {}", scenario.scenarioId(), String.join(" + ", scenario.pathIds()));
            log.info(" Cost: {}  Stealth: {}  Length: {}  Criticality: {}",
                    scenario.cost(), scenario.averageStealth(), scenario.length(), scenario.criticality());
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }

    static final class CriticalityModeConverter implements CommandLine.ITypeConverter<CriticalityMode> {
        @Override
        public CriticalityMode convert(String value) {
            return parseEnum(value, CriticalityMode::parse, "mean, max");
        }
    }

    static final class GatePolicyConverter implements CommandLine.ITypeConverter<GatePolicy> {
        @Override
        public GatePolicy convert(String value) {
            return parseEnum(value, GatePolicy::parse, "strict, lenient");
        }
    }

    static final class WeightProfileConverter implements CommandLine.ITypeConverter<WeightProfile> {
        @Override
        public WeightProfile convert(String value) {
            return parseEnum(value, v -> WeightProfile.valueOf(normalize(v)), "neutral, channel-typed");
        }
    }

    static final class CentralityScopeConverter implements CommandLine.ITypeConverter<CentralityScope> {
        @Override
        public CentralityScope convert(String value) {
            return parseEnum(value, v -> switch (normalize(v)) {
                case "FULL", "FULL_GRAPH" -> CentralityScope.FULL_GRAPH;
                case "RULES", "RULE_NODES" -> CentralityScope.RULE_NODES;
                default -> throw new IllegalArgumentException(v);
            }, "full, rules");
        }
    }

    private static String normalize(String value) {
        return value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static <T> T parseEnum(String value, Function<String, T> parser, String expected) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(
                    "'" + value + "' is not one of: " + expected);
        }
    }
}

package com.vidnyan.attackpath.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.vidnyan.attackpath.adapter.out.export.DotGraphWriter;
import com.vidnyan.attackpath.adapter.out.export.FileSystemResultExporter;
import com.vidnyan.attackpath.adapter.out.export.GraphInfoWriter;
import com.vidnyan.attackpath.adapter.out.export.PathTableWriter;
import com.vidnyan.attackpath.adapter.out.export.ScenarioForestWriter;
import com.vidnyan.attackpath.adapter.out.parser.DotGraphParser;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.AnalysisRequest;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.AnalysisResult;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.TargetResult;
import com.vidnyan.attackpath.application.port.out.ExportIOException;
import com.vidnyan.attackpath.application.port.out.GraphDescriptionParser.ParsingOptions;
import com.vidnyan.attackpath.domain.analysis.AnalysisWarning;
import com.vidnyan.attackpath.domain.analysis.WarningType;
import com.vidnyan.attackpath.domain.graph.MalformedGraphException;
import com.vidnyan.attackpath.domain.graph.WeightProfile;
import com.vidnyan.attackpath.domain.logic.GatePolicy;
import com.vidnyan.attackpath.domain.logic.LenientLogicResolver;
import com.vidnyan.attackpath.domain.logic.StrictLogicResolver;
import com.vidnyan.attackpath.domain.metrics.CentralityScope;
import com.vidnyan.attackpath.domain.metrics.CriticalityMode;
import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.EnumerationLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathAnalysisServiceTest {

    private static final String GRAPH = """
            digraph home {
              T_Rule_1 [label="Trigger_Rule_1"];
              T_Rule_2 [label="Trigger_Rule_2"];
              CH_smoke [label="Smoke [Physical]", shape=ellipse];
              CH_power [label="Power [System]", shape=ellipse];
              LOGIC_Rule_3_AND [label="AND", shape=diamond];
              LOGIC_Rule_4_OR [label="OR", shape=diamond];
              A_Rule_3 [label="Action_Rule_3"];
              A_Rule_4 [label="Action_Rule_4"];
              T_Rule_1 -> CH_smoke;
              T_Rule_2 -> CH_power;
              CH_smoke -> LOGIC_Rule_3_AND;
              CH_power -> LOGIC_Rule_3_AND;
              LOGIC_Rule_3_AND -> A_Rule_3;
              CH_power -> LOGIC_Rule_4_OR;
              LOGIC_Rule_4_OR -> A_Rule_4;
            }
            """;

    @TempDir
    Path tempDir;

    private PathAnalysisService service;
    private Path graphFile;

    @BeforeEach
    void setUp() throws IOException {
        FileSystemResultExporter exporter = new FileSystemResultExporter(
                new PathTableWriter(new CsvMapper()), new DotGraphWriter(), new ScenarioForestWriter(), new GraphInfoWriter(new ObjectMapper()));
        service = new PathAnalysisService(new DotGraphParser(), exporter,
                List.of(new StrictLogicResolver(), new LenientLogicResolver()));
        graphFile = Files.writeString(tempDir.resolve("home.dot"), GRAPH);
    }

    private AnalysisRequest request(List<String> targets, GatePolicy policy, Path out) {
        return new AnalysisRequest(
                graphFile,
                targets,
                out,
                EnumerationLimits.defaults(),
                CriticalityMode.MAX,
                policy,
                WeightProfile.CHANNEL_TYPED,
                CentralityScope.FULL_GRAPH,
                ParsingOptions.DEFAULT_WEIGHT_KEYS,
                Set.of(),
                2
        );
    }

    @Test
    void analyze_ShouldScoreAndExportEveryTarget() {
        // Arrange
        Path out = tempDir.resolve("out");

        // Act
        AnalysisResult result = service.analyze(request(List.of("A_Rule_3", "A_Rule_4"), GatePolicy.STRICT, out));

        // Assert
        assertEquals(List.of("A_Rule_3", "A_Rule_4"), result.targets().stream().map(TargetResult::target).toList());
        TargetResult gated = result.target("A_Rule_3").orElseThrow();
        assertEquals(2, gated.paths().size());
        assertEquals(6.0, gated.scores().get(0).cost(), "physical hop of 5, unscored gate input, explicit hop of 1");
        assertEquals(4.0, gated.scores().get(1).cost(), "system hop of 3, unscored gate input, explicit hop of 1");
        assertEquals(2.0, gated.scores().get(0).averageStealth(), "mean of stealth 3 and 1, gate input left out");
        assertFalse(gated.topPaths().isEmpty());

        assertEquals(3, result.stats().pathsFound());
        assertEquals(8, result.stats().nodeCount());
        assertEquals(2, result.stats().targetsAnalyzed());
        assertFalse(result.anyTruncated());

        assertTrue(Files.exists(out.resolve("graphinfo.json")));
        assertTrue(Files.exists(out.resolve("paths_A_Rule_3.csv")));
        assertTrue(Files.exists(out.resolve("subgraph_A_Rule_4.dot")));
        assertTrue(Files.exists(out.resolve("forest_A_Rule_3.txt")));
        assertEquals(11, result.exportedFiles().size());
        assertEquals(5, gated.exportedFiles().size());
    }

    @Test
    void analyze_ShouldGroupAndGateBranchesIntoOneScenario() {
        // Act
        AnalysisResult result = service.analyze(request(List.of("A_Rule_3"), GatePolicy.STRICT, tempDir));

        // Assert
        TargetResult gated = result.target("A_Rule_3").orElseThrow();
        assertEquals(1, gated.scenarios().size());
        assertEquals(List.of("P1", "P2"), gated.scenarios().scenarios().get(0).pathIds());
        ScenarioScore scenario = gated.scenarioScores().get(0);
        assertEquals(9.0, scenario.cost(), "physical 5, system 3 and the gate output 1, each hop once");
        assertEquals(2.0, scenario.averageStealth());
        assertEquals(3, scenario.length());
    }

    @Test
    void analyze_ShouldReportDegenerateGatesAsGraphWarnings() {
        // Act
        AnalysisResult result = service.analyze(request(List.of("A_Rule_4"), GatePolicy.STRICT, tempDir));

        // Assert
        List<AnalysisWarning> warnings = result.graphWarnings();
        assertEquals(1, warnings.size());
        assertEquals(WarningType.DEGENERATE_GATE, warnings.get(0).type());
        assertEquals("LOGIC_Rule_4_OR", warnings.get(0).nodeId());
        assertEquals(List.of("T_Rule_2", "CH_power", "LOGIC_Rule_4_OR", "A_Rule_4"),
                result.target("A_Rule_4").orElseThrow().scores().get(0).nodeIds());
    }

    @Test
    void analyze_ShouldAttachUnreachableWarningToTarget() {
        // Act
        AnalysisResult result = service.analyze(request(List.of("T_Rule_1"), GatePolicy.STRICT, tempDir));

        // Assert
        assertEquals(0, result.pathCount());
        assertEquals(List.of(WarningType.UNREACHABLE_TARGET),
                result.target("T_Rule_1").orElseThrow().warnings().stream().map(AnalysisWarning::type).toList());
        assertEquals(1, result.allWarnings().size() - result.graphWarnings().size());
    }

    @Test
    void analyze_ShouldRejectUnknownTargetBeforeExporting() {
        Path out = tempDir.resolve("never");

        assertThrows(IllegalArgumentException.class,
                () -> service.analyze(request(List.of("A_Rule_3", "Ghost"), GatePolicy.STRICT, out)));
        assertFalse(Files.exists(out));
    }

    @Test
    void analyze_ShouldAbortOnMalformedGraph() throws IOException {
        // Arrange
        Files.writeString(graphFile, "digraph { A_x -> missing; A_x; }");

        // Act & Assert
        assertThrows(MalformedGraphException.class,
                () -> service.analyze(request(List.of("A_x"), GatePolicy.STRICT, tempDir)));
    }

    @Test
    void analyze_ShouldKeepComputedResultWhenExportFails() throws IOException {
        // Arrange
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "");

        // Act
        ExportIOException e = assertThrows(ExportIOException.class,
                () -> service.analyze(request(List.of("A_Rule_3"), GatePolicy.STRICT, blocker)));

        // Assert
        AnalysisResult result = e.result().orElseThrow();
        assertEquals(2, result.pathCount());
        assertTrue(result.exportedFiles().isEmpty());
    }

    @Test
    void analyze_ShouldFollowRequestedGatePolicy() throws IOException {
        // Arrange: drop the second input of the AND gate
        Files.writeString(graphFile, GRAPH.replace("CH_power -> LOGIC_Rule_3_AND;", ""));

        // Act
        AnalysisResult strict = service.analyze(
                request(List.of("A_Rule_3"), GatePolicy.STRICT, tempDir.resolve("strict")));
        AnalysisResult lenient = service.analyze(
                request(List.of("A_Rule_3"), GatePolicy.LENIENT, tempDir.resolve("lenient")));

        // Assert
        assertEquals(0, strict.pathCount());
        assertEquals(1, lenient.pathCount());
        assertEquals(2, strict.graphWarnings().size());
    }
}

package com.vidnyan.attackpath.adapter.out.export;

import com.vidnyan.attackpath.domain.metrics.ScenarioScore;
import com.vidnyan.attackpath.domain.path.AttackPath;
import com.vidnyan.attackpath.domain.path.AttackScenario;
import com.vidnyan.attackpath.domain.path.ScenarioSet;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes the scenarios of one target as text trees rooted at the target, one block
 * per scenario. Branches of an AND gate appear as siblings under the gate.
 */
@Component
public class ScenarioForestWriter {

    static final String SEPARATOR = "========================================================";

    public void write(ScenarioSet scenarios, List<ScenarioScore> scores, Path file) throws IOException {
        Map<String, ScenarioScore> scoreById = new HashMap<>();
        scores.forEach(s -> scoreById.put(s.scenarioId(), s));

        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("### Attack scenarios reaching " + scenarios.target() + " ###");
            out.newLine();
            out.write(SEPARATOR);
            out.newLine();
            if (scenarios.scenarios().isEmpty()) {
                out.write("(no scenario reaches the target)");
                out.newLine();
            }
            for (AttackScenario scenario : scenarios.scenarios()) {
                out.newLine();
                out.write(heading(scenario, scoreById.get(scenario.id())));
                out.newLine();
                Branch root = Branch.of(scenario);
                out.write(root.nodeId);
                out.newLine();
                List<Branch> children = new ArrayList<>(root.children.values());
                for (int i = 0; i < children.size(); i++) {
                    render(out, children.get(i), "", i == children.size() - 1);
                }
            }
            if (scenarios.truncated()) {
                out.newLine();
                out.write("(list truncated after " + scenarios.size() + " scenarios)");
                out.newLine();
            }
        }
    }

    private static String heading(AttackScenario scenario, ScenarioScore score) {
        StringBuilder sb = new StringBuilder("--- Scenario ").append(scenario.id())
                .append(": paths ").append(String.join(", ", scenario.pathIds()));
        if (score != null) {
            sb.append(" | cost ").append(score.cost())
              .append(" | stealth ").append(score.averageStealth())
              .append(" | length ").append(score.length())
              .append(" | criticality ").append(score.criticality());
        }
        return sb.append(" ---").toString();
    }

    private static void render(BufferedWriter out, Branch branch, String prefix, boolean last) throws IOException {
        out.write(prefix + (last ? "└── " : "├── ") + branch.nodeId);
        out.newLine();
        String childPrefix = prefix + (last ? "    " : "│   ");
        List<Branch> children = new ArrayList<>(branch.children.values());
        for (int i = 0; i < children.size(); i++) {
            render(out, children.get(i), childPrefix, i == children.size() - 1);
        }
    }

    /**
     * Scenario tree keyed by node id, walked from the target towards the sources.
     */
    private static final class Branch {

        private final String nodeId;
        private final Map<String, Branch> children = new LinkedHashMap<>();

        private Branch(String nodeId) {
            this.nodeId = nodeId;
        }

        static Branch of(AttackScenario scenario) {
            Branch root = new Branch(scenario.paths().get(0).target());
            for (AttackPath path : scenario.paths()) {
                Branch current = root;
                List<String> nodes = path.nodeIds();
                for (int i = nodes.size() - 2; i >= 0; i--) {
                    current = current.children.computeIfAbsent(nodes.get(i), Branch::new);
                }
            }
            return root;
        }
    }
}

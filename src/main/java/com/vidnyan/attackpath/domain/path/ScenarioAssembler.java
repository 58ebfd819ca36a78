package com.vidnyan.attackpath.domain.path;

import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Groups enumerated paths into {@link AttackScenario}s.
 *
 * The paths are merged into one tree rooted at the target, sharing common suffixes.
 * The tree is then split: below an AND gate every input subtree is kept together,
 * below any other node each input subtree becomes a scenario of its own. A path that
 * ends at an inner node of the tree (an entry node) is a scenario by itself.
 */
@Slf4j
public class ScenarioAssembler {

    private final int maxScenarios;

    /**
     * @param maxScenarios number of scenarios after which assembly stops
     */
    public ScenarioAssembler(int maxScenarios) {
        if (maxScenarios < 1) {
            throw new IllegalArgumentException("maxScenarios must be at least 1, got " + maxScenarios);
        }
        this.maxScenarios = maxScenarios;
    }

    public ScenarioSet assemble(GraphModel graph, PathSet paths) {
        if (paths.isEmpty()) {
            return ScenarioSet.empty(paths.target());
        }

        TreeNode root = new TreeNode(paths.target());
        Map<String, AttackPath> byId = new HashMap<>();
        for (AttackPath path : paths.paths()) {
            byId.put(path.id(), path);
            root.insert(path);
        }

        Assembly assembly = new Assembly();
        List<List<String>> groups = assembly.split(graph, root);

        List<AttackScenario> scenarios = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            List<AttackPath> members = group.stream().map(byId::get).toList();
            scenarios.add(new AttackScenario("S" + (scenarios.size() + 1), members));
        }
        log.debug("Grouped {} paths to '{}' into {} scenarios{}", paths.size(), paths.target(),
                scenarios.size(), assembly.truncated ? " (truncated)" : "");
        return new ScenarioSet(paths.target(), scenarios, assembly.truncated);
    }

    private final class Assembly {

        private boolean truncated;

        /**
         * Scenarios of the subtree below {@code node}, each as a list of path ids.
         */
        private List<List<String>> split(GraphModel graph, TreeNode node) {
            List<List<String>> options = new ArrayList<>();
            if (node.pathId != null) {
                options.add(List.of(node.pathId));
            }
            if (node.children.isEmpty()) {
                return options;
            }

            boolean andGate = graph.requireNode(node.nodeId).kind() == NodeKind.LOGIC_AND
                    && node.children.size() > 1;
            if (andGate) {
                addAll(options, combine(graph, node.children.values()));
            } else {
                for (TreeNode child : node.children.values()) {
                    addAll(options, split(graph, child));
                }
            }
            return options;
        }

        private List<List<String>> combine(GraphModel graph, Collection<TreeNode> inputs) {
            List<List<String>> combined = List.of(List.of());
            for (TreeNode input : inputs) {
                List<List<String>> alternatives = split(graph, input);
                List<List<String>> next = new ArrayList<>();
                for (List<String> prefix : combined) {
                    for (List<String> alternative : alternatives) {
                        if (next.size() >= maxScenarios) {
                            truncated = true;
                            break;
                        }
                        List<String> merged = new ArrayList<>(prefix);
                        merged.addAll(alternative);
                        next.add(merged);
                    }
                }
                combined = next;
            }
            return combined;
        }

        private void addAll(List<List<String>> options, List<List<String>> more) {
            for (List<String> option : more) {
                if (options.size() >= maxScenarios) {
                    truncated = true;
                    return;
                }
                options.add(option);
            }
        }
    }

    /**
     * Node of the merged path tree; children are keyed by the edge leading into this node.
     */
    private static final class TreeNode {

        private final String nodeId;
        private final Map<Integer, TreeNode> children = new LinkedHashMap<>();
        private String pathId;

        private TreeNode(String nodeId) {
            this.nodeId = nodeId;
        }

        private void insert(AttackPath path) {
            TreeNode current = this;
            List<Integer> edges = path.edgeIndices();
            for (int i = edges.size() - 1; i >= 0; i--) {
                String predecessor = path.nodeIds().get(i);
                current = current.children.computeIfAbsent(edges.get(i), e -> new TreeNode(predecessor));
            }
            current.pathId = path.id();
        }
    }
}

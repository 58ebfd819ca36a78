package com.vidnyan.attackpath.adapter.out.export;

import com.vidnyan.attackpath.domain.graph.Edge;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import com.vidnyan.attackpath.domain.path.AttackPath;
import com.vidnyan.attackpath.domain.path.PathSet;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Renders path results back to DOT, keeping the styling of the input description.
 *
 * Two renderings are produced. The subgraph holds only the nodes and edges of the
 * union of paths. The highlight keeps the whole graph and dims everything off the
 * paths. In both the target is drawn as a double octagon and the edges of the
 * top-scoring paths are bold red.
 */
@Component
public class DotGraphWriter {

    static final String DIM_COLOR = "#d3d3d3";
    static final String DIM_FILL = "#f5f5f5";
    static final String TOP_PATH_COLOR = "red";

    public void writeSubgraph(GraphModel graph, PathSet paths, List<PathScore> topPaths, Path file)
            throws IOException {
        Highlight highlight = Highlight.of(paths, topPaths);
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote("subgraph_" + paths.target())).append(" {\n");

        for (Node node : graph.nodes()) {
            if (highlight.nodes.contains(node.id()) || node.id().equals(paths.target())) {
                appendNode(dot, node, nodeAttributes(node, paths.target()));
            }
        }
        for (Edge edge : graph.edges()) {
            if (highlight.edges.contains(edge.index())) {
                appendEdge(dot, edge, edgeAttributes(edge, highlight));
            }
        }
        dot.append("}\n");
        Files.writeString(file, dot, StandardCharsets.UTF_8);
    }

    public void writeHighlight(GraphModel graph, PathSet paths, List<PathScore> topPaths, Path file)
            throws IOException {
        Highlight highlight = Highlight.of(paths, topPaths);
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote("highlight_" + paths.target())).append(" {\n");

        for (Node node : graph.nodes()) {
            Map<String, String> attributes = nodeAttributes(node, paths.target());
            if (!highlight.nodes.contains(node.id()) && !node.id().equals(paths.target())) {
                attributes.put("color", DIM_COLOR);
                attributes.put("fontcolor", DIM_COLOR);
                attributes.put("style", "filled");
                attributes.put("fillcolor", DIM_FILL);
            }
            appendNode(dot, node, attributes);
        }
        for (Edge edge : graph.edges()) {
            Map<String, String> attributes = edgeAttributes(edge, highlight);
            if (!highlight.edges.contains(edge.index())) {
                attributes.put("color", DIM_COLOR);
                if (attributes.containsKey("label")) {
                    attributes.put("fontcolor", DIM_COLOR);
                }
            }
            appendEdge(dot, edge, attributes);
        }
        dot.append("}\n");
        Files.writeString(file, dot, StandardCharsets.UTF_8);
    }

    private static Map<String, String> nodeAttributes(Node node, String target) {
        Map<String, String> attributes = new LinkedHashMap<>(node.properties());
        if (node.id().equals(target)) {
            attributes.put("shape", "doubleoctagon");
            attributes.put("penwidth", "2.5");
        }
        return attributes;
    }

    private static Map<String, String> edgeAttributes(Edge edge, Highlight highlight) {
        Map<String, String> attributes = new LinkedHashMap<>(edge.properties());
        if (highlight.topEdges.contains(edge.index())) {
            attributes.put("color", TOP_PATH_COLOR);
            attributes.put("style", "bold");
            attributes.put("penwidth", "2.5");
        }
        return attributes;
    }

    private static void appendNode(StringBuilder dot, Node node, Map<String, String> attributes) {
        dot.append("  ").append(quote(node.id()));
        appendAttributes(dot, attributes);
        dot.append(";\n");
    }

    private static void appendEdge(StringBuilder dot, Edge edge, Map<String, String> attributes) {
        dot.append("  ").append(quote(edge.source())).append(" -> ").append(quote(edge.target()));
        appendAttributes(dot, attributes);
        dot.append(";\n");
    }

    private static void appendAttributes(StringBuilder dot, Map<String, String> attributes) {
        if (attributes.isEmpty()) {
            return;
        }
        StringJoiner joiner = new StringJoiner(", ", " [", "]");
        attributes.forEach((key, value) -> joiner.add(quote(key) + "=" + quote(value)));
        dot.append(joiner);
    }

    static String quote(String value) {
        return '"' + value.replace("\"", "\\\"") + '"';
    }

    /**
     * Node ids and edge indices on the exported paths and on the top-scoring ones.
     */
    private record Highlight(Set<String> nodes, Set<Integer> edges, Set<Integer> topEdges) {

        static Highlight of(PathSet paths, List<PathScore> topPaths) {
            Set<String> topIds = new HashSet<>();
            topPaths.forEach(s -> topIds.add(s.pathId()));

            Set<String> nodes = new HashSet<>();
            Set<Integer> edges = new HashSet<>();
            Set<Integer> topEdges = new HashSet<>();
            for (AttackPath path : paths.paths()) {
                nodes.addAll(path.nodeIds());
                edges.addAll(path.edgeIndices());
                if (topIds.contains(path.id())) {
                    topEdges.addAll(path.edgeIndices());
                }
            }
            return new Highlight(nodes, edges, topEdges);
        }
    }
}

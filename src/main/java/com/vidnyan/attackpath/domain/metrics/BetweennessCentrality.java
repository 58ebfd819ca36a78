package com.vidnyan.attackpath.domain.metrics;

import com.vidnyan.attackpath.domain.graph.Direction;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.Node;
import com.vidnyan.attackpath.domain.graph.NodeKind;

import java.util.*;

/**
 * Brandes' betweenness centrality on the directed graph.
 *
 * Edge direction is kept as declared. Parallel edges count once and self loops are
 * ignored. Scores are normalized by 1 / ((n - 1)(n - 2)), the directed-graph maximum.
 * Nodes and neighbours are visited in sorted id order, which makes the result
 * independent of declaration order down to the last bit.
 */
public final class BetweennessCentrality {

    private BetweennessCentrality() {
    }

    public static CentralityTable compute(GraphModel graph, CentralityScope scope) {
        List<String> ids = graph.nodes().stream()
                .filter(n -> scope == CentralityScope.FULL_GRAPH || n.kind() != NodeKind.LOGIC_AND)
                .map(Node::id)
                .sorted()
                .toList();

        double[] scores = brandes(graph, ids);

        Map<String, Double> values = new LinkedHashMap<>();
        Map<String, Integer> position = indexOf(ids);
        for (Node node : graph.nodes()) {
            Integer i = position.get(node.id());
            boolean zeroed = scope == CentralityScope.RULE_NODES
                    && (node.kind() == NodeKind.CHANNEL || node.kind() == NodeKind.LOGIC_AND);
            values.put(node.id(), i == null || zeroed ? 0.0 : scores[i]);
        }
        return new CentralityTable(values);
    }

    private static double[] brandes(GraphModel graph, List<String> ids) {
        int n = ids.size();
        double[] centrality = new double[n];
        if (n <= 2) {
            return centrality;
        }

        Map<String, Integer> position = indexOf(ids);
        int[][] successors = new int[n][];
        for (int v = 0; v < n; v++) {
            String id = ids.get(v);
            successors[v] = graph.neighbors(id, Direction.OUTGOING).stream()
                    .filter(t -> !t.equals(id) && position.containsKey(t))
                    .sorted()
                    .mapToInt(position::get)
                    .toArray();
        }

        for (int s = 0; s < n; s++) {
            Deque<Integer> stack = new ArrayDeque<>();
            List<List<Integer>> predecessors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                predecessors.add(new ArrayList<>());
            }
            double[] sigma = new double[n];
            int[] distance = new int[n];
            Arrays.fill(distance, -1);
            sigma[s] = 1.0;
            distance[s] = 0;

            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                stack.push(v);
                for (int w : successors[v]) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }

            double[] delta = new double[n];
            while (!stack.isEmpty()) {
                int w = stack.pop();
                for (int v : predecessors.get(w)) {
                    delta[v] += (sigma[v] / sigma[w]) * (1.0 + delta[w]);
                }
                if (w != s) {
                    centrality[w] += delta[w];
                }
            }
        }

        double scale = 1.0 / ((n - 1.0) * (n - 2.0));
        for (int v = 0; v < n; v++) {
            centrality[v] *= scale;
        }
        return centrality;
    }

    private static Map<String, Integer> indexOf(List<String> ids) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            position.put(ids.get(i), i);
        }
        return position;
    }
}

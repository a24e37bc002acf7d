package com.z254.butterfly.coordination.network;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Exact topology metrics over the whole organism graph.
 * <ul>
 *     <li>Clustering: mean local clustering coefficient, organisms with fewer
 *     than two connections contribute zero</li>
 *     <li>Modularity: Newman modularity of communities found by label
 *     propagation, clamped to [0, 1]</li>
 *     <li>Average path length: mean shortest path over all ordered pairs,
 *     infinite when any pair is unreachable</li>
 * </ul>
 */
@Slf4j
public class GraphTopologyAnalyzer implements TopologyAnalyzer {

    private static final int MAX_PROPAGATION_ROUNDS = 30;

    private final long seed;

    public GraphTopologyAnalyzer(long seed) {
        this.seed = seed;
    }

    @Override
    public NetworkMetrics analyze(long generation, OrganismGraph graph) {
        int[][] adjacency = indexedAdjacency(graph);
        int n = adjacency.length;
        int m = graph.connectionCount();

        double averageDegree = n == 0 ? 0.0 : 2.0 * m / n;
        double density = n < 2 ? 0.0 : 2.0 * m / ((double) n * (n - 1));

        NetworkMetrics metrics = NetworkMetrics.builder()
                .generation(generation)
                .organismCount(n)
                .connectionCount(m)
                .averageDegree(averageDegree)
                .density(Math.min(1.0, density))
                .clusteringCoefficient(clustering(adjacency))
                .modularity(modularity(adjacency, m, generation))
                .averagePathLength(averagePathLength(adjacency))
                .build();

        log.trace("Analyzed generation {}: {}", generation, metrics);
        return metrics;
    }

    private int[][] indexedAdjacency(OrganismGraph graph) {
        List<Integer> organisms = graph.organisms();
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < organisms.size(); i++) {
            index.put(organisms.get(i), i);
        }
        int[][] adjacency = new int[organisms.size()][];
        for (int i = 0; i < organisms.size(); i++) {
            adjacency[i] = graph.neighbors(organisms.get(i)).stream()
                    .mapToInt(index::get)
                    .toArray();
        }
        return adjacency;
    }

    double clustering(int[][] adjacency) {
        int n = adjacency.length;
        if (n == 0) {
            return 0.0;
        }
        boolean[] mark = new boolean[n];
        double total = 0.0;
        for (int v = 0; v < n; v++) {
            int[] neighbors = adjacency[v];
            int k = neighbors.length;
            if (k < 2) {
                continue;
            }
            for (int u : neighbors) {
                mark[u] = true;
            }
            int links = 0;
            for (int u : neighbors) {
                for (int w : adjacency[u]) {
                    if (mark[w]) {
                        links++;
                    }
                }
            }
            for (int u : neighbors) {
                mark[u] = false;
            }
            // each triangle edge was seen from both ends
            total += (double) links / (k * (k - 1.0));
        }
        return total / n;
    }

    double modularity(int[][] adjacency, int m, long generation) {
        int n = adjacency.length;
        if (m == 0) {
            return 0.0;
        }
        int[] labels = propagateLabels(adjacency, new Random(seed ^ generation));

        Map<Integer, double[]> communities = new HashMap<>();
        for (int v = 0; v < n; v++) {
            double[] stats = communities.computeIfAbsent(labels[v], k -> new double[2]);
            stats[1] += adjacency[v].length;
            for (int u : adjacency[v]) {
                if (labels[u] == labels[v]) {
                    stats[0] += 0.5;
                }
            }
        }

        double q = 0.0;
        for (double[] stats : communities.values()) {
            double internal = stats[0] / m;
            double degreeShare = stats[1] / (2.0 * m);
            q += internal - degreeShare * degreeShare;
        }
        return Math.max(0.0, Math.min(1.0, q));
    }

    private int[] propagateLabels(int[][] adjacency, Random random) {
        int n = adjacency.length;
        int[] labels = new int[n];
        int[] order = new int[n];
        for (int v = 0; v < n; v++) {
            labels[v] = v;
            order[v] = v;
        }

        Map<Integer, Integer> counts = new HashMap<>();
        for (int round = 0; round < MAX_PROPAGATION_ROUNDS; round++) {
            shuffle(order, random);
            boolean changed = false;
            for (int v : order) {
                if (adjacency[v].length == 0) {
                    continue;
                }
                counts.clear();
                int best = labels[v];
                int bestCount = 0;
                for (int u : adjacency[v]) {
                    counts.merge(labels[u], 1, Integer::sum);
                }
                for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
                    int label = entry.getKey();
                    int count = entry.getValue();
                    if (count > bestCount || (count == bestCount && label < best)) {
                        best = label;
                        bestCount = count;
                    }
                }
                // keep the current label when it is among the most frequent
                if (counts.getOrDefault(labels[v], 0) == bestCount) {
                    best = labels[v];
                }
                if (best != labels[v]) {
                    labels[v] = best;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        return labels;
    }

    double averagePathLength(int[][] adjacency) {
        int n = adjacency.length;
        if (n < 2) {
            return Double.POSITIVE_INFINITY;
        }
        int[] distance = new int[n];
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        long total = 0;
        for (int source = 0; source < n; source++) {
            Arrays.fill(distance, -1);
            distance[source] = 0;
            queue.add(source);
            int reached = 1;
            while (!queue.isEmpty()) {
                int v = queue.poll();
                for (int u : adjacency[v]) {
                    if (distance[u] < 0) {
                        distance[u] = distance[v] + 1;
                        total += distance[u];
                        reached++;
                        queue.add(u);
                    }
                }
            }
            if (reached < n) {
                return Double.POSITIVE_INFINITY;
            }
        }
        return (double) total / ((long) n * (n - 1));
    }

    private static void shuffle(int[] values, Random random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}

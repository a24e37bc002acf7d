package com.z254.butterfly.coordination.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected graph of organisms and their symbiotic connections.
 * <p>
 * The per-organism connection cap is enforced here, so no strategy can
 * produce a node whose degree exceeds it. Insertion-ordered collections keep
 * iteration deterministic for a seeded run. Not thread-safe; owned by a
 * single {@link NetworkEvolutionEngine}.
 */
public class OrganismGraph {

    private final int maxConnectionsPerOrganism;
    private final Map<Integer, Set<Integer>> adjacency = new LinkedHashMap<>();
    private int nextId;
    private int connectionCount;

    public OrganismGraph(int maxConnectionsPerOrganism) {
        this.maxConnectionsPerOrganism = maxConnectionsPerOrganism;
    }

    public int addOrganism() {
        int id = nextId++;
        adjacency.put(id, new LinkedHashSet<>());
        return id;
    }

    /**
     * Connect two organisms.
     *
     * @return false if either is unknown, they are the same organism, already
     *         connected, or one of them is at its connection cap
     */
    public boolean connect(int a, int b) {
        if (a == b) {
            return false;
        }
        Set<Integer> left = adjacency.get(a);
        Set<Integer> right = adjacency.get(b);
        if (left == null || right == null || left.contains(b)) {
            return false;
        }
        if (left.size() >= maxConnectionsPerOrganism || right.size() >= maxConnectionsPerOrganism) {
            return false;
        }
        left.add(b);
        right.add(a);
        connectionCount++;
        return true;
    }

    public boolean disconnect(int a, int b) {
        Set<Integer> left = adjacency.get(a);
        if (left == null || !left.remove(b)) {
            return false;
        }
        adjacency.get(b).remove(a);
        connectionCount--;
        return true;
    }

    public boolean isConnected(int a, int b) {
        Set<Integer> left = adjacency.get(a);
        return left != null && left.contains(b);
    }

    public boolean hasCapacity(int id) {
        Set<Integer> neighbors = adjacency.get(id);
        return neighbors != null && neighbors.size() < maxConnectionsPerOrganism;
    }

    public int degree(int id) {
        Set<Integer> neighbors = adjacency.get(id);
        return neighbors == null ? 0 : neighbors.size();
    }

    public Set<Integer> neighbors(int id) {
        Set<Integer> neighbors = adjacency.get(id);
        return neighbors == null ? Collections.emptySet() : Collections.unmodifiableSet(neighbors);
    }

    public List<Integer> organisms() {
        return new ArrayList<>(adjacency.keySet());
    }

    public int organismCount() {
        return adjacency.size();
    }

    public int connectionCount() {
        return connectionCount;
    }

    public int maxDegree() {
        int max = 0;
        for (Set<Integer> neighbors : adjacency.values()) {
            max = Math.max(max, neighbors.size());
        }
        return max;
    }

    public int getMaxConnectionsPerOrganism() {
        return maxConnectionsPerOrganism;
    }
}

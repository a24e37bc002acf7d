package com.z254.butterfly.coordination.network;

import com.z254.butterfly.coordination.config.ButterflyProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Default evolution step: growth, connection formation, pruning, rewiring.
 * <p>
 * New connections close a triangle (friend of a friend) with probability
 * {@code triadicClosureBias}, otherwise they link two random organisms that
 * both have spare capacity.
 */
public class SymbioticEvolutionStrategy implements EvolutionStrategy {

    private final int growthPerGeneration;
    private final int newConnectionsPerGeneration;
    private final double triadicClosureBias;
    private final double pruneProbability;
    private final double rewireProbability;

    public SymbioticEvolutionStrategy(ButterflyProperties.Network config) {
        this.growthPerGeneration = config.getGrowthPerGeneration();
        this.newConnectionsPerGeneration = config.getNewConnectionsPerGeneration();
        this.triadicClosureBias = config.getTriadicClosureBias();
        this.pruneProbability = config.getPruneProbability();
        this.rewireProbability = config.getRewireProbability();
    }

    @Override
    public void evolve(OrganismGraph graph, int maxOrganisms, Random random) {
        grow(graph, maxOrganisms, random);
        formConnections(graph, random);
        prune(graph, random);
        rewire(graph, random);
    }

    private void grow(OrganismGraph graph, int maxOrganisms, Random random) {
        int room = Math.max(0, maxOrganisms - graph.organismCount());
        int births = Math.min(growthPerGeneration, room);
        for (int i = 0; i < births; i++) {
            List<Integer> open = withCapacity(graph);
            int newborn = graph.addOrganism();
            if (!open.isEmpty()) {
                graph.connect(newborn, open.get(random.nextInt(open.size())));
            }
        }
    }

    private void formConnections(OrganismGraph graph, Random random) {
        for (int i = 0; i < newConnectionsPerGeneration; i++) {
            List<Integer> open = withCapacity(graph);
            if (open.size() < 2) {
                return;
            }
            int source = open.get(random.nextInt(open.size()));
            Integer target = random.nextDouble() < triadicClosureBias
                    ? friendOfFriend(graph, source, random)
                    : null;
            if (target == null) {
                target = open.get(random.nextInt(open.size()));
            }
            graph.connect(source, target);
        }
    }

    private void prune(OrganismGraph graph, Random random) {
        if (pruneProbability <= 0.0) {
            return;
        }
        for (int[] edge : edges(graph)) {
            if (random.nextDouble() < pruneProbability) {
                graph.disconnect(edge[0], edge[1]);
            }
        }
    }

    private void rewire(OrganismGraph graph, Random random) {
        if (rewireProbability <= 0.0) {
            return;
        }
        for (int[] edge : edges(graph)) {
            if (random.nextDouble() >= rewireProbability || !graph.isConnected(edge[0], edge[1])) {
                continue;
            }
            graph.disconnect(edge[0], edge[1]);
            Integer target = friendOfFriend(graph, edge[0], random);
            if (target == null || target == edge[1] || !graph.connect(edge[0], target)) {
                graph.connect(edge[0], edge[1]);
            }
        }
    }

    private Integer friendOfFriend(OrganismGraph graph, int source, Random random) {
        List<Integer> candidates = new ArrayList<>();
        for (Integer friend : graph.neighbors(source)) {
            for (Integer candidate : graph.neighbors(friend)) {
                if (candidate != source && !graph.isConnected(source, candidate) && graph.hasCapacity(candidate)) {
                    candidates.add(candidate);
                }
            }
        }
        return candidates.isEmpty() ? null : candidates.get(random.nextInt(candidates.size()));
    }

    private List<Integer> withCapacity(OrganismGraph graph) {
        List<Integer> open = new ArrayList<>();
        for (Integer organism : graph.organisms()) {
            if (graph.hasCapacity(organism)) {
                open.add(organism);
            }
        }
        return open;
    }

    private List<int[]> edges(OrganismGraph graph) {
        List<int[]> edges = new ArrayList<>();
        for (Integer a : graph.organisms()) {
            for (Integer b : graph.neighbors(a)) {
                if (a < b) {
                    edges.add(new int[]{a, b});
                }
            }
        }
        return edges;
    }
}

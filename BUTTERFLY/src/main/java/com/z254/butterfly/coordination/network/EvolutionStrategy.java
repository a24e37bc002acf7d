package com.z254.butterfly.coordination.network;

import java.util.Random;

/**
 * One step of population and connection change applied to the graph.
 * <p>
 * Implementations must go through {@link OrganismGraph} so the connection cap
 * holds, and must never grow the population beyond {@code maxOrganisms}.
 */
@FunctionalInterface
public interface EvolutionStrategy {

    void evolve(OrganismGraph graph, int maxOrganisms, Random random);
}

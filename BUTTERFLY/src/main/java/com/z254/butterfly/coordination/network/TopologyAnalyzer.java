package com.z254.butterfly.coordination.network;

/**
 * Derives {@link NetworkMetrics} from the live graph after a generation.
 */
@FunctionalInterface
public interface TopologyAnalyzer {

    NetworkMetrics analyze(long generation, OrganismGraph graph);
}

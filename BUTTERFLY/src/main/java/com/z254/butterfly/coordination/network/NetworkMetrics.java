package com.z254.butterfly.coordination.network;

import lombok.Builder;
import lombok.Value;

/**
 * Topology metrics of one generation.
 * <p>
 * {@code averagePathLength} is {@link Double#POSITIVE_INFINITY} when the
 * graph is disconnected or has fewer than two organisms.
 */
@Value
@Builder(toBuilder = true)
public class NetworkMetrics {

    long generation;
    int organismCount;
    int connectionCount;
    double averageDegree;
    double density;
    double clusteringCoefficient;
    double modularity;
    @Builder.Default
    double averagePathLength = Double.POSITIVE_INFINITY;

    public boolean isConnected() {
        return !Double.isInfinite(averagePathLength);
    }
}

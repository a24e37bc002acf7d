package com.z254.butterfly.coordination.network;

import com.z254.butterfly.coordination.config.ButterflyProperties;

/**
 * The four sub-conditions of network collapse. All must hold in the same
 * generation for the network to count as collapsed.
 */
public enum CollapseCondition {

    ORGANISM_COUNT {
        @Override
        public boolean test(NetworkMetrics metrics, ButterflyProperties.Network config) {
            return metrics.getOrganismCount() >= config.getCollapseThreshold();
        }
    },

    CLUSTERING {
        @Override
        public boolean test(NetworkMetrics metrics, ButterflyProperties.Network config) {
            return metrics.getClusteringCoefficient() > config.getClusteringThreshold();
        }
    },

    MODULARITY {
        @Override
        public boolean test(NetworkMetrics metrics, ButterflyProperties.Network config) {
            return metrics.getModularity() < config.getModularityThreshold();
        }
    },

    /** An undefined (infinite) path length never satisfies this. */
    PATH_LENGTH {
        @Override
        public boolean test(NetworkMetrics metrics, ButterflyProperties.Network config) {
            double pathLength = metrics.getAveragePathLength();
            return !Double.isNaN(pathLength)
                    && !Double.isInfinite(pathLength)
                    && pathLength < config.getPathLengthThreshold();
        }
    };

    public abstract boolean test(NetworkMetrics metrics, ButterflyProperties.Network config);
}

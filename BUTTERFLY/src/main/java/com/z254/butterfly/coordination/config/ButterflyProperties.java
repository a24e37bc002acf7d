package com.z254.butterfly.coordination.config;

import com.z254.butterfly.coordination.network.PostCollapsePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the BUTTERFLY service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Breath pacing (period, inhale ratio, tick interval)</li>
 *     <li>Network evolution bounds and collapse thresholds</li>
 *     <li>Violation-pressure thresholds and the trait envelope</li>
 *     <li>Aggregation cadence and readiness policy</li>
 * </ul>
 * Core components receive these objects directly and never read
 * configuration sources themselves.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "butterfly")
public class ButterflyProperties {

    private final Breath breath = new Breath();
    private final Network network = new Network();
    private final Pressure pressure = new Pressure();
    private final Aggregator aggregator = new Aggregator();

    /**
     * Breath engine configuration.
     */
    @Data
    public static class Breath {
        /** Length of one full inhale-exhale cycle; zero yields a flat breath */
        @NotNull
        private Duration period = Duration.ofSeconds(4);

        /** Fraction of the cycle spent inhaling */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double inhaleRatio = 0.5;

        /** Interval between breath ticks */
        @NotNull
        private Duration tickInterval = Duration.ofMillis(50);

        /** Rate multiplier applied once the unified transition triggers */
        @Positive
        private double transitionRateFactor = 0.5;
    }

    /**
     * Network evolution engine configuration.
     */
    @Data
    public static class Network {
        private boolean enabled = true;

        @Positive
        private int maxOrganisms = 600;

        @Positive
        private int maxConnectionsPerOrganism = 5;

        /** Organism count required for collapse */
        @Positive
        private int collapseThreshold = 500;

        /** Clustering coefficient must exceed this */
        private double clusteringThreshold = 0.5;

        /** Modularity must stay below this */
        private double modularityThreshold = 0.3;

        /** Average path length must stay below this */
        private double pathLengthThreshold = 3.0;

        @PositiveOrZero
        private int initialOrganisms = 10;

        @PositiveOrZero
        private int growthPerGeneration = 8;

        @PositiveOrZero
        private int newConnectionsPerGeneration = 12;

        /** Probability that a new connection closes a triangle */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double triadicClosureBias = 0.7;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double pruneProbability = 0.02;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rewireProbability = 0.05;

        private long seed = 42L;

        @NotNull
        private Duration generationInterval = Duration.ofMillis(200);

        @NotNull
        private PostCollapsePolicy postCollapsePolicy = PostCollapsePolicy.FREEZE;
    }

    /**
     * Violation-pressure monitor configuration.
     */
    @Data
    public static class Pressure {
        private boolean enabled = true;

        /** VP strictly below this is convergence */
        @Positive
        private double convergenceThreshold = 0.25;

        /** VP at or above this is divergence and yields zero proximity */
        @Positive
        private double divergenceCeiling = 1.0;

        @NotNull
        private Duration pollInterval = Duration.ofMillis(50);

        @Positive
        private int maxPendingEvents = 1000;

        /** Stability envelope per trait for the default pressure function */
        private Map<String, TraitEnvelope> traits = new LinkedHashMap<>();
    }

    /**
     * Stability envelope of a single trait.
     */
    @Data
    public static class TraitEnvelope {
        /** Ideal value */
        private double center;
        private double min;
        private double max = 1.0;
        private double weight = 1.0;
    }

    /**
     * State aggregator configuration.
     */
    @Data
    public static class Aggregator {
        @NotNull
        private Duration interval = Duration.ofMillis(500);

        /** Consecutive wing updates at full proximity before the wing counts as ready */
        @Positive
        private int readinessHoldSamples = 1;

        @Positive
        private int historySize = 256;
    }
}

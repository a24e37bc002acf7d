package com.z254.butterfly.coordination.network;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.exception.ButterflyConfigurationException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;

/**
 * Owns the organism graph and advances it one generation at a time.
 * <p>
 * Generations are strictly sequential: generation N is analyzed only after
 * its mutation is fully applied, and no generation is skipped or merged, so
 * the metrics form a time series indexed by generation.
 */
@Slf4j
public class NetworkEvolutionEngine {

    private final ButterflyProperties.Network config;
    private final EvolutionStrategy strategy;
    private final TopologyAnalyzer analyzer;
    private final OrganismGraph graph;
    private final CollapseTracker tracker;
    private final Random random;

    private long generation;
    private NetworkMetrics latestMetrics;
    private CollapseStatus latestStatus = CollapseStatus.initial();

    public NetworkEvolutionEngine(ButterflyProperties.Network config,
                                  EvolutionStrategy strategy,
                                  TopologyAnalyzer analyzer) {
        validate(config);
        this.config = config;
        this.strategy = strategy;
        this.analyzer = analyzer;
        this.graph = new OrganismGraph(config.getMaxConnectionsPerOrganism());
        this.tracker = new CollapseTracker(config);
        this.random = new Random(config.getSeed());

        for (int i = 0; i < config.getInitialOrganisms(); i++) {
            graph.addOrganism();
        }
        this.latestMetrics = analyzer.analyze(0, graph);

        log.info("Initialized network evolution engine: maxOrganisms={}, maxConnectionsPerOrganism={}, "
                        + "collapseThreshold={}, initialOrganisms={}",
                config.getMaxOrganisms(), config.getMaxConnectionsPerOrganism(),
                config.getCollapseThreshold(), config.getInitialOrganisms());
    }

    /**
     * Apply exactly one evolution step, then recompute metrics and evaluate collapse.
     */
    public synchronized GenerationResult evolveGeneration() {
        generation++;
        strategy.evolve(graph, config.getMaxOrganisms(), random);

        NetworkMetrics metrics = analyzer.analyze(generation, graph);
        CollapseStatus status = tracker.evaluate(metrics);
        boolean firstCollapse = status.isCollapsed()
                && Long.valueOf(generation).equals(tracker.diagnostics().getCollapsedAtGeneration());

        latestMetrics = metrics;
        latestStatus = status;

        if (firstCollapse) {
            log.info("Network collapse detected: generation={}, organisms={}, clustering={}, modularity={}, "
                            + "pathLength={}",
                    generation, metrics.getOrganismCount(), metrics.getClusteringCoefficient(),
                    metrics.getModularity(), metrics.getAveragePathLength());
        }
        return new GenerationResult(metrics, status, firstCollapse);
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public synchronized NetworkMetrics getLatestMetrics() {
        return latestMetrics;
    }

    public synchronized CollapseStatus getLatestStatus() {
        return latestStatus;
    }

    public synchronized boolean isCollapsed() {
        return latestStatus.isCollapsed();
    }

    /**
     * True once collapse has held in any generation so far.
     */
    public synchronized boolean hasEverCollapsed() {
        return tracker.diagnostics().getCollapsedAtGeneration() != null;
    }

    public synchronized CollapseDiagnostics diagnostics() {
        return tracker.diagnostics();
    }

    public synchronized int maxDegree() {
        return graph.maxDegree();
    }

    public ButterflyProperties.Network getConfig() {
        return config;
    }

    private static void validate(ButterflyProperties.Network config) {
        ButterflyConfigurationException.require(config.getMaxOrganisms() > 0,
                "butterfly.network.max-organisms", "must be positive, was " + config.getMaxOrganisms());
        ButterflyConfigurationException.require(config.getMaxConnectionsPerOrganism() > 0,
                "butterfly.network.max-connections-per-organism",
                "must be positive, was " + config.getMaxConnectionsPerOrganism());
        ButterflyConfigurationException.require(config.getCollapseThreshold() > 0,
                "butterfly.network.collapse-threshold", "must be positive, was " + config.getCollapseThreshold());
        ButterflyConfigurationException.require(config.getCollapseThreshold() <= config.getMaxOrganisms(),
                "butterfly.network.collapse-threshold",
                "must not exceed max-organisms (" + config.getMaxOrganisms() + "), was "
                        + config.getCollapseThreshold());
        ButterflyConfigurationException.require(config.getInitialOrganisms() >= 0
                        && config.getInitialOrganisms() <= config.getMaxOrganisms(),
                "butterfly.network.initial-organisms",
                "must be within [0, max-organisms], was " + config.getInitialOrganisms());
        ButterflyConfigurationException.require(config.getPostCollapsePolicy() != null,
                "butterfly.network.post-collapse-policy", "must be set");
    }

    /**
     * Outcome of one generation.
     */
    @Value
    public static class GenerationResult {
        NetworkMetrics metrics;
        CollapseStatus status;
        /** True only for the first generation in which collapse held */
        boolean firstCollapse;
    }
}

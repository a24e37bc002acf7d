package com.z254.butterfly.coordination.config;

import com.z254.butterfly.coordination.aggregator.InMemorySnapshotRepository;
import com.z254.butterfly.coordination.aggregator.SnapshotRepository;
import com.z254.butterfly.coordination.aggregator.StateAggregator;
import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.breath.BreathEngine;
import com.z254.butterfly.coordination.exception.ButterflyConfigurationException;
import com.z254.butterfly.coordination.network.EvolutionStrategy;
import com.z254.butterfly.coordination.network.GraphTopologyAnalyzer;
import com.z254.butterfly.coordination.network.NetworkEvolutionEngine;
import com.z254.butterfly.coordination.network.SymbioticEvolutionStrategy;
import com.z254.butterfly.coordination.network.TopologyAnalyzer;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.TransitionEventType;
import com.z254.butterfly.coordination.pressure.EnvelopePressureFunction;
import com.z254.butterfly.coordination.pressure.PressureFunction;
import com.z254.butterfly.coordination.pressure.ViolationPressureMonitor;
import com.z254.butterfly.coordination.wing.NetworkWingAdapter;
import com.z254.butterfly.coordination.wing.PressureWingAdapter;
import com.z254.butterfly.coordination.wing.WingRegistry;
import com.z254.butterfly.coordination.wing.WingType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Wires the breath engine, both wings and the aggregator.
 * <p>
 * Invalid configuration fails startup. Any other failure while bringing a
 * wing up leaves that wing unavailable and the rest of the organism running.
 */
@Slf4j
@Configuration
public class ButterflyConfiguration {

    private final ButterflyProperties properties;

    public ButterflyConfiguration(ButterflyProperties properties) {
        this.properties = properties;
    }

    // ==================== Breath ====================

    @Bean
    public BreathEngine breathEngine() {
        return new BreathEngine(properties.getBreath());
    }

    @Bean
    public StateBoard stateBoard(BreathEngine breathEngine) {
        return new StateBoard(breathEngine.current());
    }

    // ==================== Wings ====================

    @Bean
    public TopologyAnalyzer topologyAnalyzer() {
        return new GraphTopologyAnalyzer(properties.getNetwork().getSeed());
    }

    @Bean
    public EvolutionStrategy evolutionStrategy() {
        return new SymbioticEvolutionStrategy(properties.getNetwork());
    }

    @Bean
    public PressureFunction pressureFunction() {
        return new EnvelopePressureFunction(properties.getPressure().getTraits());
    }

    @Bean
    public WingRegistry wingRegistry(StateBoard board,
                                     TopologyAnalyzer topologyAnalyzer,
                                     EvolutionStrategy evolutionStrategy,
                                     PressureFunction pressureFunction,
                                     ButterflyMetrics metrics,
                                     ButterflyStructuredLogger structuredLogger) {
        WingRegistry registry = new WingRegistry(board, metrics, structuredLogger);

        ButterflyProperties.Network network = properties.getNetwork();
        if (!network.isEnabled()) {
            registry.markUnavailable(WingType.NETWORK, "disabled by configuration");
        } else {
            try {
                NetworkEvolutionEngine engine = new NetworkEvolutionEngine(network, evolutionStrategy,
                        topologyAnalyzer);
                registry.register(new NetworkWingAdapter(engine, board, metrics, structuredLogger));
            } catch (ButterflyConfigurationException e) {
                throw e;
            } catch (RuntimeException | LinkageError e) {
                log.error("Network wing failed to initialize", e);
                registry.markUnavailable(WingType.NETWORK, e.toString());
            }
        }

        ButterflyProperties.Pressure pressure = properties.getPressure();
        if (!pressure.isEnabled()) {
            registry.markUnavailable(WingType.PRESSURE, "disabled by configuration");
        } else {
            try {
                ViolationPressureMonitor monitor = new ViolationPressureMonitor(pressure, pressureFunction);
                registry.register(new PressureWingAdapter(monitor, pressure.getMaxPendingEvents(), board,
                        metrics, structuredLogger));
            } catch (ButterflyConfigurationException e) {
                throw e;
            } catch (RuntimeException | LinkageError e) {
                log.error("Pressure wing failed to initialize", e);
                registry.markUnavailable(WingType.PRESSURE, e.toString());
            }
        }
        return registry;
    }

    // ==================== Aggregation ====================

    @Bean
    public StateAggregator stateAggregator(StateBoard board,
                                           BreathEngine breathEngine,
                                           ButterflyMetrics metrics,
                                           ButterflyStructuredLogger structuredLogger) {
        StateAggregator aggregator = new StateAggregator(board,
                properties.getAggregator().getReadinessHoldSamples(), metrics, structuredLogger);

        double factor = properties.getBreath().getTransitionRateFactor();
        aggregator.onTransition(event -> {
            breathEngine.adjustRate(factor);
            structuredLogger.logTransitionEvent(event.getBreathCycle(), TransitionEventType.BREATH_RATE_ADJUSTED,
                    "Breath slowed for transition", Map.of("factor", factor, "rate", breathEngine.getRate()));
        });
        return aggregator;
    }

    @Bean
    public SnapshotRepository snapshotRepository() {
        return new InMemorySnapshotRepository(properties.getAggregator().getHistorySize());
    }
}

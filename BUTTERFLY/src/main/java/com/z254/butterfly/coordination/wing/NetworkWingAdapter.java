package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.network.CollapseCondition;
import com.z254.butterfly.coordination.network.CollapseDiagnostics;
import com.z254.butterfly.coordination.network.CollapseStatus;
import com.z254.butterfly.coordination.network.NetworkEvolutionEngine;
import com.z254.butterfly.coordination.network.NetworkMetrics;
import com.z254.butterfly.coordination.network.PostCollapsePolicy;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.WingEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Network wing: advances the evolution engine one generation per call and
 * reports collapse proximity as the fraction of satisfied sub-conditions.
 * <p>
 * Under {@link PostCollapsePolicy#FREEZE} the wing stops advancing once
 * collapse has been detected. Each later call republishes the collapsed
 * generation unchanged, so its readiness streak keeps growing.
 */
@Slf4j
public class NetworkWingAdapter extends AbstractWingAdapter {

    private final NetworkEvolutionEngine engine;
    private final PostCollapsePolicy postCollapsePolicy;

    private Set<CollapseCondition> lastSatisfied = EnumSet.noneOf(CollapseCondition.class);
    private volatile boolean frozen;

    public NetworkWingAdapter(NetworkEvolutionEngine engine,
                              StateBoard board,
                              ButterflyMetrics metrics,
                              ButterflyStructuredLogger structuredLogger) {
        super(board, metrics, structuredLogger);
        this.engine = engine;
        this.postCollapsePolicy = engine.getConfig().getPostCollapsePolicy();

        publish(stateFrom(engine.getLatestMetrics(), engine.getLatestStatus()));
        metrics.recordWingAvailability(WingType.NETWORK, true);
    }

    @Override
    public WingType wing() {
        return WingType.NETWORK;
    }

    @Override
    public boolean advanceIfReady() {
        if (frozen) {
            hold();
            return false;
        }

        Timer.Sample sample = metrics.startGenerationTimer();
        NetworkEvolutionEngine.GenerationResult result = engine.evolveGeneration();
        NetworkMetrics networkMetrics = result.getMetrics();
        CollapseStatus status = result.getStatus();
        metrics.recordGeneration(sample, networkMetrics.getOrganismCount());

        logConditionChanges(status);
        if (result.isFirstCollapse()) {
            metrics.recordCollapse();
            structuredLogger.logGeneration(status.getGeneration(), WingEventType.COLLAPSE_DETECTED,
                    "Network collapse detected", describe(networkMetrics));
        }
        if (status.isCollapsed() && postCollapsePolicy == PostCollapsePolicy.FREEZE) {
            frozen = true;
            structuredLogger.logGeneration(status.getGeneration(), WingEventType.FROZEN,
                    "Network wing frozen after collapse", Map.of("policy", postCollapsePolicy.name()));
        }

        publish(stateFrom(networkMetrics, status));
        structuredLogger.logGeneration(status.getGeneration(), WingEventType.GENERATION_EVOLVED,
                "Generation evolved", describe(networkMetrics));
        return true;
    }

    private void hold() {
        WingState held = currentState();
        publish(held.toBuilder());
    }

    public boolean isFrozen() {
        return frozen;
    }

    public CollapseDiagnostics diagnostics() {
        return engine.diagnostics();
    }

    public NetworkMetrics latestMetrics() {
        return engine.getLatestMetrics();
    }

    private WingState.WingStateBuilder stateFrom(NetworkMetrics networkMetrics, CollapseStatus status) {
        return WingState.builder()
                .phase(status.isCollapsed() ? WingPhase.PRECISION : WingPhase.CHAOS)
                .proximity(status.getProximity())
                .generation(networkMetrics.getGeneration())
                .organismCount(networkMetrics.getOrganismCount())
                .connectionCount(networkMetrics.getConnectionCount())
                .conditionsSatisfied(status.getSatisfied().size())
                .frozen(frozen);
    }

    private void logConditionChanges(CollapseStatus status) {
        for (CollapseCondition condition : CollapseCondition.values()) {
            boolean now = status.getSatisfied().contains(condition);
            boolean before = lastSatisfied.contains(condition);
            if (now && !before) {
                structuredLogger.logGeneration(status.getGeneration(), WingEventType.CONDITION_MET,
                        "Collapse condition met", Map.of("condition", condition.name()));
            } else if (!now && before) {
                structuredLogger.logGeneration(status.getGeneration(), WingEventType.CONDITION_LOST,
                        "Collapse condition lost", Map.of("condition", condition.name()));
            }
        }
        lastSatisfied = status.getSatisfied().isEmpty()
                ? EnumSet.noneOf(CollapseCondition.class)
                : EnumSet.copyOf(status.getSatisfied());
    }

    private Map<String, Object> describe(NetworkMetrics networkMetrics) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("organisms", networkMetrics.getOrganismCount());
        details.put("connections", networkMetrics.getConnectionCount());
        details.put("clustering", networkMetrics.getClusteringCoefficient());
        details.put("modularity", networkMetrics.getModularity());
        details.put("pathLength", networkMetrics.getAveragePathLength());
        return details;
    }
}

package com.z254.butterfly.coordination.network;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates the collapse predicate each generation and tracks, per
 * sub-condition, the generation from which it has held without interruption.
 * <p>
 * A condition that lapses loses its first-true generation and starts over
 * when it holds again. Not thread-safe; driven by the engine's generation loop.
 */
@Slf4j
public class CollapseTracker {

    private final ButterflyProperties.Network config;
    private final Map<CollapseCondition, Long> firstTrue = new EnumMap<>(CollapseCondition.class);

    private long generation;
    private Long collapsedAtGeneration;

    public CollapseTracker(ButterflyProperties.Network config) {
        this.config = config;
    }

    public CollapseStatus evaluate(NetworkMetrics metrics) {
        generation = metrics.getGeneration();
        Set<CollapseCondition> satisfied = EnumSet.noneOf(CollapseCondition.class);

        for (CollapseCondition condition : CollapseCondition.values()) {
            if (condition.test(metrics, config)) {
                satisfied.add(condition);
                if (firstTrue.putIfAbsent(condition, generation) == null) {
                    log.debug("Collapse condition met: condition={}, generation={}", condition, generation);
                }
            } else if (firstTrue.remove(condition) != null) {
                log.debug("Collapse condition lost: condition={}, generation={}", condition, generation);
            }
        }

        CollapseStatus status = new CollapseStatus(generation, satisfied);
        if (status.isCollapsed() && collapsedAtGeneration == null) {
            collapsedAtGeneration = generation;
        }
        return status;
    }

    public CollapseDiagnostics diagnostics() {
        Set<CollapseCondition> pending = EnumSet.allOf(CollapseCondition.class);
        pending.removeAll(firstTrue.keySet());

        CollapseCondition bottleneck = null;
        Long bottleneckGeneration = null;
        if (pending.isEmpty()) {
            for (Map.Entry<CollapseCondition, Long> entry : firstTrue.entrySet()) {
                if (bottleneckGeneration == null || entry.getValue() > bottleneckGeneration) {
                    bottleneck = entry.getKey();
                    bottleneckGeneration = entry.getValue();
                }
            }
        }

        return CollapseDiagnostics.builder()
                .generation(generation)
                .firstTrueGenerations(Collections.unmodifiableMap(new EnumMap<>(firstTrue)))
                .pendingConditions(Collections.unmodifiableSet(pending))
                .bottleneckCondition(bottleneck)
                .bottleneckGeneration(bottleneckGeneration)
                .collapsedAtGeneration(collapsedAtGeneration)
                .build();
    }
}

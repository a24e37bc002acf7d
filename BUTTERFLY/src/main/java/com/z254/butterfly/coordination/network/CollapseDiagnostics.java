package com.z254.butterfly.coordination.network;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Bottleneck view of the collapse predicate.
 * <p>
 * {@code firstTrueGenerations} holds, per satisfied condition, the generation
 * from which it has held continuously. The bottleneck is the condition that
 * became true last; it is only known once every condition holds. Before that
 * the {@code pendingConditions} are what collapse is waiting on.
 */
@Value
@Builder
public class CollapseDiagnostics {

    long generation;
    Map<CollapseCondition, Long> firstTrueGenerations;
    Set<CollapseCondition> pendingConditions;
    CollapseCondition bottleneckCondition;
    Long bottleneckGeneration;
    Long collapsedAtGeneration;

    public boolean isBottleneckKnown() {
        return bottleneckGeneration != null;
    }
}

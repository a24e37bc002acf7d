package com.z254.butterfly.coordination.network;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Collapse evaluation of a single generation.
 */
@Value
public class CollapseStatus {

    long generation;
    Set<CollapseCondition> satisfied;

    public CollapseStatus(long generation, Set<CollapseCondition> satisfied) {
        this.generation = generation;
        this.satisfied = satisfied.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CollapseCondition.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(satisfied));
    }

    /**
     * Fraction of the sub-conditions currently satisfied: 0, 0.25, 0.5, 0.75 or 1.0.
     */
    public double getProximity() {
        return (double) satisfied.size() / CollapseCondition.values().length;
    }

    public boolean isCollapsed() {
        return satisfied.size() == CollapseCondition.values().length;
    }

    public static CollapseStatus initial() {
        return new CollapseStatus(0, EnumSet.noneOf(CollapseCondition.class));
    }
}

package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.pressure.VpClass;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable state published by a wing adapter after each advance.
 * <p>
 * Network fields are zero on the pressure wing and vice versa. An
 * unavailable wing reports phase {@link WingPhase#UNAVAILABLE}, proximity 0,
 * {@code available=false} and NaN pressure.
 */
@Value
@Builder(toBuilder = true)
public class WingState {

    WingType wing;
    boolean available;
    WingPhase phase;
    double proximity;

    /** Consecutive updates in which proximity was 1.0 */
    int readyStreak;

    /** Per-wing update counter */
    long sequence;

    // Network wing
    long generation;
    int organismCount;
    int connectionCount;
    int conditionsSatisfied;
    boolean frozen;

    // Pressure wing
    @Builder.Default
    double currentVp = Double.NaN;
    VpClass vpClass;
    long calculationCount;

    Instant updatedAt;

    /**
     * Ready when fully proximate for at least {@code holdSamples} consecutive updates.
     */
    public boolean isReady(int holdSamples) {
        return available && proximity >= 1.0 && readyStreak >= holdSamples;
    }

    public static WingState unavailable(WingType wing) {
        return WingState.builder()
                .wing(wing)
                .available(false)
                .phase(WingPhase.UNAVAILABLE)
                .proximity(0.0)
                .updatedAt(Instant.now())
                .build();
    }
}

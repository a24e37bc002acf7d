package com.z254.butterfly.coordination.breath;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One published instant of the breath signal.
 * <p>
 * {@code phase} runs from -1 (fully exhaled) up to +1 during the inhale and
 * back down to -1 during the exhale. {@code depth} is the same curve mapped
 * onto [0, 1]. {@code position} is the fraction of the current cycle elapsed.
 * Instances are never mutated; the next tick supersedes them.
 */
@Value
@Builder
public class BreathState {

    double phase;
    double depth;
    long cycle;
    double position;
    double inhaleRatio;
    boolean flat;
    Instant timestamp;

    /**
     * Output of an engine configured with a zero period.
     */
    public static BreathState flat(long cycle, double inhaleRatio) {
        return BreathState.builder()
                .phase(-1.0)
                .depth(0.0)
                .cycle(cycle)
                .position(0.0)
                .inhaleRatio(inhaleRatio)
                .flat(true)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Build the state for a cycle position.
     */
    public static BreathState at(long cycle, double position, double inhaleRatio) {
        double angle = angle(position, inhaleRatio);
        double phase = -Math.cos(angle);
        return BreathState.builder()
                .phase(phase)
                .depth(clamp((1.0 + phase) / 2.0))
                .cycle(cycle)
                .position(position)
                .inhaleRatio(inhaleRatio)
                .flat(false)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isInhale() {
        return !flat && position < inhaleRatio;
    }

    public boolean isExhale() {
        return !isInhale();
    }

    /**
     * Magnitude of the instantaneous rate of change, normalised to [0, 1].
     * Zero at the turning points and for a flat breath.
     */
    public double pulse() {
        if (flat) {
            return 0.0;
        }
        return clamp(Math.abs(Math.sin(angle(position, inhaleRatio))));
    }

    // The inhale covers [0, pi] of the angle, the exhale (pi, 2pi].
    private static double angle(double position, double inhaleRatio) {
        if (position < inhaleRatio) {
            return Math.PI * position / inhaleRatio;
        }
        return Math.PI + Math.PI * (position - inhaleRatio) / (1.0 - inhaleRatio);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

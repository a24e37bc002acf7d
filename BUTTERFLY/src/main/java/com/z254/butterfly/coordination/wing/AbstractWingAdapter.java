package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;

import java.time.Instant;

/**
 * Shared plumbing for wing adapters: publication to the state board and
 * breath sampling. Each adapter is the single writer of its wing's state.
 */
public abstract class AbstractWingAdapter implements ReactiveSubsystemAdapter {

    protected final StateBoard board;
    protected final ButterflyMetrics metrics;
    protected final ButterflyStructuredLogger structuredLogger;

    protected AbstractWingAdapter(StateBoard board,
                                  ButterflyMetrics metrics,
                                  ButterflyStructuredLogger structuredLogger) {
        this.board = board;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public double sample(BreathState breath) {
        return flapIntensity(breath, currentState());
    }

    @Override
    public WingState currentState() {
        return board.wing(wing());
    }

    /**
     * Publish the next state, carrying the readiness streak forward.
     */
    protected WingState publish(WingState.WingStateBuilder next) {
        WingState previous = currentState();
        WingState candidate = next.wing(wing())
                .available(true)
                .sequence(previous.getSequence() + 1)
                .updatedAt(Instant.now())
                .build();
        int streak = candidate.getProximity() >= 1.0 ? previous.getReadyStreak() + 1 : 0;
        WingState published = candidate.toBuilder().readyStreak(streak).build();
        board.publishWing(published);
        return published;
    }

    /**
     * Pulse times proximity; zero for a flat breath or an unavailable wing.
     */
    public static double flapIntensity(BreathState breath, WingState state) {
        if (breath == null || breath.isFlat() || state == null || !state.isAvailable()) {
            return 0.0;
        }
        return breath.pulse() * state.getProximity();
    }
}

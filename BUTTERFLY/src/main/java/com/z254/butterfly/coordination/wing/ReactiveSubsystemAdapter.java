package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.breath.BreathState;

/**
 * Uniform contract between a wing's subsystem and the aggregator.
 * <p>
 * Breath informs how strongly a wing responds, never whether it advances:
 * {@link #sample(BreathState)} is a constant-time read with no effect on the
 * subsystem, while {@link #advanceIfReady()} is driven at the subsystem's own
 * rhythm.
 */
public interface ReactiveSubsystemAdapter {

    WingType wing();

    /**
     * Flap intensity for the given breath: pulse times proximity to transition.
     */
    double sample(BreathState breath);

    /**
     * Advance the wrapped subsystem by one unit of its own rhythm.
     *
     * @return true if the subsystem advanced and a new state was published
     */
    boolean advanceIfReady();

    /**
     * Latest published state of this wing.
     */
    WingState currentState();

    default double proximityToTransition() {
        return currentState().getProximity();
    }
}

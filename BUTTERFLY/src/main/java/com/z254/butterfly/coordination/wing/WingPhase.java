package com.z254.butterfly.coordination.wing;

/**
 * Phase reported by a wing, or by the body for the breath.
 */
public enum WingPhase {
    CHAOS,
    PRECISION,
    /** Sentinel for a wing whose subsystem never came up */
    UNAVAILABLE
}

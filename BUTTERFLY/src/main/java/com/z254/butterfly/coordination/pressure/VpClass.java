package com.z254.butterfly.coordination.pressure;

/**
 * Violation-pressure bands.
 */
public enum VpClass {
    /** VP strictly below the convergence threshold */
    CONVERGENCE,
    /** Between the convergence threshold and the divergence ceiling */
    NEUTRAL,
    /** At or above the divergence ceiling */
    DIVERGENCE;

    public static VpClass classify(double vp, double convergenceThreshold, double divergenceCeiling) {
        if (vp < convergenceThreshold) {
            return CONVERGENCE;
        }
        if (vp >= divergenceCeiling) {
            return DIVERGENCE;
        }
        return NEUTRAL;
    }
}

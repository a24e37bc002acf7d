package com.z254.butterfly.coordination.pressure;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest violation-pressure reading.
 */
@Value
@Builder(toBuilder = true)
public class VPState {

    double currentVp;
    VpClass vpClass;
    long calculationCount;
    double proximity;
    Instant updatedAt;

    public boolean isConverged() {
        return vpClass == VpClass.CONVERGENCE;
    }
}

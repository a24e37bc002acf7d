package com.z254.butterfly.coordination.aggregator;

import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.wing.WingPhase;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Atomic snapshot of the whole organism: breath plus both wings, all taken
 * from the same board version.
 */
@Value
@Builder
public class ButterflyState {

    Instant timestamp;

    /** Board version the snapshot was read from */
    long version;

    BreathState breath;

    /** CHAOS while inhaling, PRECISION while exhaling or flat */
    WingPhase bodyPhase;

    WingState networkWing;
    WingState pressureWing;

    double networkFlapIntensity;
    double pressureFlapIntensity;

    boolean unifiedTransitionReady;
    Set<WingType> readyWings;

    /** True once the unified transition has been latched, in this or an earlier snapshot */
    boolean transitionTriggered;

    public WingState wing(WingType wing) {
        return wing == WingType.NETWORK ? networkWing : pressureWing;
    }
}

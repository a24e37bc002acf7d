package com.z254.butterfly.coordination.aggregator;

import com.z254.butterfly.coordination.wing.WingType;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * The first moment unified transition readiness was observed.
 */
@Value
public class TransitionEvent {
    Instant triggeredAt;
    Set<WingType> wings;
    long breathCycle;
    long boardVersion;
}

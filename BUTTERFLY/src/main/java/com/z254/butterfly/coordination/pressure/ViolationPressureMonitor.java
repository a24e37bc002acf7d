package com.z254.butterfly.coordination.pressure;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.exception.ButterflyConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Purely reactive violation-pressure monitor.
 * <p>
 * Every {@link #onEvent(Map)} call counts as one calculation. A trait vector
 * that cannot be scored (empty, or no trait covered by the pressure function)
 * leaves the pressure and its classification unchanged. Without input the
 * state simply holds. Until the first scored event the monitor reports the
 * divergence ceiling.
 */
@Slf4j
public class ViolationPressureMonitor {

    private final PressureFunction pressureFunction;
    private final double convergenceThreshold;
    private final double divergenceCeiling;
    private final AtomicReference<VPState> state;

    public ViolationPressureMonitor(ButterflyProperties.Pressure config, PressureFunction pressureFunction) {
        ButterflyConfigurationException.require(config.getConvergenceThreshold() > 0.0,
                "butterfly.pressure.convergence-threshold",
                "must be positive, was " + config.getConvergenceThreshold());
        ButterflyConfigurationException.require(config.getDivergenceCeiling() > config.getConvergenceThreshold(),
                "butterfly.pressure.divergence-ceiling",
                "must exceed convergence-threshold (" + config.getConvergenceThreshold() + "), was "
                        + config.getDivergenceCeiling());
        ButterflyConfigurationException.require(pressureFunction != null,
                "butterfly.pressure", "a pressure function is required");

        this.pressureFunction = pressureFunction;
        this.convergenceThreshold = config.getConvergenceThreshold();
        this.divergenceCeiling = config.getDivergenceCeiling();
        this.state = new AtomicReference<>(stateFor(divergenceCeiling, 0));

        log.info("Initialized violation-pressure monitor: convergenceThreshold={}, divergenceCeiling={}",
                convergenceThreshold, divergenceCeiling);
    }

    /**
     * Score one trait event.
     */
    public synchronized VPState onEvent(Map<String, Double> traits) {
        VPState previous = state.get();
        long count = previous.getCalculationCount() + 1;

        double vp = traits == null || traits.isEmpty() ? Double.NaN : pressureFunction.compute(traits);
        VPState next;
        if (Double.isNaN(vp) || Double.isInfinite(vp) || vp < 0.0) {
            log.debug("Unscorable trait event, pressure unchanged: traits={}, vp={}", traits, vp);
            next = previous.toBuilder()
                    .calculationCount(count)
                    .updatedAt(Instant.now())
                    .build();
        } else {
            next = stateFor(vp, count);
        }

        state.set(next);
        return next;
    }

    public VPState current() {
        return state.get();
    }

    /**
     * 1.0 while converged; otherwise {@code 1 - vp / divergenceCeiling},
     * reaching 0 at the ceiling.
     */
    public double proximityFor(double vp) {
        if (vp < convergenceThreshold) {
            return 1.0;
        }
        if (vp >= divergenceCeiling) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - vp / divergenceCeiling));
    }

    public double getConvergenceThreshold() {
        return convergenceThreshold;
    }

    public double getDivergenceCeiling() {
        return divergenceCeiling;
    }

    private VPState stateFor(double vp, long count) {
        return VPState.builder()
                .currentVp(vp)
                .vpClass(VpClass.classify(vp, convergenceThreshold, divergenceCeiling))
                .calculationCount(count)
                .proximity(proximityFor(vp))
                .updatedAt(Instant.now())
                .build();
    }
}

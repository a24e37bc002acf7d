package com.z254.butterfly.coordination.pressure;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.exception.ButterflyConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted sum of per-trait overflow ratios against a stability envelope.
 * <p>
 * A trait's ratio is its distance from the ideal center divided by the
 * envelope width, plus the same-scaled distance by which it falls outside
 * the envelope. A zero-width envelope scores 0 at the exact value and 1
 * anywhere else. Traits without an envelope are ignored.
 */
@Slf4j
public class EnvelopePressureFunction implements PressureFunction {

    private static final double EPSILON = 1e-10;

    private final Map<String, ButterflyProperties.TraitEnvelope> envelopes;

    public EnvelopePressureFunction(Map<String, ButterflyProperties.TraitEnvelope> envelopes) {
        envelopes.forEach((trait, envelope) -> ButterflyConfigurationException.require(
                envelope.getMax() >= envelope.getMin(),
                "butterfly.pressure.traits." + trait,
                "max (" + envelope.getMax() + ") must not be below min (" + envelope.getMin() + ")"));
        this.envelopes = new LinkedHashMap<>(envelopes);
    }

    @Override
    public double compute(Map<String, Double> traits) {
        double vp = 0.0;
        int scored = 0;
        for (Map.Entry<String, ButterflyProperties.TraitEnvelope> entry : envelopes.entrySet()) {
            Double actual = traits.get(entry.getKey());
            if (actual == null || actual.isNaN()) {
                continue;
            }
            ButterflyProperties.TraitEnvelope envelope = entry.getValue();
            double part = overflowRatio(actual, envelope.getCenter(), envelope.getMin(), envelope.getMax())
                    * envelope.getWeight();
            log.trace("Trait {}: overflow({}, {}, {}) = {}", entry.getKey(), actual,
                    envelope.getMin(), envelope.getMax(), part);
            vp += part;
            scored++;
        }
        return scored == 0 ? Double.NaN : vp;
    }

    static double overflowRatio(double actual, double ideal, double lo, double hi) {
        double width = hi - lo;
        if (Math.abs(width) < EPSILON) {
            return Math.abs(actual - ideal) < EPSILON ? 0.0 : 1.0;
        }
        double penalty = Math.abs(actual - ideal) / width;
        if (actual < lo) {
            penalty += (lo - actual) / width;
        } else if (actual > hi) {
            penalty += (actual - hi) / width;
        }
        return penalty;
    }

    public int traitCount() {
        return envelopes.size();
    }
}

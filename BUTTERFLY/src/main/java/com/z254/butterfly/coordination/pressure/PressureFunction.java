package com.z254.butterfly.coordination.pressure;

import java.util.Map;

/**
 * Replaceable formula turning a trait vector into a scalar pressure.
 */
@FunctionalInterface
public interface PressureFunction {

    /**
     * @return the pressure, or {@link Double#NaN} when the traits carry
     *         nothing this function can score
     */
    double compute(Map<String, Double> traits);
}

package com.z254.butterfly.coordination.breath;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.exception.ButterflyConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Central pacing signal and the only time base of the system.
 * <p>
 * The engine is advanced by a single producer. Everyone else reads the latest
 * published {@link BreathState} through {@link #current()}, which never blocks.
 * Advancing by elapsed duration rather than wall clock keeps the signal
 * reproducible for a given sequence of {@link #advance(Duration)} calls.
 */
@Slf4j
public class BreathEngine {

    private final double periodNanos;
    private final double inhaleRatio;
    private final AtomicReference<BreathState> current;

    // Guarded by this
    private double position;
    private long cycle;
    private double rate = 1.0;

    public BreathEngine(ButterflyProperties.Breath config) {
        Duration period = config.getPeriod();
        ButterflyConfigurationException.require(period != null, "butterfly.breath.period", "must be set");
        ButterflyConfigurationException.require(!period.isNegative(), "butterfly.breath.period",
                "must not be negative, was " + period);
        ButterflyConfigurationException.require(config.getInhaleRatio() > 0.0 && config.getInhaleRatio() < 1.0,
                "butterfly.breath.inhale-ratio", "must be within (0, 1), was " + config.getInhaleRatio());

        this.periodNanos = period.toNanos();
        this.inhaleRatio = config.getInhaleRatio();
        this.current = new AtomicReference<>(isFlat()
                ? BreathState.flat(0, inhaleRatio)
                : BreathState.at(0, 0.0, inhaleRatio));

        if (isFlat()) {
            log.warn("Breath period is zero; breath will stay flat (always exhale)");
        } else {
            log.info("Initialized breath engine: period={}, inhaleRatio={}", period, inhaleRatio);
        }
    }

    /**
     * Move the breath forward and publish the resulting state.
     *
     * @param elapsed time since the previous call; negative values count as zero
     * @return the newly published state
     */
    public synchronized BreathState advance(Duration elapsed) {
        if (isFlat()) {
            BreathState flat = BreathState.flat(cycle, inhaleRatio);
            current.set(flat);
            return flat;
        }

        long nanos = elapsed == null || elapsed.isNegative() ? 0L : elapsed.toNanos();
        position += rate * nanos / periodNanos;
        if (position >= 1.0) {
            long wraps = (long) Math.floor(position);
            cycle += wraps;
            position -= wraps;
            log.debug("Breath cycle completed: cycle={}", cycle);
        }

        BreathState next = BreathState.at(cycle, position, inhaleRatio);
        current.set(next);
        return next;
    }

    /**
     * Latest published state.
     */
    public BreathState current() {
        return current.get();
    }

    public boolean isInhalePhase() {
        return current.get().isInhale();
    }

    public boolean isExhalePhase() {
        return current.get().isExhale();
    }

    public double getBreathPulse() {
        return current.get().pulse();
    }

    /**
     * Scale the breathing rate. Takes effect from the next advance.
     */
    public synchronized void adjustRate(double factor) {
        if (factor <= 0.0 || Double.isNaN(factor) || Double.isInfinite(factor)) {
            log.warn("Ignoring breath rate factor {}", factor);
            return;
        }
        rate *= factor;
        log.info("Breath rate adjusted: factor={}, rate={}", factor, rate);
    }

    public synchronized double getRate() {
        return rate;
    }

    public boolean isFlat() {
        return periodNanos == 0.0;
    }
}

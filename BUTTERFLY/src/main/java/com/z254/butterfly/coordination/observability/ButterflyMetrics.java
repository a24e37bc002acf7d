package com.z254.butterfly.coordination.observability;

import com.z254.butterfly.coordination.wing.WingType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for the BUTTERFLY service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Breath (cycle gauge)</li>
 *     <li>Network wing (generations, organisms, generation latency)</li>
 *     <li>Pressure wing (calculations, VP distribution, dropped events)</li>
 *     <li>Aggregation (snapshots, unified transitions)</li>
 *     <li>Wing health (failures, availability)</li>
 * </ul>
 */
@Component
public class ButterflyMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicLong breathCycle = new AtomicLong();

    @Getter
    private final Counter generationsEvolved;
    @Getter
    private final Counter collapsesDetected;
    private final Timer generationLatency;
    private final AtomicInteger organismCount = new AtomicInteger();

    @Getter
    private final Counter vpCalculations;
    @Getter
    private final Counter pressureEventsDropped;
    private final DistributionSummary vpValues;

    @Getter
    private final Counter snapshotsTaken;
    @Getter
    private final Counter transitionsTriggered;

    private final Map<WingType, Counter> wingFailures = new EnumMap<>(WingType.class);
    private final Map<WingType, AtomicInteger> wingAvailable = new EnumMap<>(WingType.class);

    public ButterflyMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("butterfly.breath.cycle", breathCycle);

        this.generationsEvolved = Counter.builder("butterfly.network.generations")
                .description("Generations evolved by the network wing")
                .register(meterRegistry);
        this.collapsesDetected = Counter.builder("butterfly.network.collapses")
                .description("Network collapses detected")
                .register(meterRegistry);
        this.generationLatency = Timer.builder("butterfly.network.generation.latency")
                .description("Time to evolve and analyze one generation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        meterRegistry.gauge("butterfly.network.organisms", organismCount);

        this.vpCalculations = Counter.builder("butterfly.pressure.calculations")
                .description("Violation-pressure calculations")
                .register(meterRegistry);
        this.pressureEventsDropped = Counter.builder("butterfly.pressure.events.dropped")
                .description("Trait events rejected because the pending queue was full")
                .register(meterRegistry);
        this.vpValues = DistributionSummary.builder("butterfly.pressure.vp")
                .description("Violation-pressure values")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        this.snapshotsTaken = Counter.builder("butterfly.aggregator.snapshots")
                .description("Butterfly state snapshots assembled")
                .register(meterRegistry);
        this.transitionsTriggered = Counter.builder("butterfly.aggregator.transitions")
                .description("Unified transitions triggered")
                .register(meterRegistry);

        for (WingType wing : WingType.values()) {
            wingFailures.put(wing, Counter.builder("butterfly.wing.failures")
                    .tag("wing", wing.getTag())
                    .description("Wing advance iterations that failed")
                    .register(meterRegistry));
            wingAvailable.put(wing, meterRegistry.gauge("butterfly.wing.available",
                    List.of(Tag.of("wing", wing.getTag())),
                    new AtomicInteger(0)));
        }
    }

    // ========== Breath ==========

    public void recordBreathCycle(long cycle) {
        breathCycle.set(cycle);
    }

    // ========== Network Wing ==========

    public Timer.Sample startGenerationTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordGeneration(Timer.Sample sample, int organisms) {
        sample.stop(generationLatency);
        generationsEvolved.increment();
        organismCount.set(organisms);
    }

    public void recordCollapse() {
        collapsesDetected.increment();
    }

    // ========== Pressure Wing ==========

    public void recordVpCalculation(double vp) {
        vpCalculations.increment();
        if (!Double.isNaN(vp) && !Double.isInfinite(vp)) {
            vpValues.record(vp);
        }
    }

    public void recordPressureEventDropped() {
        pressureEventsDropped.increment();
    }

    // ========== Aggregation ==========

    public void recordSnapshot() {
        snapshotsTaken.increment();
    }

    public void recordTransitionTriggered() {
        transitionsTriggered.increment();
    }

    // ========== Wing Health ==========

    public void recordWingFailure(WingType wing) {
        wingFailures.get(wing).increment();
    }

    public void recordWingAvailability(WingType wing, boolean available) {
        wingAvailable.get(wing).set(available ? 1 : 0);
    }

    public double wingFailureCount(WingType wing) {
        return wingFailures.get(wing).count();
    }
}

package com.z254.butterfly.coordination.observability;

import com.z254.butterfly.coordination.wing.WingType;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ButterflyMetricsTest {

    private SimpleMeterRegistry registry;
    private ButterflyMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ButterflyMetrics(registry);
    }

    @Test
    void generationRecordsLatencyCountAndPopulation() {
        Timer.Sample sample = metrics.startGenerationTimer();
        metrics.recordGeneration(sample, 42);

        assertThat(metrics.getGenerationsEvolved().count()).isEqualTo(1.0);
        assertThat(registry.get("butterfly.network.generation.latency").timer().count()).isEqualTo(1);
        assertThat(registry.get("butterfly.network.organisms").gauge().value()).isEqualTo(42.0);
    }

    @Test
    void unscorablePressureIsCountedButNotDistributed() {
        metrics.recordVpCalculation(0.3);
        metrics.recordVpCalculation(Double.NaN);

        assertThat(metrics.getVpCalculations().count()).isEqualTo(2.0);
        assertThat(registry.get("butterfly.pressure.vp").summary().count()).isEqualTo(1);
    }

    @Test
    void wingHealthIsTaggedPerWing() {
        metrics.recordWingFailure(WingType.PRESSURE);
        metrics.recordWingAvailability(WingType.NETWORK, true);

        assertThat(metrics.wingFailureCount(WingType.PRESSURE)).isEqualTo(1.0);
        assertThat(metrics.wingFailureCount(WingType.NETWORK)).isZero();
        assertThat(registry.get("butterfly.wing.available").tag("wing", "network").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("butterfly.wing.available").tag("wing", "pressure").gauge().value()).isZero();
    }

    @Test
    void breathCycleGaugeFollowsTheLatestCycle() {
        metrics.recordBreathCycle(7);

        assertThat(registry.get("butterfly.breath.cycle").gauge().value()).isEqualTo(7.0);
    }
}

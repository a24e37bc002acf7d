package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.network.NetworkEvolutionEngine;
import com.z254.butterfly.coordination.network.NetworkMetrics;
import com.z254.butterfly.coordination.network.PostCollapsePolicy;
import com.z254.butterfly.coordination.network.SymbioticEvolutionStrategy;
import com.z254.butterfly.coordination.network.TopologyAnalyzer;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.WingEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NetworkWingAdapterTest {

    private static final TopologyAnalyzer COLLAPSE_READY_TOPOLOGY = (generation, graph) -> NetworkMetrics.builder()
            .generation(generation)
            .organismCount(graph.organismCount())
            .connectionCount(graph.connectionCount())
            .clusteringCoefficient(0.6)
            .modularity(0.2)
            .averagePathLength(2.5)
            .build();

    @Mock
    private ButterflyStructuredLogger structuredLogger;

    private ButterflyMetrics metrics;
    private StateBoard board;

    @BeforeEach
    void setUp() {
        metrics = new ButterflyMetrics(new SimpleMeterRegistry());
        board = new StateBoard(BreathState.at(0, 0.0, 0.5));
    }

    /** Collapses at generation 5: 10 organisms plus 8 per generation reach 50. */
    private NetworkWingAdapter adapter(PostCollapsePolicy policy) {
        ButterflyProperties.Network config = new ButterflyProperties.Network();
        config.setMaxOrganisms(60);
        config.setCollapseThreshold(50);
        config.setPostCollapsePolicy(policy);
        NetworkEvolutionEngine engine = new NetworkEvolutionEngine(config,
                new SymbioticEvolutionStrategy(config), COLLAPSE_READY_TOPOLOGY);
        return new NetworkWingAdapter(engine, board, metrics, structuredLogger);
    }

    @Test
    void publishesInitialStateOnConstruction() {
        adapter(PostCollapsePolicy.FREEZE);

        WingState state = board.wing(WingType.NETWORK);
        assertThat(state.isAvailable()).isTrue();
        assertThat(state.getPhase()).isEqualTo(WingPhase.CHAOS);
        assertThat(state.getGeneration()).isZero();
        assertThat(state.getOrganismCount()).isEqualTo(10);
        assertThat(state.getSequence()).isEqualTo(1);
    }

    @Test
    void reportsFractionOfSatisfiedConditionsBeforeCollapse() {
        NetworkWingAdapter adapter = adapter(PostCollapsePolicy.FREEZE);

        assertThat(adapter.advanceIfReady()).isTrue();

        WingState state = adapter.currentState();
        assertThat(state.getProximity()).isEqualTo(0.75);
        assertThat(state.getConditionsSatisfied()).isEqualTo(3);
        assertThat(state.getGeneration()).isEqualTo(1);
        assertThat(state.getOrganismCount()).isEqualTo(18);
        assertThat(state.getReadyStreak()).isZero();
        assertThat(adapter.proximityToTransition()).isEqualTo(0.75);
    }

    @Test
    void freezesAfterCollapse() {
        NetworkWingAdapter adapter = adapter(PostCollapsePolicy.FREEZE);

        int advances = 0;
        while (adapter.advanceIfReady()) {
            advances++;
        }

        WingState state = adapter.currentState();
        assertThat(advances).isEqualTo(5);
        assertThat(adapter.isFrozen()).isTrue();
        assertThat(state.isFrozen()).isTrue();
        assertThat(state.getPhase()).isEqualTo(WingPhase.PRECISION);
        assertThat(state.getProximity()).isEqualTo(1.0);
        assertThat(state.getGeneration()).isEqualTo(5);
        assertThat(state.isReady(1)).isTrue();
        assertThat(state.getReadyStreak()).isEqualTo(2);

        assertThat(adapter.advanceIfReady()).isFalse();
        assertThat(adapter.currentState().getGeneration()).isEqualTo(5);
        assertThat(adapter.currentState().getReadyStreak()).isEqualTo(3);
        assertThat(adapter.currentState().isReady(3)).isTrue();
        assertThat(adapter.diagnostics().getCollapsedAtGeneration()).isEqualTo(5L);
        assertThat(metrics.getCollapsesDetected().count()).isEqualTo(1.0);
        assertThat(metrics.getGenerationsEvolved().count()).isEqualTo(5.0);
        verify(structuredLogger).logGeneration(eq(5L), eq(WingEventType.COLLAPSE_DETECTED), anyString(), anyMap());
        verify(structuredLogger).logGeneration(eq(5L), eq(WingEventType.FROZEN), anyString(), anyMap());
    }

    @Test
    void continuesPastCollapseWhenConfigured() {
        NetworkWingAdapter adapter = adapter(PostCollapsePolicy.CONTINUE);

        for (int i = 0; i < 8; i++) {
            assertThat(adapter.advanceIfReady()).isTrue();
        }

        WingState state = adapter.currentState();
        assertThat(adapter.isFrozen()).isFalse();
        assertThat(state.getGeneration()).isEqualTo(8);
        assertThat(state.getOrganismCount()).isEqualTo(60);
        assertThat(state.getReadyStreak()).isEqualTo(4);
        assertThat(metrics.getCollapsesDetected().count()).isEqualTo(1.0);
        verify(structuredLogger, times(1))
                .logGeneration(eq(5L), eq(WingEventType.COLLAPSE_DETECTED), anyString(), anyMap());
    }

    @Test
    void conditionChangesAreLogged() {
        NetworkWingAdapter adapter = adapter(PostCollapsePolicy.FREEZE);

        adapter.advanceIfReady();

        verify(structuredLogger, times(3))
                .logGeneration(eq(1L), eq(WingEventType.CONDITION_MET), anyString(), anyMap());
    }

    @Test
    void flapIntensityIsPulseTimesProximity() {
        NetworkWingAdapter adapter = adapter(PostCollapsePolicy.FREEZE);
        adapter.advanceIfReady();

        BreathState midInhale = BreathState.at(0, 0.25, 0.5);
        BreathState turningPoint = BreathState.at(0, 0.5, 0.5);

        assertThat(adapter.sample(midInhale)).isCloseTo(0.75, within(1e-9));
        assertThat(adapter.sample(turningPoint)).isCloseTo(0.0, within(1e-9));
        assertThat(adapter.sample(BreathState.flat(0, 0.5))).isZero();
    }

    @Test
    void unavailableWingHasNoFlapIntensity() {
        BreathState midInhale = BreathState.at(0, 0.25, 0.5);

        assertThat(AbstractWingAdapter.flapIntensity(midInhale, WingState.unavailable(WingType.NETWORK))).isZero();
    }
}

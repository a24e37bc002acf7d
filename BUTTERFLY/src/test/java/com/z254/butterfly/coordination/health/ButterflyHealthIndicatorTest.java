package com.z254.butterfly.coordination.health;

import com.z254.butterfly.coordination.aggregator.StateAggregator;
import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.wing.WingPhase;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingSupervisor;
import com.z254.butterfly.coordination.wing.WingType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ButterflyHealthIndicatorTest {

    private StateBoard board;
    private WingSupervisor supervisor;
    private StateAggregator aggregator;
    private ButterflyHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        board = new StateBoard(BreathState.at(3, 0.5, 0.5));
        supervisor = mock(WingSupervisor.class);
        aggregator = mock(StateAggregator.class);
        when(aggregator.getTransition()).thenReturn(Optional.empty());
        indicator = new ButterflyHealthIndicator(board, supervisor, aggregator);
    }

    @Test
    void upWhenBothWingsAvailable() {
        board.publishWing(available(WingType.NETWORK));
        board.publishWing(available(WingType.PRESSURE));
        when(supervisor.isRunning(WingType.NETWORK)).thenReturn(true);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("breath.cycle", 3L)
                            .containsEntry("network.running", true)
                            .containsEntry("pressure.running", false)
                            .containsEntry("transition.triggered", false);
                })
                .verifyComplete();
    }

    @Test
    void degradedWhenOneWingUnavailable() {
        board.publishWing(available(WingType.NETWORK));
        board.publishWing(WingState.unavailable(WingType.PRESSURE));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
                    assertThat(health.getDetails())
                            .containsEntry("pressure.available", false)
                            .containsEntry("pressure.phase", "UNAVAILABLE");
                })
                .verifyComplete();
    }

    @Test
    void downWhenNoWingAvailable() {
        board.publishWing(WingState.unavailable(WingType.NETWORK));
        board.publishWing(WingState.unavailable(WingType.PRESSURE));

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    private static WingState available(WingType wing) {
        return WingState.builder()
                .wing(wing)
                .available(true)
                .phase(WingPhase.CHAOS)
                .proximity(0.5)
                .updatedAt(Instant.now())
                .build();
    }
}

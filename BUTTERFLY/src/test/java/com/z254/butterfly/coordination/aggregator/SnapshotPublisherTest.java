package com.z254.butterfly.coordination.aggregator;

import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.wing.WingPhase;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class SnapshotPublisherTest {

    @Mock
    private ButterflyStructuredLogger structuredLogger;

    private StateBoard board;
    private SnapshotPublisher publisher;

    @BeforeEach
    void setUp() {
        board = new StateBoard(BreathState.at(0, 0.0, 0.5));
        StateAggregator aggregator = new StateAggregator(board, 1,
                new ButterflyMetrics(new SimpleMeterRegistry()), structuredLogger);
        publisher = new SnapshotPublisher(aggregator, new InMemorySnapshotRepository(3));
    }

    @Test
    void subscribersReceiveEachPass() {
        StepVerifier.create(publisher.stream().take(2))
                .then(publisher::publish)
                .assertNext(state -> assertThat(state.isUnifiedTransitionReady()).isFalse())
                .then(() -> {
                    board.publishWing(WingState.builder()
                            .wing(WingType.PRESSURE)
                            .available(true)
                            .phase(WingPhase.PRECISION)
                            .proximity(1.0)
                            .readyStreak(1)
                            .build());
                    publisher.publish();
                })
                .assertNext(state -> assertThat(state.isUnifiedTransitionReady()).isTrue())
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void lateSubscriberStartsFromTheLatestSnapshot() {
        publisher.publish();
        board.publishBreath(BreathState.at(0, 0.1, 0.5));
        publisher.publish();

        StepVerifier.create(publisher.stream().take(1))
                .assertNext(state -> assertThat(state.getVersion()).isEqualTo(1L))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < 5; i++) {
            board.publishBreath(BreathState.at(i, 0.0, 0.5));
            publisher.publish();
        }

        assertThat(publisher.history(10)).hasSize(3)
                .extracting(state -> state.getBreath().getCycle())
                .containsExactly(2L, 3L, 4L);
        assertThat(publisher.history(1)).hasSize(1);
    }
}

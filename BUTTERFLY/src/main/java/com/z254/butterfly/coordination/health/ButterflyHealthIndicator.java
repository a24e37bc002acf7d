package com.z254.butterfly.coordination.health;

import com.z254.butterfly.coordination.aggregator.StateAggregator;
import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingSupervisor;
import com.z254.butterfly.coordination.wing.WingType;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for BUTTERFLY.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Breath cycle</li>
 *     <li>Per-wing availability and driver state</li>
 *     <li>Unified transition status</li>
 * </ul>
 * A single unavailable wing is degraded, not down; the service is down only
 * when neither wing is available.
 */
@Component
public class ButterflyHealthIndicator implements ReactiveHealthIndicator {

    private final StateBoard board;
    private final WingSupervisor supervisor;
    private final StateAggregator aggregator;

    public ButterflyHealthIndicator(StateBoard board, WingSupervisor supervisor, StateAggregator aggregator) {
        this.board = board;
        this.supervisor = supervisor;
        this.aggregator = aggregator;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        StateBoard.Board current = board.current();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("breath.cycle", current.getBreath().getCycle());
        details.put("breath.flat", current.getBreath().isFlat());

        int available = 0;
        for (WingType wing : WingType.values()) {
            WingState state = current.wing(wing);
            details.put(wing.getTag() + ".available", state.isAvailable());
            details.put(wing.getTag() + ".running", supervisor.isRunning(wing));
            details.put(wing.getTag() + ".phase", state.getPhase().name());
            details.put(wing.getTag() + ".proximity", state.getProximity());
            if (state.isAvailable()) {
                available++;
            }
        }

        details.put("transition.triggered", aggregator.getTransition().isPresent());
        aggregator.getTransition().ifPresent(event -> details.put("transition.at", event.getTriggeredAt().toString()));

        if (available == 0) {
            return Health.down().withDetails(details).build();
        }
        if (available < WingType.values().length) {
            return Health.status("DEGRADED").withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}

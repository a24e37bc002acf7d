package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.WingEventType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The wings that initialized successfully. A wing missing from the registry
 * is reported on the board with the unavailable sentinel.
 */
public class WingRegistry {

    private final StateBoard board;
    private final ButterflyMetrics metrics;
    private final ButterflyStructuredLogger structuredLogger;
    private final Map<WingType, ReactiveSubsystemAdapter> adapters = new EnumMap<>(WingType.class);

    public WingRegistry(StateBoard board, ButterflyMetrics metrics, ButterflyStructuredLogger structuredLogger) {
        this.board = board;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public synchronized void register(ReactiveSubsystemAdapter adapter) {
        adapters.put(adapter.wing(), adapter);
    }

    /**
     * Record that a wing could not be brought up.
     */
    public synchronized void markUnavailable(WingType wing, String reason) {
        adapters.remove(wing);
        board.publishWing(WingState.unavailable(wing));
        metrics.recordWingAvailability(wing, false);
        structuredLogger.logWingEvent(wing, WingEventType.UNAVAILABLE, "Wing unavailable",
                Map.of("reason", String.valueOf(reason)));
    }

    public synchronized Optional<ReactiveSubsystemAdapter> get(WingType wing) {
        return Optional.ofNullable(adapters.get(wing));
    }

    public synchronized boolean isAvailable(WingType wing) {
        return adapters.containsKey(wing);
    }

    public Optional<NetworkWingAdapter> network() {
        return get(WingType.NETWORK).filter(NetworkWingAdapter.class::isInstance).map(NetworkWingAdapter.class::cast);
    }

    public Optional<PressureWingAdapter> pressure() {
        return get(WingType.PRESSURE).filter(PressureWingAdapter.class::isInstance).map(PressureWingAdapter.class::cast);
    }

    public synchronized List<ReactiveSubsystemAdapter> all() {
        return List.copyOf(adapters.values());
    }
}

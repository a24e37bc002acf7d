package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.WingEventType;
import com.z254.butterfly.coordination.pressure.VPState;
import com.z254.butterfly.coordination.pressure.ViolationPressureMonitor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Pressure wing: feeds delivered trait events to the monitor, one event per
 * advance. Delivery never blocks; when the pending queue is full the event
 * is dropped and counted.
 */
@Slf4j
public class PressureWingAdapter extends AbstractWingAdapter {

    private final ViolationPressureMonitor monitor;
    private final BlockingQueue<Map<String, Double>> pending;

    public PressureWingAdapter(ViolationPressureMonitor monitor,
                               int maxPendingEvents,
                               StateBoard board,
                               ButterflyMetrics metrics,
                               ButterflyStructuredLogger structuredLogger) {
        super(board, metrics, structuredLogger);
        this.monitor = monitor;
        this.pending = new ArrayBlockingQueue<>(maxPendingEvents);

        publish(stateFrom(monitor.current()));
        metrics.recordWingAvailability(WingType.PRESSURE, true);
    }

    @Override
    public WingType wing() {
        return WingType.PRESSURE;
    }

    /**
     * Queue a trait vector for the monitor.
     *
     * @return false if the event was dropped because the queue is full
     */
    public boolean deliver(Map<String, Double> traits) {
        Map<String, Double> event = new LinkedHashMap<>();
        if (traits != null) {
            traits.forEach((name, value) -> {
                if (name != null && value != null) {
                    event.put(name, value);
                }
            });
        }
        if (pending.offer(event)) {
            return true;
        }
        metrics.recordPressureEventDropped();
        structuredLogger.logWingEvent(WingType.PRESSURE, WingEventType.EVENT_DROPPED,
                "Trait event dropped, pending queue full", Map.of("pending", pending.size()));
        return false;
    }

    /**
     * Score the oldest pending event, if any.
     */
    @Override
    public boolean advanceIfReady() {
        Map<String, Double> traits = pending.poll();
        if (traits == null) {
            return false;
        }

        boolean wasConverged = currentState().getPhase() == WingPhase.PRECISION;
        VPState vpState = monitor.onEvent(traits);
        metrics.recordVpCalculation(vpState.getCurrentVp());
        publish(stateFrom(vpState));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("vp", vpState.getCurrentVp());
        details.put("vpClass", vpState.getVpClass().name());
        details.put("calculations", vpState.getCalculationCount());
        structuredLogger.logWingEvent(WingType.PRESSURE, WingEventType.VP_CLASSIFIED, "VP classified", details);
        if (vpState.isConverged() && !wasConverged) {
            structuredLogger.logWingEvent(WingType.PRESSURE, WingEventType.CONVERGED,
                    "Violation pressure converged", details);
        }
        return true;
    }

    public int pendingEvents() {
        return pending.size();
    }

    public VPState vpState() {
        return monitor.current();
    }

    private WingState.WingStateBuilder stateFrom(VPState vpState) {
        return WingState.builder()
                .phase(vpState.isConverged() ? WingPhase.PRECISION : WingPhase.CHAOS)
                .proximity(vpState.getProximity())
                .currentVp(vpState.getCurrentVp())
                .vpClass(vpState.getVpClass())
                .calculationCount(vpState.getCalculationCount());
    }
}

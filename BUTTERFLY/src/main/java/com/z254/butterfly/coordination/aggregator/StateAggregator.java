package com.z254.butterfly.coordination.aggregator;

import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.TransitionEventType;
import com.z254.butterfly.coordination.wing.AbstractWingAdapter;
import com.z254.butterfly.coordination.wing.WingPhase;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Composes breath and both wings into one {@link ButterflyState}.
 * <p>
 * A snapshot reads a single board version, so it never mixes component
 * states from different instants and never waits on a producer. The unified
 * transition is ready when any available wing has held full proximity for
 * the configured number of consecutive updates. The first ready snapshot
 * latches a {@link TransitionEvent} and notifies the transition listeners
 * exactly once.
 */
@Slf4j
public class StateAggregator {

    private final StateBoard board;
    private final int readinessHoldSamples;
    private final ButterflyMetrics metrics;
    private final ButterflyStructuredLogger structuredLogger;

    private final AtomicReference<TransitionEvent> transition = new AtomicReference<>();
    private final List<Consumer<TransitionEvent>> transitionListeners = new CopyOnWriteArrayList<>();

    public StateAggregator(StateBoard board,
                           int readinessHoldSamples,
                           ButterflyMetrics metrics,
                           ButterflyStructuredLogger structuredLogger) {
        this.board = board;
        this.readinessHoldSamples = Math.max(1, readinessHoldSamples);
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Assemble a consistent snapshot of the latest published states.
     */
    public ButterflyState snapshot() {
        StateBoard.Board current = board.current();
        BreathState breath = current.getBreath();

        Set<WingType> ready = EnumSet.noneOf(WingType.class);
        for (WingType wing : WingType.values()) {
            if (current.wing(wing).isReady(readinessHoldSamples)) {
                ready.add(wing);
            }
        }
        boolean unifiedReady = !ready.isEmpty();
        if (unifiedReady && transition.get() == null) {
            latch(current, ready);
        }

        metrics.recordSnapshot();
        return ButterflyState.builder()
                .timestamp(Instant.now())
                .version(current.getVersion())
                .breath(breath)
                .bodyPhase(breath.isInhale() ? WingPhase.CHAOS : WingPhase.PRECISION)
                .networkWing(current.getNetwork())
                .pressureWing(current.getPressure())
                .networkFlapIntensity(AbstractWingAdapter.flapIntensity(breath, current.getNetwork()))
                .pressureFlapIntensity(AbstractWingAdapter.flapIntensity(breath, current.getPressure()))
                .unifiedTransitionReady(unifiedReady)
                .readyWings(Collections.unmodifiableSet(ready))
                .transitionTriggered(transition.get() != null)
                .build();
    }

    /**
     * Register a callback run once, when the transition first triggers.
     */
    public void onTransition(Consumer<TransitionEvent> listener) {
        transitionListeners.add(listener);
    }

    public Optional<TransitionEvent> getTransition() {
        return Optional.ofNullable(transition.get());
    }

    public int getReadinessHoldSamples() {
        return readinessHoldSamples;
    }

    private void latch(StateBoard.Board current, Set<WingType> ready) {
        TransitionEvent event = new TransitionEvent(Instant.now(),
                Collections.unmodifiableSet(EnumSet.copyOf(ready)),
                current.getBreath().getCycle(), current.getVersion());
        if (!transition.compareAndSet(null, event)) {
            return;
        }

        metrics.recordTransitionTriggered();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("wings", ready.toString());
        details.put("boardVersion", current.getVersion());
        for (WingType wing : ready) {
            WingState state = current.wing(wing);
            details.put(wing.getTag() + "Proximity", state.getProximity());
        }
        structuredLogger.logTransitionEvent(event.getBreathCycle(), TransitionEventType.TRIGGERED,
                "Unified transition triggered", details);

        for (Consumer<TransitionEvent> listener : transitionListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Transition listener failed", e);
            }
        }
    }
}

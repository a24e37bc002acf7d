package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger.WingEventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one wing's advancement loop on its own thread at the wing's own rhythm.
 * <p>
 * Each tick either advances once or, when {@code drain} is set, keeps
 * advancing while the adapter reports progress. A failing iteration is
 * logged and counted; the loop carries on and the wing keeps its last
 * published state.
 */
@Slf4j
public class WingDriver {

    private final ReactiveSubsystemAdapter adapter;
    private final Duration interval;
    private final boolean drain;
    private final ButterflyMetrics metrics;
    private final ButterflyStructuredLogger structuredLogger;

    private ScheduledExecutorService scheduler;

    public WingDriver(ReactiveSubsystemAdapter adapter,
                      Duration interval,
                      boolean drain,
                      ButterflyMetrics metrics,
                      ButterflyStructuredLogger structuredLogger) {
        this.adapter = adapter;
        this.interval = interval;
        this.drain = drain;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        String threadName = "butterfly-wing-" + adapter.wing().getTag();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        long millis = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::tick, 0L, millis, TimeUnit.MILLISECONDS);
        structuredLogger.logWingEvent(adapter.wing(), WingEventType.STARTED, "Wing driver started",
                Map.of("intervalMs", millis));
    }

    /**
     * Stop advancing. The wing's last state stays on the board.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        structuredLogger.logWingEvent(adapter.wing(), WingEventType.STOPPED, "Wing driver stopped", Map.of());
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    public ReactiveSubsystemAdapter getAdapter() {
        return adapter;
    }

    void tick() {
        try {
            boolean advanced = adapter.advanceIfReady();
            while (drain && advanced && !Thread.currentThread().isInterrupted()) {
                advanced = adapter.advanceIfReady();
            }
        } catch (RuntimeException e) {
            metrics.recordWingFailure(adapter.wing());
            structuredLogger.logWingEvent(adapter.wing(), WingEventType.ADVANCE_FAILED,
                    "Wing advance failed", Map.of("error", String.valueOf(e.getMessage())));
            log.debug("Wing advance failure detail", e);
        }
    }
}

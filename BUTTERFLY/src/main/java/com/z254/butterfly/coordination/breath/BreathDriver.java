package com.z254.butterfly.coordination.breath;

import com.z254.butterfly.coordination.aggregator.StateBoard;
import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single producer of the breath signal. Advances the engine by the measured
 * time between ticks and publishes each state to the board.
 */
@Slf4j
@Component
public class BreathDriver {

    private final BreathEngine engine;
    private final StateBoard board;
    private final ButterflyMetrics metrics;
    private final Duration tickInterval;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "butterfly-breath");
        thread.setDaemon(true);
        return thread;
    });

    private long lastTickNanos;

    public BreathDriver(BreathEngine engine,
                        StateBoard board,
                        ButterflyMetrics metrics,
                        ButterflyProperties properties) {
        this.engine = engine;
        this.board = board;
        this.metrics = metrics;
        this.tickInterval = properties.getBreath().getTickInterval();
    }

    @PostConstruct
    public void start() {
        lastTickNanos = System.nanoTime();
        long millis = Math.max(1L, tickInterval.toMillis());
        scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Breath driver started: tickInterval={}ms", millis);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Breath driver stopped");
    }

    void tick() {
        try {
            long now = System.nanoTime();
            BreathState state = engine.advance(Duration.ofNanos(now - lastTickNanos));
            lastTickNanos = now;
            board.publishBreath(state);
            metrics.recordBreathCycle(state.getCycle());
        } catch (RuntimeException e) {
            log.error("Breath tick failed", e);
        }
    }
}

package com.z254.butterfly.coordination.wing;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import com.z254.butterfly.coordination.observability.ButterflyMetrics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns one {@link WingDriver} per available wing.
 * <p>
 * The network wing advances one generation per interval; the pressure wing
 * drains its pending events each poll. Wings are stopped independently and
 * a stopped wing's last state remains visible to the aggregator.
 */
@Slf4j
@Component
public class WingSupervisor {

    private final Map<WingType, WingDriver> drivers = new EnumMap<>(WingType.class);

    public WingSupervisor(WingRegistry registry,
                          ButterflyProperties properties,
                          ButterflyMetrics metrics,
                          ButterflyStructuredLogger structuredLogger) {
        for (ReactiveSubsystemAdapter adapter : registry.all()) {
            Duration interval = adapter.wing() == WingType.NETWORK
                    ? properties.getNetwork().getGenerationInterval()
                    : properties.getPressure().getPollInterval();
            boolean drain = adapter.wing() == WingType.PRESSURE;
            drivers.put(adapter.wing(), new WingDriver(adapter, interval, drain, metrics, structuredLogger));
        }
    }

    @PostConstruct
    public void start() {
        drivers.values().forEach(WingDriver::start);
        log.info("Wing supervisor started: wings={}", drivers.keySet());
    }

    @PreDestroy
    public void shutdown() {
        drivers.values().forEach(WingDriver::stop);
        log.info("Wing supervisor stopped");
    }

    /**
     * Stop a single wing. Breath and the other wing keep running.
     *
     * @return false if the wing has no driver
     */
    public boolean stop(WingType wing) {
        WingDriver driver = drivers.get(wing);
        if (driver == null) {
            return false;
        }
        driver.stop();
        return true;
    }

    public boolean isRunning(WingType wing) {
        WingDriver driver = drivers.get(wing);
        return driver != null && driver.isRunning();
    }
}

package com.z254.butterfly.coordination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * BUTTERFLY - breath-paced coordination of two reactive wings.
 *
 * <p>The service runs:
 * <ul>
 *   <li>Breath Engine - the single time base (phase, depth, cycle)</li>
 *   <li>Network Wing - an evolving organism graph that watches for topology collapse</li>
 *   <li>Pressure Wing - violation-pressure classification of incoming trait vectors</li>
 *   <li>State Aggregator - consistent snapshots and the unified transition flag</li>
 * </ul>
 *
 * <p>Each producer keeps its own rhythm. Nothing waits for the breath and the
 * breath waits for nothing.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ButterflyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ButterflyApplication.class, args);
    }
}

package com.z254.butterfly.coordination.observability;

import com.z254.butterfly.coordination.wing.WingType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the BUTTERFLY service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management (wing, generation, breath cycle)</li>
 *     <li>Domain-specific logging methods for wings and transitions</li>
 * </ul>
 */
@Slf4j
@Component
public class ButterflyStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_WING = "wing";
    public static final String MDC_GENERATION = "generation";
    public static final String MDC_BREATH_CYCLE = "breathCycle";

    /**
     * Log a wing lifecycle event.
     */
    public void logWingEvent(WingType wing, WingEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_WING, wing.getTag()))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("wing", wing.getTag());
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case UNAVAILABLE, ADVANCE_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case STOPPED, EVENT_DROPPED, CONDITION_LOST ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case GENERATION_EVOLVED, VP_CLASSIFIED, CONDITION_MET ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a network generation with the generation number in MDC.
     */
    public void logGeneration(long generation, WingEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_GENERATION, String.valueOf(generation)))) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("generation", generation);
            if (details != null) {
                data.putAll(details);
            }
            logWingEvent(WingType.NETWORK, eventType, message, data);
        }
    }

    /**
     * Log a unified transition event.
     */
    public void logTransitionEvent(long breathCycle, TransitionEventType eventType, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_BREATH_CYCLE, String.valueOf(breathCycle)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("breathCycle", breathCycle);
            if (details != null) {
                logData.putAll(details);
            }
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Set correlation ID in MDC.
     */
    public MDCScope withCorrelationId(String correlationId) {
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new MDCScope(MDC_CORRELATION_ID);
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                sb.append("\"").append(d).append("\"");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum WingEventType {
        STARTED, STOPPED, UNAVAILABLE, ADVANCE_FAILED,
        GENERATION_EVOLVED, CONDITION_MET, CONDITION_LOST, COLLAPSE_DETECTED, FROZEN,
        VP_CLASSIFIED, CONVERGED, EVENT_DROPPED
    }

    public enum TransitionEventType {
        TRIGGERED, BREATH_RATE_ADJUSTED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}

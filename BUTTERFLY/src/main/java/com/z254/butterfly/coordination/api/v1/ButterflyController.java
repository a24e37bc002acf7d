package com.z254.butterfly.coordination.api.v1;

import com.z254.butterfly.coordination.aggregator.ButterflyState;
import com.z254.butterfly.coordination.aggregator.SnapshotPublisher;
import com.z254.butterfly.coordination.aggregator.StateAggregator;
import com.z254.butterfly.coordination.api.dto.TraitEventRequest;
import com.z254.butterfly.coordination.api.dto.TraitEventResponse;
import com.z254.butterfly.coordination.api.dto.WingStopResponse;
import com.z254.butterfly.coordination.network.CollapseDiagnostics;
import com.z254.butterfly.coordination.observability.ButterflyStructuredLogger;
import com.z254.butterfly.coordination.pressure.VPState;
import com.z254.butterfly.coordination.wing.PressureWingAdapter;
import com.z254.butterfly.coordination.wing.WingRegistry;
import com.z254.butterfly.coordination.wing.WingSupervisor;
import com.z254.butterfly.coordination.wing.WingType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for butterfly state, network diagnostics and the trait feed.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/butterfly")
@Tag(name = "State", description = "Snapshots and the unified transition")
public class ButterflyController {

    private final StateAggregator aggregator;
    private final SnapshotPublisher publisher;
    private final WingRegistry registry;
    private final WingSupervisor supervisor;
    private final ButterflyStructuredLogger structuredLogger;

    public ButterflyController(StateAggregator aggregator,
                               SnapshotPublisher publisher,
                               WingRegistry registry,
                               WingSupervisor supervisor,
                               ButterflyStructuredLogger structuredLogger) {
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.registry = registry;
        this.supervisor = supervisor;
        this.structuredLogger = structuredLogger;
    }

    @GetMapping("/state")
    @Operation(summary = "Current state", description = "Take a consistent snapshot of breath and both wings")
    public Mono<ButterflyState> getState() {
        return Mono.fromCallable(aggregator::snapshot);
    }

    @GetMapping(value = "/state/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream state", description = "Server-sent stream of periodic snapshots")
    public Flux<ButterflyState> streamState() {
        return publisher.stream();
    }

    @GetMapping("/state/history")
    @Operation(summary = "Snapshot history", description = "Recent snapshots, oldest first")
    public Mono<List<ButterflyState>> getHistory(
            @Parameter(description = "Maximum number of snapshots")
            @RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> publisher.history(limit));
    }

    @GetMapping("/network/diagnostics")
    @Tag(name = "Wings")
    @Operation(summary = "Collapse diagnostics",
            description = "Per-condition first-true generations and the bottleneck condition")
    public Mono<ResponseEntity<CollapseDiagnostics>> getNetworkDiagnostics() {
        return Mono.fromCallable(() -> registry.network()
                .map(network -> ResponseEntity.ok(network.diagnostics()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @PostMapping("/traits")
    @Tag(name = "Wings")
    @Operation(summary = "Deliver traits", description = "Queue a trait vector for violation-pressure scoring")
    public Mono<ResponseEntity<TraitEventResponse>> deliverTraits(@Valid @RequestBody TraitEventRequest request) {
        return Mono.fromCallable(() -> {
            String correlationId = request.getCorrelationId() != null
                    ? request.getCorrelationId()
                    : UUID.randomUUID().toString();
            try (var scope = structuredLogger.withCorrelationId(correlationId)) {
                Optional<PressureWingAdapter> pressure = registry.pressure();
                if (pressure.isEmpty()) {
                    log.warn("Trait event rejected, pressure wing unavailable");
                    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(TraitEventResponse.builder()
                                    .accepted(false)
                                    .error("Pressure wing unavailable")
                                    .build());
                }

                PressureWingAdapter adapter = pressure.get();
                boolean accepted = adapter.deliver(request.getTraits());
                VPState vpState = adapter.vpState();
                TraitEventResponse body = TraitEventResponse.builder()
                        .accepted(accepted)
                        .pendingEvents(adapter.pendingEvents())
                        .currentVp(vpState.getCurrentVp())
                        .vpClass(vpState.getVpClass().name())
                        .calculationCount(vpState.getCalculationCount())
                        .error(accepted ? null : "Pending event queue full")
                        .build();
                return accepted
                        ? ResponseEntity.status(HttpStatus.ACCEPTED).body(body)
                        : ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
            }
        });
    }

    @PostMapping("/wings/{wing}/stop")
    @Tag(name = "Wings")
    @Operation(summary = "Stop a wing", description = "Stop one wing; breath and the other wing keep running")
    public Mono<ResponseEntity<WingStopResponse>> stopWing(
            @Parameter(description = "Wing tag: network or pressure")
            @PathVariable String wing) {
        return Mono.fromCallable(() -> {
            WingType type;
            try {
                type = WingType.fromTag(wing);
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(WingStopResponse.builder()
                        .wing(wing)
                        .stopped(false)
                        .message(e.getMessage())
                        .build());
            }

            boolean stopped = supervisor.stop(type);
            log.info("Wing stop requested: wing={}, stopped={}", type.getTag(), stopped);
            return ResponseEntity.ok(WingStopResponse.builder()
                    .wing(type.getTag())
                    .stopped(stopped)
                    .message(stopped ? "Wing stopped" : "Wing has no running driver")
                    .build());
        });
    }
}

package com.z254.butterfly.coordination.aggregator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;

/**
 * Periodic aggregation pass. Each pass takes a snapshot, records it in the
 * history and pushes it to subscribers.
 */
@Slf4j
@Component
public class SnapshotPublisher {

    private final StateAggregator aggregator;
    private final SnapshotRepository repository;

    // Slow subscribers miss snapshots rather than hold up the pass
    private final Sinks.Many<ButterflyState> sink = Sinks.many().multicast().directBestEffort();

    public SnapshotPublisher(StateAggregator aggregator, SnapshotRepository repository) {
        this.aggregator = aggregator;
        this.repository = repository;
    }

    @Scheduled(fixedDelayString = "${butterfly.aggregator.interval:PT0.5S}")
    public void publish() {
        ButterflyState state = aggregator.snapshot();
        repository.save(state);
        Sinks.EmitResult result = sink.tryEmitNext(state);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to emit snapshot: version={}, result={}", state.getVersion(), result);
        }
    }

    /**
     * Latest recorded snapshot followed by every new one.
     */
    public Flux<ButterflyState> stream() {
        return Flux.concat(Mono.justOrEmpty(repository.findLatest()), sink.asFlux())
                .doOnSubscribe(s -> log.debug("Snapshot stream subscribed"))
                .doOnCancel(() -> log.debug("Snapshot stream cancelled"));
    }

    public List<ButterflyState> history(int limit) {
        return repository.findRecent(limit);
    }
}

package com.z254.butterfly.coordination.aggregator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySnapshotRepositoryTest {

    private static ButterflyState snapshot(long version) {
        return ButterflyState.builder().version(version).build();
    }

    @Test
    void evictsOldestBeyondCapacity() {
        InMemorySnapshotRepository repository = new InMemorySnapshotRepository(2);

        repository.save(snapshot(1));
        repository.save(snapshot(2));
        repository.save(snapshot(3));

        assertThat(repository.size()).isEqualTo(2);
        assertThat(repository.findRecent(5)).extracting(ButterflyState::getVersion).containsExactly(2L, 3L);
        assertThat(repository.findLatest()).map(ButterflyState::getVersion).contains(3L);
    }

    @Test
    void emptyRepositoryHasNoLatest() {
        InMemorySnapshotRepository repository = new InMemorySnapshotRepository(4);

        assertThat(repository.findLatest()).isEmpty();
        assertThat(repository.findRecent(3)).isEmpty();
        assertThat(repository.findRecent(-1)).isEmpty();
    }
}

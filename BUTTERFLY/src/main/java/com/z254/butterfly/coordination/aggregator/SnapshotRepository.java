package com.z254.butterfly.coordination.aggregator;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for recent snapshots.
 */
public interface SnapshotRepository {

    /**
     * Append a snapshot. The oldest entries are evicted beyond capacity.
     */
    ButterflyState save(ButterflyState state);

    /**
     * Most recently saved snapshot.
     */
    Optional<ButterflyState> findLatest();

    /**
     * Up to {@code limit} snapshots, oldest first.
     */
    List<ButterflyState> findRecent(int limit);

    int size();
}

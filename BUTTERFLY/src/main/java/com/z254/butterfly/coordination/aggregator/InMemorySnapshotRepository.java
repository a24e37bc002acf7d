package com.z254.butterfly.coordination.aggregator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded in-memory snapshot history.
 */
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final int capacity;
    private final Deque<ButterflyState> history = new ArrayDeque<>();

    public InMemorySnapshotRepository(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized ButterflyState save(ButterflyState state) {
        history.addLast(state);
        while (history.size() > capacity) {
            history.removeFirst();
        }
        return state;
    }

    @Override
    public synchronized Optional<ButterflyState> findLatest() {
        return Optional.ofNullable(history.peekLast());
    }

    @Override
    public synchronized List<ButterflyState> findRecent(int limit) {
        List<ButterflyState> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    @Override
    public synchronized int size() {
        return history.size();
    }
}

package com.z254.butterfly.coordination.aggregator;

import com.z254.butterfly.coordination.breath.BreathState;
import com.z254.butterfly.coordination.wing.WingState;
import com.z254.butterfly.coordination.wing.WingType;
import lombok.Value;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Versioned, read-mostly cell holding the latest breath and wing states.
 * <p>
 * Producers swap in a new immutable {@link Board} with compare-and-set; a
 * reader takes one reference and therefore sees the three component states
 * exactly as they stood at a single instant. Nobody holds a lock, so a
 * reader never stalls a producer and producers never stall each other.
 */
public class StateBoard {

    private final AtomicReference<Board> board;

    public StateBoard(BreathState initialBreath) {
        this.board = new AtomicReference<>(new Board(0L, initialBreath,
                WingState.unavailable(WingType.NETWORK),
                WingState.unavailable(WingType.PRESSURE)));
    }

    public Board publishBreath(BreathState breath) {
        return board.updateAndGet(current -> new Board(current.version + 1, breath,
                current.network, current.pressure));
    }

    public Board publishWing(WingState state) {
        return board.updateAndGet(current -> switch (state.getWing()) {
            case NETWORK -> new Board(current.version + 1, current.breath, state, current.pressure);
            case PRESSURE -> new Board(current.version + 1, current.breath, current.network, state);
        });
    }

    public Board current() {
        return board.get();
    }

    public WingState wing(WingType wing) {
        return board.get().wing(wing);
    }

    /**
     * One consistent view of all producers.
     */
    @Value
    public static class Board {
        long version;
        BreathState breath;
        WingState network;
        WingState pressure;

        public WingState wing(WingType wing) {
            return wing == WingType.NETWORK ? network : pressure;
        }
    }
}

package com.ordoAetheris.handoff;

/**
 * Occupancy of a {@link BoundedQueue}: put blocks in FULL, take blocks in EMPTY.
 */
public enum QueueState {
    EMPTY,
    PARTIAL,
    FULL;

    static QueueState of(int size, int capacity) {
        if (size == 0) return EMPTY;
        if (size == capacity) return FULL;
        return PARTIAL;
    }
}

package com.ordoAetheris.handoff;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link Pipeline} run. {@link #success()} is recomputed on every call
 * from the two immutable lists, so repeated checks always agree.
 */
public final class PipelineResult<T> {

    private final List<T> source;
    private final List<T> destination;
    private final int itemsProduced;
    private final int capacity;
    private final int highWaterMark;

    PipelineResult(List<T> source, List<T> destination, int itemsProduced, int capacity, int highWaterMark) {
        this.source = Collections.unmodifiableList(source);
        this.destination = Collections.unmodifiableList(destination);
        this.itemsProduced = itemsProduced;
        this.capacity = capacity;
        this.highWaterMark = highWaterMark;
    }

    public List<T> source() {
        return source;
    }

    public List<T> destination() {
        return destination;
    }

    public int itemsProduced() {
        return itemsProduced;
    }

    public int capacity() {
        return capacity;
    }

    /** Largest number of envelopes (end-of-stream marker included) the queue held during the run. */
    public int highWaterMark() {
        return highWaterMark;
    }

    public boolean success() {
        return source.equals(destination);
    }

    @Override
    public String toString() {
        return "Source data:      " + source + System.lineSeparator()
                + "Destination data: " + destination + System.lineSeparator()
                + "Transfer successful: " + success();
    }
}

package com.ordoAetheris.handoff;

/**
 * Queue element of the pipeline: either a data item or the end-of-stream marker.
 * The marker is told apart by its flag, never by its payload, so any T value (null included) is a legal item.
 */
public final class Envelope<T> {

    private final T value;
    private final boolean endOfStream;

    private Envelope(T value, boolean endOfStream) {
        this.value = value;
        this.endOfStream = endOfStream;
    }

    public static <T> Envelope<T> of(T value) {
        return new Envelope<>(value, false);
    }

    public static <T> Envelope<T> endOfStream() {
        return new Envelope<>(null, true);
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }

    public T value() {
        if (endOfStream) throw new IllegalStateException("end-of-stream marker carries no value");
        return value;
    }

    @Override
    public String toString() {
        return endOfStream ? "Envelope[EOS]" : "Envelope[" + value + "]";
    }
}

package com.ordoAetheris.handoff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Pushes every source item into the queue in order, then exactly one end-of-stream marker.
 * Issues no queue operation after the marker. Returns the number of data items sent.
 */
public class Producer<T> implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    /** put() slower than this is reported as backpressure. */
    static final long BLOCKED_PUT_REPORT_MICROS = 200;

    private final List<T> source;
    private final BoundedQueue<Envelope<T>> queue;
    private int produced;

    public Producer(List<T> source, BoundedQueue<Envelope<T>> queue) {
        this.source = source;
        this.queue = queue;
    }

    @Override
    public Integer call() throws InterruptedException {
        produced = 0;
        for (T item : source) {
            Instant t0 = Instant.now();
            queue.put(Envelope.of(item)); // <-- backpressure shows up here
            long blockedMicros = Duration.between(t0, Instant.now()).toNanos() / 1_000;
            produced++;

            if (blockedMicros > BLOCKED_PUT_REPORT_MICROS) {
                log.debug("put blocked ~{}µs (queue likely full), produced={}", blockedMicros, produced);
            }
        }
        queue.put(Envelope.endOfStream());
        log.debug("source exhausted after {} items, end-of-stream sent", produced);
        return produced;
    }

    /** Data items sent by the last {@link #call()}; the end-of-stream marker is not counted. */
    public int produced() {
        return produced;
    }
}

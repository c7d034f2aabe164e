package com.ordoAetheris.handoff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Takes from the queue until the end-of-stream marker and collects the payloads in received order.
 * The marker itself is never collected and nothing is taken after it.
 */
public class Consumer<T> implements Callable<List<T>> {

    private static final Logger log = LoggerFactory.getLogger(Consumer.class);

    private final BoundedQueue<Envelope<T>> queue;
    private final List<T> destination = new ArrayList<>();

    public Consumer(BoundedQueue<Envelope<T>> queue) {
        this.queue = queue;
    }

    @Override
    public List<T> call() throws InterruptedException {
        while (true) {
            Envelope<T> next = queue.take();
            if (next.isEndOfStream()) {
                // EOF: producer is done, consumer exits
                log.debug("end-of-stream received after {} items", destination.size());
                return destination;
            }
            destination.add(next.value());
        }
    }

    public List<T> destination() {
        return destination;
    }
}

package com.ordoAetheris.handoff;

import com.ordoAetheris.handoff.config.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 Single producer / single consumer run over one BoundedQueue.

 Roles:
 - Producer: reads the source in order, put() each item, then put(EOS) exactly once
 - Queue(capacity): the only shared mutable state, backpressure on both ends
 - Consumer: take() until EOS, collects payloads into its own destination list

 The run is complete when both tasks have terminated. Result is verified by
 PipelineResult.success(): destination equals source in content and order.
 Capacity is validated before any thread is started.
 */
public final class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    static final String PRODUCER_THREAD = "handoff-producer";
    static final String CONSUMER_THREAD = "handoff-consumer";

    private Pipeline() {}

    public static <T> PipelineResult<T> run(List<T> source, PipelineSettings settings) throws InterruptedException {
        return run(source, settings.capacity());
    }

    public static <T> PipelineResult<T> run(List<T> source, int capacity) throws InterruptedException {
        // fails fast, nothing started yet
        BoundedQueue<Envelope<T>> queue = new BoundedQueue<>(capacity);
        List<T> input = Collections.unmodifiableList(new ArrayList<>(source));

        Producer<T> producer = new Producer<>(input, queue);
        Consumer<T> consumer = new Consumer<>(queue);

        log.info("pipeline start: items={}, capacity={}", input.size(), capacity);

        ExecutorService pool = Executors.newFixedThreadPool(2, new RoleThreadFactory());
        CompletionService<Void> completion = new ExecutorCompletionService<>(pool);
        CountDownLatch start = new CountDownLatch(1);

        try {
            Future<Void> prod = completion.submit(gated(start, producer));
            completion.submit(gated(start, consumer));

            start.countDown();

            // first failure stops the other side
            for (int i = 0; i < 2; i++) {
                Future<Void> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    pool.shutdownNow();
                    String role = done == prod ? "producer" : "consumer";
                    throw new PipelineException(role + " failed", e.getCause());
                }
            }

            // both tasks done
            int produced = producer.produced();
            List<T> destination = consumer.destination();

            PipelineResult<T> result = new PipelineResult<>(input, destination, produced, capacity, queue.highWaterMark());
            if (result.success()) {
                log.info("pipeline done: transferred={}, highWaterMark={}", destination.size(), result.highWaterMark());
            } else {
                log.warn("pipeline verification failed: source={}, destination={}", input, destination);
            }
            return result;
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    private static Callable<Void> gated(CountDownLatch start, Callable<?> task) {
        return () -> {
            start.await();
            task.call();
            return null;
        };
    }

    private static final class RoleThreadFactory implements ThreadFactory {
        private int next = 0;

        @Override
        public synchronized Thread newThread(Runnable r) {
            Thread t = new Thread(r, next++ == 0 ? PRODUCER_THREAD : CONSUMER_THREAD);
            t.setDaemon(true);
            return t;
        }
    }
}

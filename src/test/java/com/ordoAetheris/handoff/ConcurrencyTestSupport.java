package com.ordoAetheris.handoff;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;

/**
 * Shared helpers for the race-hunting tests: jitter, bounded waits with a thread dump on timeout.
 */
final class ConcurrencyTestSupport {

    private ConcurrencyTestSupport() {}

    static void microJitter() {
        // 1/64 chance, up to 50µs
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        if ((rnd.nextInt() & 63) != 0) return;
        LockSupport.parkNanos(rnd.nextInt(50_000));
    }

    /** Gives a thread that is about to block a chance to actually park. */
    static void settle() {
        LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(50));
    }

    static <T> T getOrDump(Future<T> f, int sec, ExecutorService pool, String tag) throws Exception {
        try {
            return f.get(sec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            System.err.println("=== TIMEOUT [" + tag + "] thread dump ===");
            dumpThreads();
            pool.shutdownNow();
            throw new AssertionError("Timeout: " + tag, e);
        }
    }

    static void dumpThreads() {
        ThreadMXBean mx = ManagementFactory.getThreadMXBean();
        ThreadInfo[] infos = mx.dumpAllThreads(true, true);
        for (ThreadInfo ti : infos) {
            System.err.println(ti.toString());
        }
        long[] dead = mx.findDeadlockedThreads();
        if (dead != null && dead.length > 0) {
            System.err.println("=== DEADLOCK DETECTED ===");
            ThreadInfo[] di = mx.getThreadInfo(dead, true, true);
            for (ThreadInfo ti : di) System.err.println(ti.toString());
        }
    }

    static void await(CountDownLatch latch) {
        try { latch.await(); } catch (InterruptedException e) { throw new RuntimeException(e); }
    }

    static void call(ThrowingRunnable r) {
        try { r.run(); } catch (Exception e) { throw new RuntimeException(e); }
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}

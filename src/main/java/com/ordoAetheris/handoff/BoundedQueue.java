package com.ordoAetheris.handoff;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 Bounded Buffer for a single producer / single consumer handoff.

 Main idea: backpressure.
 If the producer is faster than the consumer the buffer does not grow,
 put() blocks until the consumer frees a slot. If the consumer is faster,
 take() blocks until the producer delivers.

 Class: BoundedQueue<T>

 Built from: a non-thread-safe ArrayDeque, one ReentrantLock, two Conditions.
 Methods
 void put(T item) throws InterruptedException
 item == null → IllegalArgumentException
 queue full → waits on notFull until a take() frees a slot
 after the append → wakes the waiter on notEmpty

 T take() throws InterruptedException
 queue empty → waits on notEmpty until a put() arrives
 otherwise removes the head and wakes the waiter on notFull

 State machine: EMPTY → PARTIAL/FULL on put, FULL/PARTIAL → PARTIAL/EMPTY on take.
 put blocks only in FULL, take blocks only in EMPTY.

 Invariants
 no lost items
 no duplicate items
 FIFO: take() order == put() order
 size in 0..capacity at every instant
 */
public class BoundedQueue<T> {

    private final Queue<T> queue;
    private final int capacity;
    private int highWaterMark = 0;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    public BoundedQueue(int capacity) {
        if (capacity < 1) throw new InvalidConfigurationException("capacity must be >= 1, got " + capacity);
        this.queue = new ArrayDeque<>(capacity);
        this.capacity = capacity;
    }

    public void put(T element) throws InterruptedException {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        lock.lockInterruptibly();
        try {
            while (queue.size() == capacity) notFull.await();
            queue.offer(element);
            if (queue.size() > highWaterMark) highWaterMark = queue.size();
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) notEmpty.await();
            T result = queue.poll();
            notFull.signal();
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int capacity() {
        return capacity;
    }

    public QueueState state() {
        return QueueState.of(size(), capacity);
    }

    /**
     * Largest size this queue has ever held. Never exceeds {@link #capacity()}.
     */
    public int highWaterMark() {
        lock.lock();
        try {
            return highWaterMark;
        } finally {
            lock.unlock();
        }
    }
}

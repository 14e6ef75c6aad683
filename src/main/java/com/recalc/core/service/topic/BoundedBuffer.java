package com.recalc.core.service.topic;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO buffer with a drop-oldest overflow policy.
 *
 * Offers never block: when the buffer is full the oldest element is evicted to
 * make room, and the eviction is counted. Consumers poll with a timeout so
 * their loops stay responsive to cancellation.
 *
 * @param <T> element type
 */
@Slf4j
public class BoundedBuffer<T> {

    private static final int DROP_LOG_EVERY = 100;

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    public BoundedBuffer(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Appends an element, evicting the oldest queued element if the buffer is full.
     *
     * @param element the element to append
     * @return true if an older element was evicted
     */
    public synchronized boolean offer(T element) {
        boolean evicted = false;
        while (!queue.offer(element)) {
            if (queue.poll() != null) {
                evicted = true;
                long total = dropped.incrementAndGet();
                if (total == 1 || total % DROP_LOG_EVERY == 0) {
                    log.warn("Buffer {} full (capacity {}), dropped oldest element; {} dropped so far",
                            name, capacity, total);
                }
            }
        }
        return evicted;
    }

    /**
     * Waits up to {@code timeoutMs} for the next element.
     *
     * @return the element, or empty on timeout or interruption
     */
    public Optional<T> poll(long timeoutMs) {
        try {
            return Optional.ofNullable(queue.poll(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while polling buffer {}", name);
            return Optional.empty();
        }
    }

    public String getName() {
        return name;
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getUtilizationPercent() {
        return (size() * 100) / capacity;
    }

    public void clear() {
        queue.clear();
    }
}

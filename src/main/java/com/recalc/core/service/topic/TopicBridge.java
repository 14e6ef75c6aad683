package com.recalc.core.service.topic;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Taps a {@link ChangeFeed} and republishes its elements into a {@link Topic}.
 *
 * Feed callbacks land in a bounded buffer so the feed thread is never held up;
 * a pump loop, run as a supervised task, moves buffered elements into the topic.
 */
@Slf4j
public class TopicBridge<T> implements AutoCloseable {

    private final ChangeFeed<T> feed;
    private final Topic<T> topic;
    private final BoundedBuffer<T> buffer;
    private final AtomicReference<ChangeFeed.Registration> registration = new AtomicReference<>();

    public TopicBridge(ChangeFeed<T> feed, Topic<T> topic, int backlogSize) {
        this.feed = feed;
        this.topic = topic;
        this.buffer = new BoundedBuffer<>(topic.getName() + "-bridge", backlogSize);
    }

    /**
     * Starts listening to the feed. Idempotent.
     */
    public void start() {
        if (registration.get() != null) {
            return;
        }
        ChangeFeed.Registration reg = feed.listen(buffer::offer);
        if (!registration.compareAndSet(null, reg)) {
            reg.close();
            return;
        }
        log.info("Bridge started for topic {} (backlog {})", topic.getName(), buffer.getCapacity());
    }

    /**
     * Moves buffered elements into the topic until {@code cancelled} reports true.
     */
    public void pump(BooleanSupplier cancelled, long pollTimeoutMs) {
        while (!cancelled.getAsBoolean()) {
            buffer.poll(pollTimeoutMs).ifPresent(topic::publish);
        }
    }

    public int backlog() {
        return buffer.size();
    }

    public long getDroppedCount() {
        return buffer.getDroppedCount();
    }

    public String getTopicName() {
        return topic.getName();
    }

    @Override
    public void close() {
        ChangeFeed.Registration reg = registration.getAndSet(null);
        if (reg != null) {
            try {
                reg.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close change feed for topic {}: {}", topic.getName(), e.getMessage());
            }
            log.info("Bridge stopped for topic {}", topic.getName());
        }
    }
}

package com.recalc.core.service.topic;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Topic} with one {@link BoundedBuffer} per subscriber.
 *
 * Publishes are serialized so every subscriber observes the same order.
 */
@Slf4j
public class BroadcastTopic<T> implements Topic<T> {

    private final String name;
    private final List<BufferedSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger subscriptionSeq = new AtomicInteger();

    public BroadcastTopic(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized int publish(T element) {
        int delivered = 0;
        for (BufferedSubscription subscription : subscriptions) {
            subscription.buffer.offer(element);
            delivered++;
        }
        return delivered;
    }

    @Override
    public Subscription<T> subscribe(int backlogSize) {
        String subscriptionName = name + "#" + subscriptionSeq.incrementAndGet();
        var subscription = new BufferedSubscription(new BoundedBuffer<>(subscriptionName, backlogSize));
        subscriptions.add(subscription);
        log.info("Subscribed {} with backlog {}", subscriptionName, backlogSize);
        return subscription;
    }

    @Override
    public int subscriberCount() {
        return subscriptions.size();
    }

    private final class BufferedSubscription implements Subscription<T> {

        private final BoundedBuffer<T> buffer;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private BufferedSubscription(BoundedBuffer<T> buffer) {
            this.buffer = buffer;
        }

        @Override
        public Optional<T> next(long timeoutMs) {
            if (closed.get()) {
                return Optional.empty();
            }
            return buffer.poll(timeoutMs);
        }

        @Override
        public int backlog() {
            return buffer.size();
        }

        @Override
        public int getCapacity() {
            return buffer.getCapacity();
        }

        @Override
        public long getDroppedCount() {
            return buffer.getDroppedCount();
        }

        @Override
        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                subscriptions.remove(this);
                buffer.clear();
                log.info("Unsubscribed {}", buffer.getName());
            }
        }
    }
}

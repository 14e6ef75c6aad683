package com.recalc.core.service.topic;

/**
 * Bounded multi-subscriber publish/subscribe channel.
 *
 * Publishing never blocks. Each subscriber owns an independent bounded
 * queue; a slow subscriber loses its own oldest elements and never delays
 * the publisher or any other subscriber.
 *
 * @param <T> element type
 */
public interface Topic<T> {

    String getName();

    /**
     * Delivers an element to every current subscriber.
     *
     * @param element the element to publish
     * @return number of subscribers the element was offered to
     */
    int publish(T element);

    /**
     * Attaches a new subscriber.
     *
     * @param backlogSize maximum number of undelivered elements retained
     * @return the new subscription
     */
    Subscription<T> subscribe(int backlogSize);

    int subscriberCount();
}

package com.recalc.core.service.topic;

import java.util.function.Consumer;

/**
 * Producer of change elements derived from committed mutations in the backing store.
 *
 * Implementations own the wire protocol to the store. Elements are pushed to the
 * sink in commit order from the feed's own thread; the sink never blocks.
 *
 * @param <T> element type
 */
public interface ChangeFeed<T> {

    /**
     * Starts pushing elements to the given sink.
     *
     * @param sink receives each element
     * @return handle that stops delivery when closed
     */
    Registration listen(Consumer<? super T> sink);

    interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}

package com.recalc.core.service.supervisor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single shutdown signal shared by every task of a {@link TaskGroup}.
 */
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * True once cancellation was requested or the current thread was interrupted.
     */
    public boolean isCancelled() {
        return latch.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    /**
     * Waits for the given duration unless cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled
     */
    public boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !latch.await(duration.toNanos(), TimeUnit.NANOSECONDS) && !isCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void cancel() {
        latch.countDown();
    }
}

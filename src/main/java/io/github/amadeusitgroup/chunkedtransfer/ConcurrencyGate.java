package io.github.amadeusitgroup.chunkedtransfer;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting admission gate bounding in-flight chunk operations.
 * Backed by a fair semaphore so waiters are resumed in arrival order.
 */
public class ConcurrencyGate {

    public static final int DEFAULT_CONCURRENCY_LIMIT = 4;

    private final int limit;
    private final Semaphore permits;
    private final AtomicInteger holders = new AtomicInteger(0);
    private final AtomicInteger peakHolders = new AtomicInteger(0);

    public ConcurrencyGate() {
        this(DEFAULT_CONCURRENCY_LIMIT);
    }

    public ConcurrencyGate(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive");
        }
        this.limit = limit;
        this.permits = new Semaphore(limit, true);
    }

    /**
     * Wait for a permit. There is no timeout; callers cancel through interruption.
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        int current = holders.incrementAndGet();
        peakHolders.accumulateAndGet(current, Math::max);
    }

    /**
     * Return a permit obtained by a prior {@link #acquire()}.
     *
     * @throws IllegalStateException when no permit is held
     */
    public void release() {
        while (true) {
            int current = holders.get();
            if (current == 0) {
                throw new IllegalStateException("release() without a matching acquire()");
            }
            if (holders.compareAndSet(current, current - 1)) {
                break;
            }
        }
        permits.release();
    }

    public int getLimit() {
        return limit;
    }

    public int getActiveHolders() {
        return holders.get();
    }

    public int getPeakHolders() {
        return peakHolders.get();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    /**
     * Estimated number of threads waiting for a permit.
     */
    public int getQueueLength() {
        return permits.getQueueLength();
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Time source used for backoff, timeouts and idle bookkeeping.
 * Tests swap in a manual clock so that retry delays never block.
 */
public interface TransferClock {

    TransferClock SYSTEM = new TransferClock() {
        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        }
    };

    /**
     * Current wall clock time in milliseconds.
     */
    long currentTimeMillis();

    /**
     * Suspend the calling thread for the given number of milliseconds.
     */
    void sleep(long millis) throws InterruptedException;
}

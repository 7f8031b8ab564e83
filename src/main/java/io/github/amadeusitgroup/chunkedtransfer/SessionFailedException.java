package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Aggregate error of a session in which at least one chunk failed permanently.
 */
public class SessionFailedException extends TransferException {

    private static final long serialVersionUID = 1L;

    private final int failedChunks;
    private final int totalRetries;

    public SessionFailedException(int failedChunks, int totalRetries, Throwable lastCause) {
        super(failedChunks + " chunks failed (" + totalRetries + " retries)", -1,
            ErrorCategory.NON_RETRYABLE, lastCause);
        this.failedChunks = failedChunks;
        this.totalRetries = totalRetries;
    }

    public SessionFailedException(String message, Throwable cause) {
        super(message, -1, ErrorCategory.NON_RETRYABLE, cause);
        this.failedChunks = 0;
        this.totalRetries = 0;
    }

    public int getFailedChunks() {
        return failedChunks;
    }

    public int getTotalRetries() {
        return totalRetries;
    }
}

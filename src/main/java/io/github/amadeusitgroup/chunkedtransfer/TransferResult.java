package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Outcome of one upload or download call.
 */
public class TransferResult {

    /**
     * Terminal outcome of a session. Cancellation is reported separately from failure.
     */
    public enum Outcome {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    private final Outcome outcome;
    private final long bytesTransferred;
    private final int chunksCompleted;
    private final int chunksFailed;
    private final int retryCount;
    private final Exception error;
    private final long totalTimeMs;
    private final byte[] data;
    private final UploadReceipt confirmation;
    private final int finalChunkSize;

    private TransferResult(Builder builder) {
        this.outcome = builder.outcome;
        this.bytesTransferred = builder.bytesTransferred;
        this.chunksCompleted = builder.chunksCompleted;
        this.chunksFailed = builder.chunksFailed;
        this.retryCount = builder.retryCount;
        this.error = builder.error;
        this.totalTimeMs = builder.totalTimeMs;
        this.data = builder.data;
        this.confirmation = builder.confirmation;
        this.finalChunkSize = builder.finalChunkSize;
    }

    public static Builder builder(Outcome outcome) {
        return new Builder(outcome);
    }

    public Outcome getOutcome() { return outcome; }
    public boolean isSuccess() { return outcome == Outcome.SUCCESS; }
    public boolean isCancelled() { return outcome == Outcome.CANCELLED; }
    public long getBytesTransferred() { return bytesTransferred; }
    public int getChunksCompleted() { return chunksCompleted; }
    public int getChunksFailed() { return chunksFailed; }
    public int getRetryCount() { return retryCount; }
    public Exception getError() { return error; }
    public long getTotalTimeMs() { return totalTimeMs; }

    /**
     * Assembled artifact of a successful download; null for uploads and failures.
     */
    public byte[] getData() { return data; }

    /**
     * Remote confirmation of a successful upload; null for downloads and failures.
     */
    public UploadReceipt getConfirmation() { return confirmation; }

    public int getFinalChunkSize() { return finalChunkSize; }

    /**
     * Average speed over the whole call in bytes per second.
     */
    public double getAverageSpeedBps() {
        return totalTimeMs > 0 ? bytesTransferred * 1000.0 / totalTimeMs : 0.0;
    }

    @Override
    public String toString() {
        return String.format("TransferResult{outcome=%s, bytes=%d, completed=%d, failed=%d, retries=%d, time=%dms%s}",
            outcome, bytesTransferred, chunksCompleted, chunksFailed, retryCount, totalTimeMs,
            error != null ? ", error=" + error.getMessage() : "");
    }

    public static class Builder {
        private final Outcome outcome;
        private long bytesTransferred;
        private int chunksCompleted;
        private int chunksFailed;
        private int retryCount;
        private Exception error;
        private long totalTimeMs;
        private byte[] data;
        private UploadReceipt confirmation;
        private int finalChunkSize;

        private Builder(Outcome outcome) {
            this.outcome = outcome;
        }

        public Builder bytesTransferred(long bytesTransferred) { this.bytesTransferred = bytesTransferred; return this; }
        public Builder chunksCompleted(int chunksCompleted) { this.chunksCompleted = chunksCompleted; return this; }
        public Builder chunksFailed(int chunksFailed) { this.chunksFailed = chunksFailed; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder error(Exception error) { this.error = error; return this; }
        public Builder totalTimeMs(long totalTimeMs) { this.totalTimeMs = totalTimeMs; return this; }
        public Builder data(byte[] data) { this.data = data; return this; }
        public Builder confirmation(UploadReceipt confirmation) { this.confirmation = confirmation; return this; }
        public Builder finalChunkSize(int finalChunkSize) { this.finalChunkSize = finalChunkSize; return this; }

        public TransferResult build() {
            return new TransferResult(this);
        }
    }
}

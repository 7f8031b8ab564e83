package io.github.amadeusitgroup.chunkedtransfer;

/**
 * One contiguous byte range of a payload, [start, end).
 * Mutated only by the worker that owns it and frozen once it reaches a terminal status.
 */
public class ChunkDescriptor {

    private final int index;
    private final long start;
    private final long end;

    private ChunkStatus status = ChunkStatus.PENDING;
    private int retryCount;
    private long measuredDurationMs;
    private double measuredThroughputBps;
    private String checksum;
    private byte[] payload;
    private Throwable lastError;
    private long completedAt;

    public ChunkDescriptor(int index, long start, long end) {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative: " + index);
        }
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid chunk range [" + start + ", " + end + ")");
        }
        this.index = index;
        this.start = start;
        this.end = end;
    }

    public int getIndex() { return index; }
    public long getStart() { return start; }
    public long getEnd() { return end; }
    public long getSize() { return end - start; }

    /**
     * Last byte of the range, inclusive, as used in HTTP Range headers.
     */
    public long getEndInclusive() { return end - 1; }

    public synchronized ChunkStatus getStatus() { return status; }
    public synchronized int getRetryCount() { return retryCount; }
    public synchronized long getMeasuredDurationMs() { return measuredDurationMs; }
    public synchronized double getMeasuredThroughputBps() { return measuredThroughputBps; }
    public synchronized String getChecksum() { return checksum; }
    public synchronized byte[] getPayload() { return payload; }
    public synchronized Throwable getLastError() { return lastError; }
    public synchronized long getCompletedAt() { return completedAt; }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    synchronized void markInFlight(int attempt) {
        ensureNotTerminal();
        this.status = ChunkStatus.IN_FLIGHT;
        this.retryCount = attempt;
    }

    synchronized void setChecksum(String checksum) {
        ensureNotTerminal();
        this.checksum = checksum;
    }

    synchronized void recordError(Throwable error) {
        ensureNotTerminal();
        this.lastError = error;
    }

    synchronized void markCompleted(byte[] payload, long durationMs, long completedAt) {
        ensureNotTerminal();
        this.payload = payload;
        this.measuredDurationMs = Math.max(0, durationMs);
        this.measuredThroughputBps = getSize() * 1000.0 / Math.max(1, durationMs);
        this.completedAt = completedAt;
        this.status = ChunkStatus.COMPLETED;
    }

    /**
     * Mark a chunk confirmed by an earlier session as completed without transferring it again.
     */
    synchronized void markRestored(String checksum, long completedAt) {
        ensureNotTerminal();
        this.checksum = checksum;
        this.completedAt = completedAt;
        this.status = ChunkStatus.COMPLETED;
    }

    synchronized void markFailed(Throwable error) {
        ensureNotTerminal();
        if (error != null) {
            this.lastError = error;
        }
        this.status = ChunkStatus.FAILED;
    }

    private void ensureNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Chunk " + index + " is already " + status);
        }
    }

    @Override
    public synchronized String toString() {
        return String.format("ChunkDescriptor{index=%d, range=[%d, %d), status=%s, retries=%d}",
            index, start, end, status, retryCount);
    }
}

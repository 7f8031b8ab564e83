package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Immutable snapshot of the progress of a session.
 */
public class TransferProgress {

    private final long totalBytes;
    private final long transferredBytes;
    private final int chunksTotal;
    private final int chunksCompleted;
    private final int chunksFailed;
    private final int activeChunks;
    private final double currentSpeedBps;
    private final long estimatedRemainingMs;

    public TransferProgress(long totalBytes, long transferredBytes, int chunksTotal, int chunksCompleted,
                            int chunksFailed, int activeChunks, double currentSpeedBps, long estimatedRemainingMs) {
        this.totalBytes = totalBytes;
        this.transferredBytes = transferredBytes;
        this.chunksTotal = chunksTotal;
        this.chunksCompleted = chunksCompleted;
        this.chunksFailed = chunksFailed;
        this.activeChunks = activeChunks;
        this.currentSpeedBps = currentSpeedBps;
        this.estimatedRemainingMs = estimatedRemainingMs;
    }

    public long getTotalBytes() { return totalBytes; }
    public long getTransferredBytes() { return transferredBytes; }
    public int getChunksTotal() { return chunksTotal; }
    public int getChunksCompleted() { return chunksCompleted; }
    public int getChunksFailed() { return chunksFailed; }
    public int getActiveChunks() { return activeChunks; }
    public double getCurrentSpeedBps() { return currentSpeedBps; }
    public long getEstimatedRemainingMs() { return estimatedRemainingMs; }

    public double getPercentage() {
        return totalBytes > 0 ? Math.min(100.0, transferredBytes * 100.0 / totalBytes) : 0.0;
    }

    @Override
    public String toString() {
        return String.format("TransferProgress{%d/%d bytes (%.1f%%), chunks=%d/%d, failed=%d, active=%d, speed=%.0fB/s, eta=%dms}",
            transferredBytes, totalBytes, getPercentage(), chunksCompleted, chunksTotal, chunksFailed,
            activeChunks, currentSpeedBps, estimatedRemainingMs);
    }
}

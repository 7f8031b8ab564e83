package io.github.amadeusitgroup.chunkedtransfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bookkeeping of one upload or download from planning to assembly.
 */
public class TransferSession {

    private final String sessionId;
    private final TransferDirection direction;
    private final long totalBytes;
    private final int concurrencyLimit;
    private final List<ChunkDescriptor> chunks;
    private final long startTime;
    private final CancellationToken cancellationToken;
    private final AtomicLong transferredBytes = new AtomicLong(0);
    private volatile int chunkSize;

    public TransferSession(String sessionId, TransferDirection direction, long totalBytes, int chunkSize,
                           int concurrencyLimit, List<ChunkDescriptor> chunks, long startTime,
                           CancellationToken cancellationToken) {
        this.sessionId = sessionId;
        this.direction = direction;
        this.totalBytes = totalBytes;
        this.chunkSize = chunkSize;
        this.concurrencyLimit = concurrencyLimit;
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
        this.startTime = startTime;
        this.cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();
    }

    public String getSessionId() { return sessionId; }
    public TransferDirection getDirection() { return direction; }
    public long getTotalBytes() { return totalBytes; }
    public int getConcurrencyLimit() { return concurrencyLimit; }
    public List<ChunkDescriptor> getChunks() { return chunks; }
    public long getStartTime() { return startTime; }
    public CancellationToken getCancellationToken() { return cancellationToken; }
    public long getTransferredBytes() { return transferredBytes.get(); }
    public int getChunkSize() { return chunkSize; }

    void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    /**
     * Account the bytes of a chunk that just reached COMPLETED.
     */
    long recordCompleted(ChunkDescriptor chunk) {
        return transferredBytes.addAndGet(chunk.getSize());
    }

    public int getCompletedCount() {
        return countStatus(ChunkStatus.COMPLETED);
    }

    public int getFailedCount() {
        return countStatus(ChunkStatus.FAILED);
    }

    public int getTotalRetries() {
        int total = 0;
        for (ChunkDescriptor chunk : chunks) {
            total += chunk.getRetryCount();
        }
        return total;
    }

    public boolean isTerminal() {
        for (ChunkDescriptor chunk : chunks) {
            if (!chunk.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    public boolean isSuccessful() {
        return isTerminal() && getFailedCount() == 0;
    }

    private int countStatus(ChunkStatus status) {
        int count = 0;
        for (ChunkDescriptor chunk : chunks) {
            if (chunk.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("TransferSession{id=%s, direction=%s, totalBytes=%d, chunks=%d, transferred=%d}",
            sessionId, direction, totalBytes, chunks.size(), transferredBytes.get());
    }
}

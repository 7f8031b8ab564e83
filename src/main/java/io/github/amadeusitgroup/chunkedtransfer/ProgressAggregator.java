package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Merges per-chunk events into overall progress and notifies registered listeners.
 */
public class ProgressAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ProgressAggregator.class);

    static final int RECENT_CHUNK_COUNT = 10;
    static final long SPEED_WINDOW_MS = 5000;

    private final long totalBytes;
    private final int chunksTotal;
    private final TransferClock clock;
    private final long startTime;

    private final AtomicLong transferredBytes = new AtomicLong(0);
    private final AtomicInteger chunksCompleted = new AtomicInteger(0);
    private final AtomicInteger chunksFailed = new AtomicInteger(0);
    private final Set<Integer> activeChunks = ConcurrentHashMap.newKeySet();
    private final Deque<SpeedSample> recentChunks = new ArrayDeque<>();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    public ProgressAggregator(long totalBytes, int chunksTotal, TransferClock clock) {
        this.totalBytes = totalBytes;
        this.chunksTotal = chunksTotal;
        this.clock = clock;
        this.startTime = clock.currentTimeMillis();
    }

    public void register(ProgressListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void unregister(ProgressListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void onChunkStarted(ChunkDescriptor chunk) {
        activeChunks.add(chunk.getIndex());
    }

    public void onChunkCompleted(ChunkDescriptor chunk) {
        activeChunks.remove(chunk.getIndex());
        transferredBytes.addAndGet(chunk.getSize());
        chunksCompleted.incrementAndGet();
        if (chunk.getMeasuredDurationMs() > 0) {
            synchronized (recentChunks) {
                recentChunks.addLast(new SpeedSample(chunk.getMeasuredThroughputBps(), chunk.getCompletedAt()));
                while (recentChunks.size() > RECENT_CHUNK_COUNT) {
                    recentChunks.removeFirst();
                }
            }
        }
        publish();
    }

    public void onChunkFailed(ChunkDescriptor chunk) {
        activeChunks.remove(chunk.getIndex());
        chunksFailed.incrementAndGet();
        publish();
    }

    public TransferProgress snapshot() {
        long transferred = transferredBytes.get();
        double speed = currentSpeed(transferred);
        long remaining = Math.max(0, totalBytes - transferred);
        long eta = speed > 0 ? (long) (remaining * 1000.0 / speed) : 0;
        return new TransferProgress(totalBytes, transferred, chunksTotal, chunksCompleted.get(),
            chunksFailed.get(), activeChunks.size(), speed, eta);
    }

    /**
     * Average throughput of the most recent chunks that finished inside the speed window,
     * or the session average when none did.
     */
    private double currentSpeed(long transferred) {
        long now = clock.currentTimeMillis();
        double sum = 0;
        int count = 0;
        synchronized (recentChunks) {
            for (SpeedSample sample : recentChunks) {
                if (now - sample.completedAt <= SPEED_WINDOW_MS) {
                    sum += sample.throughputBps;
                    count++;
                }
            }
        }
        if (count > 0) {
            return sum / count;
        }
        long elapsed = now - startTime;
        return elapsed > 0 ? transferred * 1000.0 / elapsed : 0.0;
    }

    private void publish() {
        if (listeners.isEmpty()) {
            return;
        }
        TransferProgress progress = snapshot();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(progress.getTransferredBytes(), progress.getTotalBytes(), progress.getPercentage());
                listener.onSnapshot(progress);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static final class SpeedSample {
        final double throughputBps;
        final long completedAt;

        SpeedSample(double throughputBps, long completedAt) {
            this.throughputBps = throughputBps;
            this.completedAt = completedAt;
        }
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multiplicative feedback loop on the working chunk size, fed by completed chunks.
 */
public class AdaptiveSizer {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveSizer.class);

    static final double FAST_THROUGHPUT_BPS = 10.0 * 1024 * 1024;
    static final long FAST_DURATION_MS = 1000;
    static final double SLOW_THROUGHPUT_BPS = 1.0 * 1024 * 1024;
    static final long SLOW_DURATION_MS = 5000;
    static final double GROWTH_FACTOR = 1.2;
    static final double SHRINK_FACTOR = 0.8;

    public enum Adjustment {
        GROW,
        SHRINK,
        KEEP
    }

    private final int minChunkSize;
    private final int maxChunkSize;
    private final AtomicInteger currentChunkSize;
    private final AtomicInteger adjustments = new AtomicInteger(0);

    public AdaptiveSizer(int seedChunkSize) {
        this(seedChunkSize, TransferPlanner.MIN_CHUNK_SIZE, TransferPlanner.MAX_CHUNK_SIZE);
    }

    public AdaptiveSizer(int seedChunkSize, int minChunkSize, int maxChunkSize) {
        if (minChunkSize <= 0 || maxChunkSize < minChunkSize) {
            throw new IllegalArgumentException("Invalid chunk size bounds [" + minChunkSize + ", " + maxChunkSize + "]");
        }
        this.minChunkSize = minChunkSize;
        this.maxChunkSize = maxChunkSize;
        this.currentChunkSize = new AtomicInteger(clamp(seedChunkSize));
    }

    /**
     * Feed one completed chunk and return the chunk size to use for chunks planned from now on.
     * Samples without a measurable duration or size leave the size unchanged.
     */
    public int recordChunk(long bytes, long durationMs) {
        if (bytes <= 0 || durationMs <= 0) {
            return currentChunkSize.get();
        }

        double throughputBps = bytes * 1000.0 / durationMs;
        Adjustment adjustment = classify(throughputBps, durationMs);
        if (adjustment == Adjustment.KEEP) {
            return currentChunkSize.get();
        }

        double factor = adjustment == Adjustment.GROW ? GROWTH_FACTOR : SHRINK_FACTOR;
        int previous = currentChunkSize.get();
        int updated = currentChunkSize.updateAndGet(size -> clamp(Math.round(size * factor)));
        if (updated != previous) {
            adjustments.incrementAndGet();
            logger.debug("Chunk size {} -> {} ({} at {} B/s over {}ms)", previous, updated, adjustment,
                (long) throughputBps, durationMs);
        }
        return updated;
    }

    public static Adjustment classify(double throughputBps, long durationMs) {
        if (throughputBps > FAST_THROUGHPUT_BPS && durationMs < FAST_DURATION_MS) {
            return Adjustment.GROW;
        }
        if (throughputBps < SLOW_THROUGHPUT_BPS || durationMs > SLOW_DURATION_MS) {
            return Adjustment.SHRINK;
        }
        return Adjustment.KEEP;
    }

    public int getCurrentChunkSize() {
        return currentChunkSize.get();
    }

    public int getAdjustmentCount() {
        return adjustments.get();
    }

    private int clamp(long size) {
        return (int) Math.max(minChunkSize, Math.min(maxChunkSize, size));
    }
}

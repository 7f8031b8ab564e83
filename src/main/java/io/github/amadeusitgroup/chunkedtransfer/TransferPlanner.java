package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a known-size payload into contiguous chunk descriptors.
 */
public class TransferPlanner {

    private static final Logger logger = LoggerFactory.getLogger(TransferPlanner.class);

    public static final int MIN_CHUNK_SIZE = 32 * 1024;
    public static final int MAX_CHUNK_SIZE = 2 * 1024 * 1024;
    public static final int DEFAULT_CHUNK_SIZE = 256 * 1024;

    private final AdvancedPerformanceMonitor performanceMonitor;

    public TransferPlanner() {
        this(null);
    }

    /**
     * @param performanceMonitor source of the long-horizon chunk size recommendation, may be null
     */
    public TransferPlanner(AdvancedPerformanceMonitor performanceMonitor) {
        this.performanceMonitor = performanceMonitor;
    }

    /**
     * Compute the chunk size a new session starts with, within the default bounds.
     */
    public int initialChunkSize(long totalBytes, Integer requestedChunkSize, NetworkQuality quality,
                                boolean useRecommendation) {
        return initialChunkSize(totalBytes, requestedChunkSize, quality, useRecommendation,
            MIN_CHUNK_SIZE, MAX_CHUNK_SIZE);
    }

    /**
     * Compute the chunk size a new session starts with.
     *
     * @param totalBytes payload size, selects the recommendation bucket
     * @param requestedChunkSize explicit caller choice, or null for the default
     * @param quality network quality hint
     * @param useRecommendation whether the monitor's recommendation may replace the default
     * @param minChunkSize lower bound of the result
     * @param maxChunkSize upper bound of the result
     */
    public int initialChunkSize(long totalBytes, Integer requestedChunkSize, NetworkQuality quality,
                                boolean useRecommendation, int minChunkSize, int maxChunkSize) {
        NetworkQuality effectiveQuality = quality != null ? quality : NetworkQuality.MEDIUM;

        if (requestedChunkSize == null && useRecommendation && performanceMonitor != null) {
            int recommended = performanceMonitor.getOptimalChunkSize(totalBytes, effectiveQuality);
            logger.debug("Using recommended chunk size {} for payload of {} bytes", recommended, totalBytes);
            return clamp(recommended, minChunkSize, maxChunkSize);
        }

        int base = requestedChunkSize != null ? requestedChunkSize : DEFAULT_CHUNK_SIZE;
        return clamp(Math.round(base * effectiveQuality.getMultiplier()), minChunkSize, maxChunkSize);
    }

    /**
     * Split [0, totalBytes) into ceil(totalBytes / chunkSize) chunks; the last one may be shorter.
     */
    public List<ChunkDescriptor> plan(long totalBytes, int chunkSize) {
        if (totalBytes <= 0) {
            throw new InvalidPayloadSizeException(totalBytes);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }

        long chunkCount = (totalBytes + chunkSize - 1) / chunkSize;
        if (chunkCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks for payload of " + totalBytes
                + " bytes with chunk size " + chunkSize);
        }

        List<ChunkDescriptor> chunks = new ArrayList<>((int) chunkCount);
        long offset = 0;
        for (int index = 0; index < chunkCount; index++) {
            long end = Math.min(offset + chunkSize, totalBytes);
            chunks.add(new ChunkDescriptor(index, offset, end));
            offset = end;
        }

        logger.debug("Planned {} chunks of {} bytes for payload of {} bytes", chunkCount, chunkSize, totalBytes);
        return chunks;
    }

    /**
     * Clamp a chunk size into the supported range.
     */
    public static int clamp(long chunkSize) {
        return clamp(chunkSize, MIN_CHUNK_SIZE, MAX_CHUNK_SIZE);
    }

    public static int clamp(long chunkSize, int minChunkSize, int maxChunkSize) {
        return (int) Math.max(minChunkSize, Math.min(maxChunkSize, chunkSize));
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable tuning table derived from measured performance. A new instance replaces the previous
 * one as a whole, so readers never observe a partially updated table.
 */
public final class AdaptiveConfig {

    public static final String DIRECTORY_OPS = "directory_ops";
    public static final String FILE_TRANSFER = "file_transfer";
    public static final String FILE_MODIFY = "file_modify";
    public static final String DEFAULT_CLASS = "default";

    public static final int MIN_BATCH_SIZE = 1;
    public static final int MAX_BATCH_SIZE = 50;
    public static final long MIN_TIMEOUT_MS = 5000;
    public static final long MAX_TIMEOUT_MS = 60000;

    public static final long CONNECT_TIMEOUT_MS = 10000;

    /**
     * Payload size buckets used for chunk size recommendations.
     */
    public enum PayloadBucket {
        SMALL,
        MEDIUM,
        LARGE;

        private static final long SMALL_LIMIT = 1024L * 1024;
        private static final long LARGE_LIMIT = 100L * 1024 * 1024;

        public static PayloadBucket forSize(long totalBytes) {
            if (totalBytes < SMALL_LIMIT) {
                return SMALL;
            }
            return totalBytes < LARGE_LIMIT ? MEDIUM : LARGE;
        }
    }

    private static final AdaptiveConfig DEFAULTS;

    static {
        Map<String, OperationSettings> settings = new LinkedHashMap<>();
        settings.put(DIRECTORY_OPS, new OperationSettings(TransferPlanner.DEFAULT_CHUNK_SIZE, 20, 5000));
        settings.put(FILE_TRANSFER, new OperationSettings(TransferPlanner.DEFAULT_CHUNK_SIZE, 3, 30000));
        settings.put(FILE_MODIFY, new OperationSettings(TransferPlanner.DEFAULT_CHUNK_SIZE, 10, 15000));
        settings.put(DEFAULT_CLASS, new OperationSettings(TransferPlanner.DEFAULT_CHUNK_SIZE, 5, 15000));

        Map<PayloadBucket, Integer> buckets = new EnumMap<>(PayloadBucket.class);
        buckets.put(PayloadBucket.SMALL, 64 * 1024);
        buckets.put(PayloadBucket.MEDIUM, 256 * 1024);
        buckets.put(PayloadBucket.LARGE, 1024 * 1024);

        DEFAULTS = new AdaptiveConfig(settings, buckets, 1);
    }

    private final Map<String, OperationSettings> settings;
    private final Map<PayloadBucket, Integer> bucketChunkSizes;
    private final long version;

    private AdaptiveConfig(Map<String, OperationSettings> settings, Map<PayloadBucket, Integer> bucketChunkSizes,
                           long version) {
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        this.bucketChunkSizes = Collections.unmodifiableMap(new EnumMap<>(bucketChunkSizes));
        this.version = version;
    }

    public static AdaptiveConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Settings for an operation class; unknown classes get the default class.
     */
    public OperationSettings getSettings(String operationClass) {
        OperationSettings result = settings.get(operationClass);
        return result != null ? result : settings.get(DEFAULT_CLASS);
    }

    public Map<String, OperationSettings> getAllSettings() {
        return settings;
    }

    public int getBucketChunkSize(PayloadBucket bucket) {
        return bucketChunkSizes.get(bucket);
    }

    public long getVersion() {
        return version;
    }

    /**
     * Copy of this table with one class replaced.
     */
    public AdaptiveConfig withSettings(String operationClass, OperationSettings newSettings) {
        Map<String, OperationSettings> copy = new LinkedHashMap<>(settings);
        copy.put(operationClass, newSettings);
        return new AdaptiveConfig(copy, bucketChunkSizes, version + 1);
    }

    @Override
    public String toString() {
        return String.format("AdaptiveConfig{version=%d, settings=%s, buckets=%s}", version, settings, bucketChunkSizes);
    }

    /**
     * Tuning values for one operation class.
     */
    public static final class OperationSettings {
        private final int chunkSize;
        private final int batchSize;
        private final long timeoutMs;

        public OperationSettings(int chunkSize, int batchSize, long timeoutMs) {
            this.chunkSize = chunkSize;
            this.batchSize = batchSize;
            this.timeoutMs = timeoutMs;
        }

        public int getChunkSize() { return chunkSize; }
        public int getBatchSize() { return batchSize; }
        public long getTimeoutMs() { return timeoutMs; }

        public OperationSettings withBatchAndTimeout(int newBatchSize, long newTimeoutMs) {
            return new OperationSettings(chunkSize, newBatchSize, newTimeoutMs);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OperationSettings)) return false;
            OperationSettings that = (OperationSettings) o;
            return chunkSize == that.chunkSize && batchSize == that.batchSize && timeoutMs == that.timeoutMs;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * chunkSize + batchSize) + Long.hashCode(timeoutMs);
        }

        @Override
        public String toString() {
            return String.format("{chunk=%d, batch=%d, timeout=%dms}", chunkSize, batchSize, timeoutMs);
        }
    }
}

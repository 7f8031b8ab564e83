package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Windowed operation metrics. Every operation key keeps the most recent samples in a fixed-capacity
 * ring buffer; the oldest sample is evicted on overflow.
 */
public class PerformanceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    public static final int DEFAULT_WINDOW_SIZE = 1000;

    private final int windowSize;
    protected final TransferClock clock;
    private final Map<String, SampleWindow> windows = new ConcurrentHashMap<>();
    private final Map<String, ActiveOperation> activeOperations = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PerformanceMonitor() {
        this(DEFAULT_WINDOW_SIZE, TransferClock.SYSTEM);
    }

    public PerformanceMonitor(int windowSize, TransferClock clock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.clock = clock;
    }

    // Recording

    public void record(PerformanceSample sample) {
        windows.computeIfAbsent(sample.getOperationKey(), k -> new SampleWindow(windowSize)).add(sample);
    }

    public void record(String operationKey, long durationMs, boolean success, long dataSize) {
        record(new PerformanceSample(operationKey, durationMs, success, dataSize, clock.currentTimeMillis()));
    }

    /**
     * Begin timing an operation.
     *
     * @return handle to pass to {@link #endOperation}
     */
    public String startOperation(String operationKey) {
        String operationId = operationKey + "-" + UUID.randomUUID();
        activeOperations.put(operationId, new ActiveOperation(operationKey, clock.currentTimeMillis()));
        return operationId;
    }

    public PerformanceSample endOperation(String operationId, boolean success) {
        return endOperation(operationId, success, 0);
    }

    /**
     * Finish timing an operation and record its sample.
     *
     * @return the recorded sample, or null when the handle is unknown
     */
    public PerformanceSample endOperation(String operationId, boolean success, long dataSize) {
        ActiveOperation operation = activeOperations.remove(operationId);
        if (operation == null) {
            logger.warn("No active operation for handle {}", operationId);
            return null;
        }
        long now = clock.currentTimeMillis();
        PerformanceSample sample = new PerformanceSample(operation.operationKey, now - operation.startedAt,
            success, dataSize, now);
        record(sample);
        return sample;
    }

    /**
     * Run and time a callable; a thrown exception is recorded as a failure and rethrown.
     */
    public <T> T measure(String operationKey, Callable<T> operation) throws Exception {
        String operationId = startOperation(operationKey);
        try {
            T result = operation.call();
            endOperation(operationId, true);
            return result;
        } catch (Exception e) {
            endOperation(operationId, false);
            throw e;
        }
    }

    public int getActiveOperationCount() {
        return activeOperations.size();
    }

    // Queries

    public Set<String> getOperationKeys() {
        return new TreeSet<>(windows.keySet());
    }

    public int getSampleCount(String operationKey) {
        SampleWindow window = windows.get(operationKey);
        return window != null ? window.size() : 0;
    }

    /**
     * Copy of the window for a key, oldest first.
     */
    public List<PerformanceSample> getSamples(String operationKey) {
        SampleWindow window = windows.get(operationKey);
        return window != null ? window.snapshot() : Collections.emptyList();
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Statistics over the whole window of a key, or null when nothing was recorded.
     */
    public OperationStatistics getStatistics(String operationKey) {
        List<PerformanceSample> samples = getSamples(operationKey);
        if (samples.isEmpty()) {
            return null;
        }
        return OperationStatistics.from(operationKey, samples);
    }

    public String generateReport() {
        StringBuilder sb = new StringBuilder("Performance report\n");
        for (String key : getOperationKeys()) {
            OperationStatistics stats = getStatistics(key);
            if (stats != null) {
                sb.append("  ").append(stats).append('\n');
            }
        }
        return sb.toString();
    }

    public String exportStatisticsAsJson() {
        ObjectNode root = objectMapper.createObjectNode();
        for (String key : getOperationKeys()) {
            OperationStatistics stats = getStatistics(key);
            if (stats != null) {
                root.set(key, objectMapper.valueToTree(stats));
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize performance statistics", e);
        }
    }

    public void reset() {
        windows.clear();
        activeOperations.clear();
    }

    /**
     * Nearest-rank percentile over an ascending array.
     */
    static long percentile(long[] sorted, double percent) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(percent / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }

    private static final class SampleWindow {
        private final int capacity;
        private final Deque<PerformanceSample> samples;

        SampleWindow(int capacity) {
            this.capacity = capacity;
            this.samples = new ArrayDeque<>(Math.min(capacity, 64));
        }

        synchronized void add(PerformanceSample sample) {
            if (samples.size() == capacity) {
                samples.pollFirst();
            }
            samples.addLast(sample);
        }

        synchronized int size() {
            return samples.size();
        }

        synchronized List<PerformanceSample> snapshot() {
            return new ArrayList<>(samples);
        }
    }

    private static final class ActiveOperation {
        final String operationKey;
        final long startedAt;

        ActiveOperation(String operationKey, long startedAt) {
            this.operationKey = operationKey;
            this.startedAt = startedAt;
        }
    }

    /**
     * Aggregates over a list of samples of one key.
     */
    public static class OperationStatistics {
        private final String operationKey;
        private final int totalCount;
        private final int successCount;
        private final double averageDurationMs;
        private final long minDurationMs;
        private final long maxDurationMs;
        private final long p50;
        private final long p95;
        private final long p99;
        private final double averageDataSize;
        private final double cacheHitRate;
        private final double binaryRatio;

        OperationStatistics(String operationKey, int totalCount, int successCount, double averageDurationMs,
                            long minDurationMs, long maxDurationMs, long p50, long p95, long p99,
                            double averageDataSize, double cacheHitRate, double binaryRatio) {
            this.operationKey = operationKey;
            this.totalCount = totalCount;
            this.successCount = successCount;
            this.averageDurationMs = averageDurationMs;
            this.minDurationMs = minDurationMs;
            this.maxDurationMs = maxDurationMs;
            this.p50 = p50;
            this.p95 = p95;
            this.p99 = p99;
            this.averageDataSize = averageDataSize;
            this.cacheHitRate = cacheHitRate;
            this.binaryRatio = binaryRatio;
        }

        public static OperationStatistics from(String operationKey, List<PerformanceSample> samples) {
            int n = samples.size();
            long[] durations = new long[n];
            long totalDuration = 0;
            long totalData = 0;
            int successes = 0;
            int cached = 0;
            int binary = 0;
            for (int i = 0; i < n; i++) {
                PerformanceSample sample = samples.get(i);
                durations[i] = sample.getDurationMs();
                totalDuration += sample.getDurationMs();
                totalData += sample.getDataSize();
                if (sample.isSuccess()) {
                    successes++;
                }
                if (sample.isCached()) {
                    cached++;
                }
                if (sample.getFormat() == WireFormat.BINARY) {
                    binary++;
                }
            }
            Arrays.sort(durations);
            if (n == 0) {
                return new OperationStatistics(operationKey, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
            }
            return new OperationStatistics(operationKey, n, successes, (double) totalDuration / n,
                durations[0], durations[n - 1],
                percentile(durations, 50), percentile(durations, 95), percentile(durations, 99),
                (double) totalData / n, (double) cached / n, (double) binary / n);
        }

        public String getOperationKey() { return operationKey; }
        public int getTotalCount() { return totalCount; }
        public int getSuccessCount() { return successCount; }
        public int getFailureCount() { return totalCount - successCount; }
        public double getAverageDurationMs() { return averageDurationMs; }
        public long getMinDurationMs() { return minDurationMs; }
        public long getMaxDurationMs() { return maxDurationMs; }
        public long getP50() { return p50; }
        public long getP95() { return p95; }
        public long getP99() { return p99; }
        public double getAverageDataSize() { return averageDataSize; }
        public double getCacheHitRate() { return cacheHitRate; }
        public double getBinaryRatio() { return binaryRatio; }

        public double getSuccessRate() {
            return totalCount > 0 ? (double) successCount / totalCount : 0.0;
        }

        @Override
        public String toString() {
            return String.format("%s: count=%d, success=%.1f%%, avg=%.1fms, p50=%dms, p95=%dms, p99=%dms, avgSize=%.0f",
                operationKey, totalCount, getSuccessRate() * 100, averageDurationMs, p50, p95, p99, averageDataSize);
        }
    }
}

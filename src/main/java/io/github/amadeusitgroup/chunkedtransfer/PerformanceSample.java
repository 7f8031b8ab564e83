package io.github.amadeusitgroup.chunkedtransfer;

/**
 * One measured operation, appended to the window of its operation key.
 */
public class PerformanceSample {

    private final String operationKey;
    private final long durationMs;
    private final boolean success;
    private final long dataSize;
    private final WireFormat format;
    private final boolean cached;
    private final long timestamp;

    public PerformanceSample(String operationKey, long durationMs, boolean success, long dataSize, long timestamp) {
        this(operationKey, durationMs, success, dataSize, null, false, timestamp);
    }

    public PerformanceSample(String operationKey, long durationMs, boolean success, long dataSize,
                             WireFormat format, boolean cached, long timestamp) {
        if (operationKey == null || operationKey.isEmpty()) {
            throw new IllegalArgumentException("operationKey must not be empty");
        }
        this.operationKey = operationKey;
        this.durationMs = Math.max(0, durationMs);
        this.success = success;
        this.dataSize = Math.max(0, dataSize);
        this.format = format;
        this.cached = cached;
        this.timestamp = timestamp;
    }

    public String getOperationKey() { return operationKey; }
    public long getDurationMs() { return durationMs; }
    public boolean isSuccess() { return success; }
    public long getDataSize() { return dataSize; }
    public WireFormat getFormat() { return format; }
    public boolean isCached() { return cached; }
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("PerformanceSample{key=%s, duration=%dms, success=%s, size=%d, format=%s, cached=%s}",
            operationKey, durationMs, success, dataSize, format, cached);
    }
}

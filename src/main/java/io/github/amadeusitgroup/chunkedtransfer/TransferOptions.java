package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Immutable per-call options of the transfer engine.
 */
public class TransferOptions {

    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_TIMEOUT_MS = 30000;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 10000;
    public static final String DEFAULT_UPLOAD_PATH = "/upload";

    private final Integer chunkSize;
    private final int minChunkSize;
    private final int maxChunkSize;
    private final int maxConcurrency;
    private final int maxRetries;
    private final long timeoutMs;
    private final boolean checksumEnabled;
    private final boolean adaptiveChunkSize;
    private final boolean rangeRequestsEnabled;
    private final NetworkQuality networkQuality;
    private final long retryBaseDelayMs;
    private final long retryMaxDelayMs;
    private final WireFormat preferredFormat;
    private final String uploadPath;

    private TransferOptions(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.minChunkSize = builder.minChunkSize;
        this.maxChunkSize = builder.maxChunkSize;
        this.maxConcurrency = builder.maxConcurrency;
        this.maxRetries = builder.maxRetries;
        this.timeoutMs = builder.timeoutMs;
        this.checksumEnabled = builder.checksumEnabled;
        this.adaptiveChunkSize = builder.adaptiveChunkSize;
        this.rangeRequestsEnabled = builder.rangeRequestsEnabled;
        this.networkQuality = builder.networkQuality;
        this.retryBaseDelayMs = builder.retryBaseDelayMs;
        this.retryMaxDelayMs = builder.retryMaxDelayMs;
        this.preferredFormat = builder.preferredFormat;
        this.uploadPath = builder.uploadPath;
    }

    public static TransferOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options seeded from configuration keys such as {@code chunk.size} and {@code transfer.maxRetries}.
     * {@code chunk.size} only counts as an explicit request when it was configured, not defaulted.
     */
    public static TransferOptions fromConfiguration(ConfigurationManager config) {
        Builder builder = builder()
            .chunkSizeBounds(config.getInt("chunk.min", TransferPlanner.MIN_CHUNK_SIZE),
                config.getInt("chunk.max", TransferPlanner.MAX_CHUNK_SIZE))
            .maxConcurrency(config.getInt("transfer.maxConcurrency", DEFAULT_MAX_CONCURRENCY))
            .maxRetries(config.getInt("transfer.maxRetries", DEFAULT_MAX_RETRIES))
            .timeoutMs(config.getLong("transfer.timeoutMs", DEFAULT_TIMEOUT_MS))
            .checksumEnabled(config.getBoolean("transfer.checksum.enabled", true))
            .adaptiveChunkSize(config.getBoolean("transfer.adaptive.enabled", true))
            .rangeRequestsEnabled(config.getBoolean("transfer.rangeRequests.enabled", true))
            .networkQuality(NetworkQuality.fromString(config.getString("transfer.networkQuality", "medium")))
            .retryBaseDelayMs(config.getLong("retry.baseDelayMs", DEFAULT_RETRY_BASE_DELAY_MS))
            .retryMaxDelayMs(config.getLong("retry.maxDelayMs", DEFAULT_RETRY_MAX_DELAY_MS))
            .uploadPath(config.getString("transfer.uploadPath", DEFAULT_UPLOAD_PATH));
        if (config.isExplicitlySet("chunk.size")) {
            builder.chunkSize(config.getInt("chunk.size", TransferPlanner.DEFAULT_CHUNK_SIZE));
        }
        String format = config.getString("transfer.preferredFormat", null);
        if (format != null && !format.trim().isEmpty()) {
            builder.preferredFormat(WireFormat.fromToken(format.trim()));
        }
        return builder.build();
    }

    /**
     * Explicitly requested chunk size, or null to let the planner decide.
     */
    public Integer getChunkSize() { return chunkSize; }
    public int getMinChunkSize() { return minChunkSize; }
    public int getMaxChunkSize() { return maxChunkSize; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public int getMaxRetries() { return maxRetries; }
    public long getTimeoutMs() { return timeoutMs; }
    public boolean isChecksumEnabled() { return checksumEnabled; }
    public boolean isAdaptiveChunkSize() { return adaptiveChunkSize; }
    public boolean isRangeRequestsEnabled() { return rangeRequestsEnabled; }
    public NetworkQuality getNetworkQuality() { return networkQuality; }
    public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
    public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
    public WireFormat getPreferredFormat() { return preferredFormat; }
    public String getUploadPath() { return uploadPath; }

    public Builder toBuilder() {
        return builder()
            .chunkSize(chunkSize)
            .chunkSizeBounds(minChunkSize, maxChunkSize)
            .maxConcurrency(maxConcurrency)
            .maxRetries(maxRetries)
            .timeoutMs(timeoutMs)
            .checksumEnabled(checksumEnabled)
            .adaptiveChunkSize(adaptiveChunkSize)
            .rangeRequestsEnabled(rangeRequestsEnabled)
            .networkQuality(networkQuality)
            .retryBaseDelayMs(retryBaseDelayMs)
            .retryMaxDelayMs(retryMaxDelayMs)
            .preferredFormat(preferredFormat)
            .uploadPath(uploadPath);
    }

    @Override
    public String toString() {
        return String.format("TransferOptions{chunkSize=%s [%d..%d], maxConcurrency=%d, maxRetries=%d, timeout=%dms, "
                + "checksum=%s, adaptive=%s, ranges=%s, quality=%s}",
            chunkSize, minChunkSize, maxChunkSize, maxConcurrency, maxRetries, timeoutMs, checksumEnabled, adaptiveChunkSize,
            rangeRequestsEnabled, networkQuality);
    }

    public static class Builder {
        private Integer chunkSize;
        private int minChunkSize = TransferPlanner.MIN_CHUNK_SIZE;
        private int maxChunkSize = TransferPlanner.MAX_CHUNK_SIZE;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private boolean checksumEnabled = true;
        private boolean adaptiveChunkSize = true;
        private boolean rangeRequestsEnabled = true;
        private NetworkQuality networkQuality = NetworkQuality.MEDIUM;
        private long retryBaseDelayMs = DEFAULT_RETRY_BASE_DELAY_MS;
        private long retryMaxDelayMs = DEFAULT_RETRY_MAX_DELAY_MS;
        private WireFormat preferredFormat;
        private String uploadPath = DEFAULT_UPLOAD_PATH;

        public Builder chunkSize(Integer chunkSize) {
            if (chunkSize != null && chunkSize <= 0) {
                throw new IllegalArgumentException("Chunk size must be positive");
            }
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Bounds for the planned chunk size and for adaptive resizing.
         */
        public Builder chunkSizeBounds(int minChunkSize, int maxChunkSize) {
            if (minChunkSize <= 0 || maxChunkSize < minChunkSize) {
                throw new IllegalArgumentException("Invalid chunk size bounds [" + minChunkSize + ", "
                    + maxChunkSize + "]");
            }
            this.minChunkSize = minChunkSize;
            this.maxChunkSize = maxChunkSize;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("Max concurrency must be positive");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder checksumEnabled(boolean checksumEnabled) { this.checksumEnabled = checksumEnabled; return this; }
        public Builder adaptiveChunkSize(boolean adaptiveChunkSize) { this.adaptiveChunkSize = adaptiveChunkSize; return this; }
        public Builder rangeRequestsEnabled(boolean rangeRequestsEnabled) { this.rangeRequestsEnabled = rangeRequestsEnabled; return this; }

        public Builder networkQuality(NetworkQuality networkQuality) {
            this.networkQuality = networkQuality != null ? networkQuality : NetworkQuality.MEDIUM;
            return this;
        }

        public Builder retryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs); return this; }
        public Builder retryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs); return this; }
        public Builder preferredFormat(WireFormat preferredFormat) { this.preferredFormat = preferredFormat; return this; }

        public Builder uploadPath(String uploadPath) {
            String path = uploadPath == null || uploadPath.isEmpty() ? DEFAULT_UPLOAD_PATH : uploadPath;
            this.uploadPath = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
            return this;
        }

        public TransferOptions build() {
            return new TransferOptions(this);
        }
    }
}

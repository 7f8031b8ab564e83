package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps whole idempotent operations (probes, range probes, finalize calls) in bounded exponential
 * backoff. Non-idempotent operations run exactly once.
 */
public class RetryManager {

    private static final Logger logger = LoggerFactory.getLogger(RetryManager.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 10000;

    /**
     * Semantic verb of an operation; read-like and replace-like verbs are idempotent.
     */
    public enum OperationType {
        GET(true),
        HEAD(true),
        OPTIONS(true),
        LIST(true),
        DOWNLOAD(true),
        READ(true),
        QUERY(true),
        PUT(true),
        DELETE(true),
        FINALIZE(true),
        POST(false),
        CREATE(false),
        APPEND(false),
        UPLOAD_CHUNK(false);

        private final boolean idempotent;

        OperationType(boolean idempotent) {
            this.idempotent = idempotent;
        }

        public boolean isIdempotent() {
            return idempotent;
        }
    }

    @FunctionalInterface
    public interface RetryableOperation<T> {
        T execute() throws IOException;
    }

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final TransferClock clock;

    private final Map<String, AtomicBoolean> activeOperations = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong successAfterRetry = new AtomicLong();
    private final AtomicLong ultimateFailures = new AtomicLong();
    private final AtomicLong retriedOperations = new AtomicLong();
    private final Map<ErrorCategory, AtomicLong> categoryCounts = new EnumMap<>(ErrorCategory.class);

    public RetryManager() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, TransferClock.SYSTEM);
    }

    public RetryManager(int maxAttempts, long baseDelayMs, long maxDelayMs, TransferClock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.clock = clock;
        for (ErrorCategory category : ErrorCategory.values()) {
            categoryCounts.put(category, new AtomicLong());
        }
    }

    public static RetryManager fromConfiguration(ConfigurationManager config, TransferClock clock) {
        return new RetryManager(
            config.getInt("retry.maxAttempts", DEFAULT_MAX_ATTEMPTS),
            config.getLong("retry.baseDelayMs", DEFAULT_BASE_DELAY_MS),
            config.getLong("retry.maxDelayMs", DEFAULT_MAX_DELAY_MS),
            clock);
    }

    public <T> T execute(OperationType type, RetryableOperation<T> operation) throws IOException {
        return execute(type.name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID(), type, operation);
    }

    /**
     * Execute operation with retry logic. The id can be passed to {@link #cancelRetry(String)}
     * while the operation is waiting for its next attempt.
     */
    public <T> T execute(String operationId, OperationType type, RetryableOperation<T> operation)
            throws IOException {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        activeOperations.put(operationId, cancelled);
        long previousDelay = 0;
        try {
            for (int attempt = 1; ; attempt++) {
                if (cancelled.get()) {
                    throw new TransferCancelledException("Operation " + operationId + " was cancelled");
                }
                try {
                    T result = operation.execute();
                    if (attempt > 1) {
                        successAfterRetry.incrementAndGet();
                        logger.debug("Operation {} succeeded on attempt {}", operationId, attempt);
                    }
                    return result;
                } catch (IOException e) {
                    ErrorCategory category = classify(e);
                    categoryCounts.get(category).incrementAndGet();

                    if (!shouldRetry(type, category, attempt)) {
                        if (attempt > 1) {
                            ultimateFailures.incrementAndGet();
                        }
                        throw e;
                    }

                    // never back off less than the previous wait
                    long delay = Math.min(Math.max(previousDelay, calculateDelay(attempt, category)), maxDelayMs);
                    previousDelay = delay;
                    if (attempt == 1) {
                        retriedOperations.incrementAndGet();
                    }
                    totalRetries.incrementAndGet();
                    logger.warn("Operation {} ({}) failed on attempt {}/{}: {}; retrying in {}ms",
                        operationId, type, attempt, maxAttempts, e.getMessage(), delay);
                    sleep(delay, operationId);
                }
            }
        } finally {
            activeOperations.remove(operationId);
        }
    }

    private boolean shouldRetry(OperationType type, ErrorCategory category, int attempt) {
        return type.isIdempotent()
            && category != ErrorCategory.NON_RETRYABLE
            && attempt < maxAttempts;
    }

    private void sleep(long delay, String operationId) throws TransferCancelledException {
        try {
            clock.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Operation " + operationId + " interrupted during backoff");
        }
    }

    /**
     * Delay after the given failed attempt (1-based): base * 2^(attempt-1), capped.
     */
    public long calculateDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        return Math.min(baseDelayMs * (1L << exponent), maxDelayMs);
    }

    private long calculateDelay(int attempt, ErrorCategory category) {
        // rate limited endpoints get the full cool-down
        return category == ErrorCategory.RATE_LIMITED ? maxDelayMs : calculateDelay(attempt);
    }

    /**
     * Classify an error by status code when the transport reported one, otherwise by type and message.
     */
    public static ErrorCategory classify(IOException e) {
        if (e instanceof TransferCancelledException) {
            return ErrorCategory.NON_RETRYABLE;
        }
        if (e instanceof TransferException) {
            return ((TransferException) e).getCategory();
        }
        if (e instanceof InterruptedIOException || e instanceof ConnectException
                || e instanceof NoRouteToHostException || e instanceof UnknownHostException
                || e instanceof SocketException) {
            return ErrorCategory.RETRYABLE;
        }
        return ErrorCategory.fromMessage(e.getMessage());
    }

    /**
     * Cancel an operation waiting between attempts; it fails before its next attempt.
     *
     * @return whether an active operation with this id existed
     */
    public boolean cancelRetry(String operationId) {
        AtomicBoolean flag = activeOperations.get(operationId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        logger.debug("Cancelled retries of {}", operationId);
        return true;
    }

    public int getActiveOperationCount() {
        return activeOperations.size();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public RetryStatistics getStatistics() {
        Map<ErrorCategory, Long> distribution = new EnumMap<>(ErrorCategory.class);
        categoryCounts.forEach((category, count) -> distribution.put(category, count.get()));
        return new RetryStatistics(totalRetries.get(), successAfterRetry.get(), ultimateFailures.get(),
            retriedOperations.get(), distribution);
    }

    public void resetStatistics() {
        totalRetries.set(0);
        successAfterRetry.set(0);
        ultimateFailures.set(0);
        retriedOperations.set(0);
        categoryCounts.values().forEach(count -> count.set(0));
    }

    /**
     * Retry statistics for monitoring
     */
    public static class RetryStatistics {
        private final long totalRetries;
        private final long successAfterRetry;
        private final long ultimateFailures;
        private final long retriedOperations;
        private final Map<ErrorCategory, Long> categoryDistribution;

        public RetryStatistics(long totalRetries, long successAfterRetry, long ultimateFailures,
                               long retriedOperations, Map<ErrorCategory, Long> categoryDistribution) {
            this.totalRetries = totalRetries;
            this.successAfterRetry = successAfterRetry;
            this.ultimateFailures = ultimateFailures;
            this.retriedOperations = retriedOperations;
            this.categoryDistribution = categoryDistribution;
        }

        public long getTotalRetries() { return totalRetries; }
        public long getSuccessAfterRetry() { return successAfterRetry; }
        public long getUltimateFailures() { return ultimateFailures; }
        public Map<ErrorCategory, Long> getCategoryDistribution() { return categoryDistribution; }

        public double getAverageRetriesPerOperation() {
            return retriedOperations > 0 ? (double) totalRetries / retriedOperations : 0.0;
        }

        @Override
        public String toString() {
            return String.format("RetryStatistics{retries=%d, successAfterRetry=%d, ultimateFailures=%d, categories=%s}",
                totalRetries, successAfterRetry, ultimateFailures, categoryDistribution);
        }
    }
}

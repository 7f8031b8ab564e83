package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watchdog for one transfer session. On a fixed tick it scores the transfer from 0 to 100 and
 * notifies listeners when the score crosses the configured minimum.
 */
public class TransferHealthMonitor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(TransferHealthMonitor.class);

    public static final long DEFAULT_TICK_MS = 5000;
    public static final int DEFAULT_MIN_SCORE = 50;
    public static final long DEFAULT_STALL_THRESHOLD_MS = 30000;

    static final long SPEED_WINDOW_MS = 30000;
    static final long RETRY_GRACE_MS = 30000;
    static final long SPEED_GRACE_MS = 10000;
    static final long SLOW_TRANSFER_MS = 300000;
    static final int MAX_PAUSES = 5;

    private final long totalBytes;
    private final int totalChunks;
    private final TransferClock clock;
    private final long tickMs;
    private final int minScore;
    private final long stallThresholdMs;
    private final long startTime;

    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<long[]> speedWindow = new ArrayDeque<>();

    // guarded by this
    private long transferredBytes;
    private int completedChunks;
    private int failedChunks;
    private int retryCount;
    private int pauseCount;
    private long lastActivityTime;
    private double currentSpeedBps;
    private double averageSpeedBps;
    private boolean healthy = true;
    private int lastScore = 100;

    private ScheduledExecutorService scheduler;

    public TransferHealthMonitor(long totalBytes, int totalChunks, TransferClock clock) {
        this(totalBytes, totalChunks, clock, DEFAULT_TICK_MS, DEFAULT_MIN_SCORE, DEFAULT_STALL_THRESHOLD_MS);
    }

    public TransferHealthMonitor(long totalBytes, int totalChunks, TransferClock clock, long tickMs, int minScore,
                                 long stallThresholdMs) {
        this.totalBytes = totalBytes;
        this.totalChunks = totalChunks;
        this.clock = clock;
        this.tickMs = tickMs;
        this.minScore = minScore;
        this.stallThresholdMs = stallThresholdMs;
        this.startTime = clock.currentTimeMillis();
        this.lastActivityTime = startTime;
    }

    // Tick

    public synchronized void start() {
        if (scheduler != null || tickMs <= 0) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "transfer-health");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tickSafely, tickMs, tickMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            logger.debug("Health monitor stopped: {} of {} bytes, {} chunks, last score {}",
                transferredBytes, totalBytes, completedChunks, lastScore);
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.warn("Health evaluation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluate once and fire transition events.
     */
    public HealthSnapshot tick() {
        HealthSnapshot snapshot = evaluate();
        boolean degraded = false;
        boolean recovered = false;
        synchronized (this) {
            if (healthy && snapshot.getScore() < minScore) {
                healthy = false;
                degraded = true;
            } else if (!healthy && snapshot.getScore() >= minScore) {
                healthy = true;
                recovered = true;
            }
        }
        if (degraded) {
            logger.warn("Transfer health degraded to {}: {}", snapshot.getScore(), snapshot.getIssues());
        } else if (recovered) {
            logger.info("Transfer health recovered to {}", snapshot.getScore());
        }
        for (HealthListener listener : listeners) {
            try {
                if (degraded) {
                    listener.onHealthDegraded(snapshot);
                } else if (recovered) {
                    listener.onHealthRecovered(snapshot);
                }
                listener.onHealthCheck(snapshot);
            } catch (RuntimeException e) {
                logger.warn("Health listener failed: {}", e.getMessage(), e);
            }
        }
        return snapshot;
    }

    // Recording

    public synchronized void recordProgress(long transferred, int completed) {
        long now = clock.currentTimeMillis();
        if (transferred > transferredBytes) {
            transferredBytes = transferred;
            completedChunks = completed;
            lastActivityTime = now;
            speedWindow.addLast(new long[] {now, transferred});
            while (!speedWindow.isEmpty() && now - speedWindow.peekFirst()[0] > SPEED_WINDOW_MS) {
                speedWindow.pollFirst();
            }
            calculateSpeeds(now);
        }
    }

    public synchronized void recordChunkFailed() {
        failedChunks++;
    }

    public synchronized void recordRetry() {
        retryCount++;
    }

    public synchronized void recordPause() {
        pauseCount++;
    }

    private void calculateSpeeds(long now) {
        double windowSpeed = 0;
        if (speedWindow.size() >= 2) {
            long[] oldest = speedWindow.peekFirst();
            long[] latest = speedWindow.peekLast();
            long[] previous = null;
            for (long[] entry : speedWindow) {
                if (entry != latest) {
                    previous = entry;
                }
            }
            if (previous != null && latest[0] > previous[0]) {
                currentSpeedBps = (latest[1] - previous[1]) * 1000.0 / (latest[0] - previous[0]);
            }
            if (latest[0] > oldest[0]) {
                windowSpeed = (latest[1] - oldest[1]) * 1000.0 / (latest[0] - oldest[0]);
            }
        }
        long elapsed = now - startTime;
        double overall = elapsed > 0 ? transferredBytes * 1000.0 / elapsed : 0;
        averageSpeedBps = windowSpeed > 0 ? windowSpeed * 0.7 + overall * 0.3 : overall;
    }

    // Evaluation

    public synchronized HealthSnapshot evaluate() {
        long now = clock.currentTimeMillis();
        long elapsed = now - startTime;
        long idle = now - lastActivityTime;
        int score = 100;
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (idle > stallThresholdMs) {
            score -= 30;
            issues.add(String.format("Transfer stalled for %d seconds", idle / 1000));
            recommendations.add("Check the network connection and the remote endpoint");
        }

        int attempted = completedChunks + failedChunks;
        if (attempted > 0) {
            double failureRate = failedChunks * 100.0 / attempted;
            if (failureRate > 10) {
                score -= 20;
                issues.add(String.format("Chunk failure rate %.1f%%", failureRate));
                recommendations.add("Reduce the chunk size or increase the retry delay");
            }
        }

        if (elapsed > RETRY_GRACE_MS) {
            double retryRate = retryCount * 1000.0 / elapsed;
            if (retryRate > 0.5) {
                score -= 15;
                issues.add(String.format("Retrying %.2f times per second", retryRate));
                recommendations.add("Lower concurrency to reduce load on the endpoint");
            }
        }

        if (averageSpeedBps > 0 && elapsed > SPEED_GRACE_MS) {
            double projectedMs = totalBytes / averageSpeedBps * 1000;
            if (projectedMs > SLOW_TRANSFER_MS) {
                score -= 10;
                issues.add("Transfer is slow");
                recommendations.add("Check available bandwidth and endpoint performance");
            }
        }

        if (pauseCount > MAX_PAUSES) {
            score -= 10;
            issues.add(String.format("Paused %d times", pauseCount));
            recommendations.add("Check for resource contention on the client");
        }

        lastScore = Math.max(0, Math.min(100, score));
        return new HealthSnapshot(lastScore, issues, recommendations, now);
    }

    /**
     * Pause a caller may insert before the next chunk instead of aborting.
     */
    public long getSuggestedPauseMs() {
        int score = evaluate().getScore();
        if (score < 25) return 2000;
        if (score < 50) return 1000;
        if (score < 75) return 500;
        return 0;
    }

    public boolean shouldPause() {
        return evaluate().getScore() < minScore;
    }

    // Listeners

    public void register(HealthListener listener) {
        listeners.add(listener);
    }

    public void unregister(HealthListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    // Accessors

    public synchronized boolean isHealthy() { return healthy; }
    public synchronized long getTransferredBytes() { return transferredBytes; }
    public synchronized int getFailedChunks() { return failedChunks; }
    public synchronized int getRetryCount() { return retryCount; }
    public synchronized int getPauseCount() { return pauseCount; }
    public synchronized double getCurrentSpeedBps() { return currentSpeedBps; }
    public synchronized double getAverageSpeedBps() { return averageSpeedBps; }
    public int getTotalChunks() { return totalChunks; }
    public int getMinScore() { return minScore; }

    public synchronized long getEstimatedRemainingMs() {
        if (averageSpeedBps <= 0) {
            return -1;
        }
        return Math.round((totalBytes - transferredBytes) / averageSpeedBps * 1000);
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }
}

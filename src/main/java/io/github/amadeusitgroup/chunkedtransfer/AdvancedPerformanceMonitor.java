package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Performance monitor that periodically analyses its windows and derives an {@link AdaptiveConfig}
 * of batch sizes, timeouts and chunk sizes.
 */
public class AdvancedPerformanceMonitor extends PerformanceMonitor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(AdvancedPerformanceMonitor.class);

    public static final long DEFAULT_ANALYSIS_INTERVAL_MS = 30_000;
    static final int MIN_SAMPLES_FOR_ANALYSIS = 10;
    static final int ANALYSIS_SAMPLE_LIMIT = 100;
    private static final int TREND_WINDOW = 5;
    private static final int BOTTLENECK_THRESHOLD = 50;

    private final long analysisIntervalMs;
    private final AtomicReference<AdaptiveConfig> adaptiveConfig = new AtomicReference<>(AdaptiveConfig.defaults());
    private final Deque<Map<String, OperationAnalysis>> analysisHistory = new ArrayDeque<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private ScheduledExecutorService scheduler;

    public AdvancedPerformanceMonitor() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_ANALYSIS_INTERVAL_MS, TransferClock.SYSTEM);
    }

    public AdvancedPerformanceMonitor(int windowSize, long analysisIntervalMs, TransferClock clock) {
        super(windowSize, clock);
        this.analysisIntervalMs = analysisIntervalMs;
    }

    public static AdvancedPerformanceMonitor fromConfiguration(ConfigurationManager config, TransferClock clock) {
        return new AdvancedPerformanceMonitor(
            config.getInt("monitor.windowSize", DEFAULT_WINDOW_SIZE),
            config.getLong("monitor.analysisIntervalMs", DEFAULT_ANALYSIS_INTERVAL_MS),
            clock);
    }

    // Scheduling

    public synchronized void start() {
        if (scheduler != null || analysisIntervalMs <= 0) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "performance-analysis");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::analyzeSafely, analysisIntervalMs, analysisIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started performance analysis every {}ms", analysisIntervalMs);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            logger.debug("Stopped performance analysis");
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public void close() {
        stop();
    }

    private void analyzeSafely() {
        try {
            analyzeNow();
        } catch (RuntimeException e) {
            logger.warn("Performance analysis failed: {}", e.getMessage(), e);
        }
    }

    // Analysis

    /**
     * Analyse every key with enough samples and publish the resulting adaptive configuration.
     *
     * @return the analyses of this pass, by operation key
     */
    public Map<String, OperationAnalysis> analyzeNow() {
        Map<String, OperationAnalysis> current = new HashMap<>();
        for (String key : getOperationKeys()) {
            List<PerformanceSample> samples = getSamples(key);
            if (samples.size() < MIN_SAMPLES_FOR_ANALYSIS) {
                continue;
            }
            current.put(key, analyze(key, samples));
        }

        synchronized (analysisHistory) {
            analysisHistory.addLast(current);
            if (analysisHistory.size() > TREND_WINDOW) {
                analysisHistory.pollFirst();
            }
        }

        applyAnalysis(current.values());
        logger.debug("Performance analysis complete for {} operation keys", current.size());
        return current;
    }

    OperationAnalysis analyze(String key, List<PerformanceSample> samples) {
        List<PerformanceSample> recent = samples.size() > ANALYSIS_SAMPLE_LIMIT
            ? samples.subList(samples.size() - ANALYSIS_SAMPLE_LIMIT, samples.size())
            : samples;
        OperationStatistics statistics = OperationStatistics.from(key, recent);
        int score = calculateBottleneckScore(statistics.getAverageDurationMs(),
            1.0 - statistics.getSuccessRate(), statistics.getP95());
        return new OperationAnalysis(statistics, mapToOperationClass(key), score);
    }

    private void applyAnalysis(Iterable<OperationAnalysis> analyses) {
        AdaptiveConfig previous = adaptiveConfig.get();
        AdaptiveConfig updated = previous;
        for (OperationAnalysis analysis : analyses) {
            String operationClass = analysis.getOperationClass();
            AdaptiveConfig.OperationSettings current = updated.getSettings(operationClass);
            int batchSize = calculateOptimalBatchSize(analysis, current.getBatchSize());
            long timeout = calculateOptimalTimeout(analysis.getStatistics());
            if (batchSize != current.getBatchSize() || timeout != current.getTimeoutMs()) {
                updated = updated.withSettings(operationClass, current.withBatchAndTimeout(batchSize, timeout));
                logger.info("Adaptive settings for {}: batch {} -> {}, timeout {}ms -> {}ms", operationClass,
                    current.getBatchSize(), batchSize, current.getTimeoutMs(), timeout);
            }
        }
        if (updated != previous) {
            adaptiveConfig.set(updated);
        }
    }

    /**
     * Weighted bottleneck score in [0, 100]: average latency bucket (up to 40), failure rate
     * fraction (35) and p95 latency bucket (up to 25).
     */
    static int calculateBottleneckScore(double averageDurationMs, double failureRate, long p95) {
        double score = 0;
        if (averageDurationMs > 5000) {
            score += 40;
        } else if (averageDurationMs > 2000) {
            score += 25;
        } else if (averageDurationMs > 1000) {
            score += 10;
        }

        score += failureRate * 35;

        if (p95 > 10000) {
            score += 25;
        } else if (p95 > 5000) {
            score += 15;
        } else if (p95 > 2000) {
            score += 8;
        }
        return (int) Math.min(100, Math.round(score));
    }

    /**
     * Nudge the live batch size of an operation class up for fast, reliable operations and down for
     * slow or failing ones.
     */
    static int calculateOptimalBatchSize(OperationAnalysis analysis, int currentBatchSize) {
        OperationStatistics stats = analysis.getStatistics();
        int baseSize = currentBatchSize;

        double multiplier = 1.0;
        if (stats.getAverageDurationMs() < 500 && stats.getSuccessRate() > 0.95) {
            multiplier = 1.5;
        } else if (stats.getAverageDurationMs() > 2000 || stats.getSuccessRate() < 0.9) {
            multiplier = 0.7;
        }
        if (stats.getAverageDataSize() > 100 * 1024) {
            multiplier *= 0.8;
        }
        long size = Math.round(baseSize * multiplier);
        return (int) Math.max(AdaptiveConfig.MIN_BATCH_SIZE, Math.min(AdaptiveConfig.MAX_BATCH_SIZE, size));
    }

    static long calculateOptimalTimeout(OperationStatistics stats) {
        long baseTimeout = Math.max(AdaptiveConfig.MIN_TIMEOUT_MS, stats.getP95() * 2);
        double failureRate = 1.0 - stats.getSuccessRate();
        if (failureRate > 0.1) {
            return Math.min(AdaptiveConfig.MAX_TIMEOUT_MS, Math.round(baseTimeout * 1.5));
        }
        return Math.min(30000, baseTimeout);
    }

    /**
     * Map an operation key such as {@code DOWNLOAD_CHUNK} to its tuning class.
     */
    public static String mapToOperationClass(String operationKey) {
        String key = operationKey.toUpperCase(Locale.ROOT);
        if (key.contains("LIST") || key.contains("INFO") || key.contains("STAT")) {
            return AdaptiveConfig.DIRECTORY_OPS;
        }
        if (key.contains("UPLOAD") || key.contains("DOWNLOAD") || key.contains("CHUNK")) {
            return AdaptiveConfig.FILE_TRANSFER;
        }
        if (key.contains("DELETE") || key.contains("RENAME") || key.contains("FINALIZE")) {
            return AdaptiveConfig.FILE_MODIFY;
        }
        return AdaptiveConfig.DEFAULT_CLASS;
    }

    // Recommendations

    public AdaptiveConfig getAdaptiveConfig() {
        return adaptiveConfig.get();
    }

    /**
     * Chunk size for a payload: bucket default scaled by network quality, clamped to the planner range.
     */
    public int getOptimalChunkSize(long totalBytes, NetworkQuality quality) {
        NetworkQuality effective = quality != null ? quality : NetworkQuality.MEDIUM;
        int base = adaptiveConfig.get().getBucketChunkSize(AdaptiveConfig.PayloadBucket.forSize(totalBytes));
        return TransferPlanner.clamp(Math.round(base * effective.getMultiplier()));
    }

    public int getOptimalBatchSize(String operationKey) {
        return adaptiveConfig.get().getSettings(mapToOperationClass(operationKey)).getBatchSize();
    }

    public long getOptimalTimeout(String operationKey) {
        return adaptiveConfig.get().getSettings(mapToOperationClass(operationKey)).getTimeoutMs();
    }

    /**
     * Current analysis of one key, or null when it has fewer samples than an analysis needs.
     */
    public OperationAnalysis getBottleneckAnalysis(String operationKey) {
        List<PerformanceSample> samples = getSamples(operationKey);
        if (samples.size() < MIN_SAMPLES_FOR_ANALYSIS) {
            return null;
        }
        return analyze(operationKey, samples);
    }

    public OptimizationReport generateOptimizationReport() {
        List<Bottleneck> bottlenecks = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        long totalRequests = 0;
        double totalResponseTime = 0;
        double totalSuccesses = 0;
        double totalBinary = 0;
        double totalCacheHits = 0;

        for (String key : getOperationKeys()) {
            List<PerformanceSample> samples = getSamples(key);
            if (samples.isEmpty()) {
                continue;
            }
            OperationAnalysis analysis = analyze(key, samples);
            OperationStatistics stats = analysis.getStatistics();
            totalRequests += stats.getTotalCount();
            totalResponseTime += stats.getAverageDurationMs() * stats.getTotalCount();
            totalSuccesses += stats.getSuccessCount();
            totalBinary += stats.getBinaryRatio() * stats.getTotalCount();
            totalCacheHits += stats.getCacheHitRate() * stats.getTotalCount();

            if (analysis.getBottleneckScore() > BOTTLENECK_THRESHOLD) {
                bottlenecks.add(new Bottleneck(key, identifyMainIssue(stats),
                    analysis.getBottleneckScore() > 75 ? "high" : "medium",
                    suggestFix(stats), stats.getAverageDurationMs(), 1.0 - stats.getSuccessRate()));
            }
            recommendations.addAll(recommend(key, stats));
        }

        bottlenecks.sort(Comparator.comparingDouble(Bottleneck::getAverageLatencyMs).reversed());
        List<Bottleneck> top = bottlenecks.size() > 5 ? bottlenecks.subList(0, 5) : bottlenecks;

        double averageResponseTime = totalRequests > 0 ? totalResponseTime / totalRequests : 0;
        double successRate = totalRequests > 0 ? totalSuccesses / totalRequests : 1.0;
        int healthScore = calculateHealthScore(averageResponseTime, successRate, bottlenecks.size());

        return new OptimizationReport(clock.currentTimeMillis(), totalRequests, averageResponseTime, successRate,
            totalRequests > 0 ? totalBinary / totalRequests : 0,
            totalRequests > 0 ? totalCacheHits / totalRequests : 0,
            healthScore, new ArrayList<>(top), recommendations, analyzeTrend());
    }

    public String exportReportAsJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(generateOptimizationReport());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize optimization report", e);
        }
    }

    static int calculateHealthScore(double averageResponseTime, double successRate, int bottleneckCount) {
        double score = 100;
        if (averageResponseTime > 5000) {
            score -= 30;
        } else if (averageResponseTime > 2000) {
            score -= 15;
        } else if (averageResponseTime > 1000) {
            score -= 5;
        }
        score -= (1 - successRate) * 40;
        score -= bottleneckCount * 10;
        return (int) Math.max(0, Math.round(score));
    }

    private static String identifyMainIssue(OperationStatistics stats) {
        if (stats.getSuccessRate() < 0.9) return "High failure rate";
        if (stats.getAverageDurationMs() > 5000) return "High latency";
        if (stats.getBinaryRatio() < 0.5) return "Inefficient wire format";
        if (stats.getCacheHitRate() < 0.5) return "Poor cache performance";
        return "Performance degradation";
    }

    private static String suggestFix(OperationStatistics stats) {
        if (stats.getSuccessRate() < 0.9) return "Review error handling and retry policy";
        if (stats.getAverageDurationMs() > 5000) return "Reduce chunk size or increase concurrency";
        if (stats.getBinaryRatio() < 0.5) return "Prefer the binary wire format for this operation";
        if (stats.getCacheHitRate() < 0.5) return "Cache capability and metadata lookups";
        return "Review transport configuration";
    }

    private static List<String> recommend(String key, OperationStatistics stats) {
        List<String> result = new ArrayList<>();
        String lower = key.toLowerCase(Locale.ROOT);
        if (stats.getBinaryRatio() < 0.5 && (lower.contains("chunk") || lower.contains("load"))) {
            result.add("Use the binary wire format for " + key);
        }
        if (stats.getCacheHitRate() < 0.6 && stats.getAverageDurationMs() > 1000) {
            result.add("Increase caching for " + key);
        }
        if (stats.getAverageDataSize() < 10 * 1024 && stats.getAverageDurationMs() > 500) {
            result.add("Batch small requests for " + key);
        }
        return result;
    }

    private String analyzeTrend() {
        Map<String, OperationAnalysis> recent;
        Map<String, OperationAnalysis> previous;
        synchronized (analysisHistory) {
            if (analysisHistory.size() < 2) {
                return "stable";
            }
            List<Map<String, OperationAnalysis>> history = new ArrayList<>(analysisHistory);
            recent = history.get(history.size() - 1);
            previous = history.get(history.size() - 2);
        }
        double totalChange = 0;
        int count = 0;
        for (Map.Entry<String, OperationAnalysis> entry : recent.entrySet()) {
            OperationAnalysis before = previous.get(entry.getKey());
            if (before == null || before.getStatistics().getAverageDurationMs() <= 0) {
                continue;
            }
            double now = entry.getValue().getStatistics().getAverageDurationMs();
            double then = before.getStatistics().getAverageDurationMs();
            totalChange += (now - then) / then * 100;
            count++;
        }
        if (count == 0) {
            return "stable";
        }
        double averageChange = totalChange / count;
        if (averageChange < -5) {
            return "improving";
        }
        return averageChange > 5 ? "degrading" : "stable";
    }

    /**
     * Statistics of one key together with its class and bottleneck score.
     */
    public static class OperationAnalysis {
        private final OperationStatistics statistics;
        private final String operationClass;
        private final int bottleneckScore;

        OperationAnalysis(OperationStatistics statistics, String operationClass, int bottleneckScore) {
            this.statistics = statistics;
            this.operationClass = operationClass;
            this.bottleneckScore = bottleneckScore;
        }

        public OperationStatistics getStatistics() { return statistics; }
        public String getOperationClass() { return operationClass; }
        public int getBottleneckScore() { return bottleneckScore; }

        @Override
        public String toString() {
            return String.format("OperationAnalysis{%s, class=%s, bottleneck=%d}",
                statistics, operationClass, bottleneckScore);
        }
    }

    public static class Bottleneck {
        private final String operation;
        private final String issue;
        private final String impact;
        private final String suggestion;
        private final double averageLatencyMs;
        private final double failureRate;

        Bottleneck(String operation, String issue, String impact, String suggestion,
                   double averageLatencyMs, double failureRate) {
            this.operation = operation;
            this.issue = issue;
            this.impact = impact;
            this.suggestion = suggestion;
            this.averageLatencyMs = averageLatencyMs;
            this.failureRate = failureRate;
        }

        public String getOperation() { return operation; }
        public String getIssue() { return issue; }
        public String getImpact() { return impact; }
        public String getSuggestion() { return suggestion; }
        public double getAverageLatencyMs() { return averageLatencyMs; }
        public double getFailureRate() { return failureRate; }
    }

    public static class OptimizationReport {
        private final long timestamp;
        private final long totalRequests;
        private final double averageResponseTimeMs;
        private final double successRate;
        private final double binaryUsage;
        private final double cacheHitRate;
        private final int overallHealthScore;
        private final List<Bottleneck> topBottlenecks;
        private final List<String> recommendations;
        private final String performanceTrend;

        OptimizationReport(long timestamp, long totalRequests, double averageResponseTimeMs, double successRate,
                           double binaryUsage, double cacheHitRate, int overallHealthScore,
                           List<Bottleneck> topBottlenecks, List<String> recommendations, String performanceTrend) {
            this.timestamp = timestamp;
            this.totalRequests = totalRequests;
            this.averageResponseTimeMs = averageResponseTimeMs;
            this.successRate = successRate;
            this.binaryUsage = binaryUsage;
            this.cacheHitRate = cacheHitRate;
            this.overallHealthScore = overallHealthScore;
            this.topBottlenecks = Collections.unmodifiableList(topBottlenecks);
            this.recommendations = Collections.unmodifiableList(recommendations);
            this.performanceTrend = performanceTrend;
        }

        public long getTimestamp() { return timestamp; }
        public long getTotalRequests() { return totalRequests; }
        public double getAverageResponseTimeMs() { return averageResponseTimeMs; }
        public double getSuccessRate() { return successRate; }
        public double getBinaryUsage() { return binaryUsage; }
        public double getCacheHitRate() { return cacheHitRate; }
        public int getOverallHealthScore() { return overallHealthScore; }
        public List<Bottleneck> getTopBottlenecks() { return topBottlenecks; }
        public List<String> getRecommendations() { return recommendations; }
        public String getPerformanceTrend() { return performanceTrend; }

        @Override
        public String toString() {
            return String.format("OptimizationReport{requests=%d, avg=%.1fms, success=%.2f, health=%d, bottlenecks=%d, trend=%s}",
                totalRequests, averageResponseTimeMs, successRate, overallHealthScore, topBottlenecks.size(),
                performanceTrend);
        }
    }
}

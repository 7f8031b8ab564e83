package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMonitor.
 */
public class PerformanceMonitorTest {

    private FakeClock clock;
    private PerformanceMonitor monitor;

    @BeforeEach
    public void setUp() {
        clock = new FakeClock();
        monitor = new PerformanceMonitor(5, clock);
    }

    @Test
    public void testWindowEvictsOldestSample() {
        for (int i = 1; i <= 7; i++) {
            monitor.record("op", i * 10L, true, 100);
        }

        List<PerformanceSample> samples = monitor.getSamples("op");
        assertEquals(5, samples.size(), "Window should be capped");
        assertEquals(30, samples.get(0).getDurationMs(), "Two oldest samples should be evicted");
        assertEquals(70, samples.get(4).getDurationMs(), "Newest sample should be last");
    }

    @Test
    public void testStatistics() {
        monitor.record(new PerformanceSample("op", 10, true, 100, WireFormat.BINARY, true, clock.currentTimeMillis()));
        monitor.record(new PerformanceSample("op", 20, true, 200, WireFormat.TEXT, false, clock.currentTimeMillis()));
        monitor.record(new PerformanceSample("op", 30, false, 300, WireFormat.BINARY, false, clock.currentTimeMillis()));
        monitor.record(new PerformanceSample("op", 40, true, 400, WireFormat.TEXT, true, clock.currentTimeMillis()));

        PerformanceMonitor.OperationStatistics stats = monitor.getStatistics("op");

        assertEquals(4, stats.getTotalCount(), "Four samples");
        assertEquals(1, stats.getFailureCount(), "One failure");
        assertEquals(0.75, stats.getSuccessRate(), 0.0001, "Success rate");
        assertEquals(25.0, stats.getAverageDurationMs(), 0.0001, "Average duration");
        assertEquals(10, stats.getMinDurationMs(), "Min duration");
        assertEquals(40, stats.getMaxDurationMs(), "Max duration");
        assertEquals(250.0, stats.getAverageDataSize(), 0.0001, "Average size");
        assertEquals(0.5, stats.getCacheHitRate(), 0.0001, "Cache hit rate");
        assertEquals(0.5, stats.getBinaryRatio(), 0.0001, "Binary ratio");
    }

    @Test
    public void testNearestRankPercentiles() {
        PerformanceMonitor large = new PerformanceMonitor(1000, clock);
        for (int i = 100; i >= 1; i--) {
            large.record("op", i, true, 0);
        }

        PerformanceMonitor.OperationStatistics stats = large.getStatistics("op");

        assertEquals(50, stats.getP50(), "p50 of 1..100");
        assertEquals(95, stats.getP95(), "p95 of 1..100");
        assertEquals(99, stats.getP99(), "p99 of 1..100");
    }

    @Test
    public void testPercentileOfSmallSets() {
        assertEquals(0, PerformanceMonitor.percentile(new long[0], 50), "Empty set");
        assertEquals(7, PerformanceMonitor.percentile(new long[] {7}, 99), "Single value");
        assertEquals(2, PerformanceMonitor.percentile(new long[] {1, 2, 3}, 50), "Median of three");
        assertEquals(3, PerformanceMonitor.percentile(new long[] {1, 2, 3}, 95), "p95 of three");
    }

    @Test
    public void testUnknownKey() {
        assertNull(monitor.getStatistics("missing"), "No statistics without samples");
        assertEquals(0, monitor.getSampleCount("missing"), "No samples");
        assertTrue(monitor.getSamples("missing").isEmpty(), "Empty window");
    }

    @Test
    public void testStartAndEndOperation() {
        String handle = monitor.startOperation("download");
        assertEquals(1, monitor.getActiveOperationCount(), "Operation should be active");
        clock.advance(250);

        PerformanceSample sample = monitor.endOperation(handle, true, 4096);

        assertEquals(250, sample.getDurationMs(), "Duration from the clock");
        assertEquals(4096, sample.getDataSize(), "Size recorded");
        assertEquals(0, monitor.getActiveOperationCount(), "Operation should be finished");
        assertNull(monitor.endOperation(handle, true), "Unknown handle yields null");
    }

    @Test
    public void testMeasureRecordsFailures() {
        assertThrows(IOException.class, () -> monitor.measure("upload", () -> {
            clock.advance(40);
            throw new IOException("boom");
        }), "Exception should be rethrown");

        PerformanceSample sample = monitor.getSamples("upload").get(0);
        assertFalse(sample.isSuccess(), "Failure recorded");
        assertEquals(40, sample.getDurationMs(), "Duration recorded");
    }

    @Test
    public void testMeasureReturnsResult() throws Exception {
        assertEquals("done", monitor.measure("upload", () -> "done"), "Result should pass through");
        assertTrue(monitor.getSamples("upload").get(0).isSuccess(), "Success recorded");
    }

    @Test
    public void testReportAndJsonExport() throws IOException {
        monitor.record("b-op", 10, true, 1);
        monitor.record("a-op", 20, false, 2);

        String report = monitor.generateReport();
        assertTrue(report.indexOf("a-op") < report.indexOf("b-op"), "Keys should be sorted in the report");

        JsonNode json = new ObjectMapper().readTree(monitor.exportStatisticsAsJson());
        assertEquals(1, json.get("a-op").get("totalCount").asInt(), "JSON should carry statistics");
        assertEquals(0.0, json.get("a-op").get("successRate").asDouble(), 0.0001, "Success rate in JSON");
    }

    @Test
    public void testInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new PerformanceMonitor(0, clock), "Window must be positive");
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AdaptiveSizer.
 */
public class AdaptiveSizerTest {

    private static final int MIB = 1024 * 1024;

    @Test
    public void testFastChunkGrowsSize() {
        AdaptiveSizer sizer = new AdaptiveSizer(1000 * 1024);
        // 2 MiB in 100ms is 20 MiB/s
        int size = sizer.recordChunk(2L * MIB, 100);
        assertEquals(1200 * 1024, size, "Fast chunks should grow the size by 20%");
        assertEquals(1, sizer.getAdjustmentCount(), "One adjustment should be counted");
    }

    @Test
    public void testSlowChunkShrinksSize() {
        AdaptiveSizer sizer = new AdaptiveSizer(1000 * 1024);
        // 512 KiB in 1s is below 1 MiB/s
        assertEquals(800 * 1024, sizer.recordChunk(512 * 1024, 1000), "Slow chunks should shrink the size by 20%");
    }

    @Test
    public void testLongChunkShrinksSize() {
        AdaptiveSizer sizer = new AdaptiveSizer(1000 * 1024);
        assertEquals(800 * 1024, sizer.recordChunk(100L * MIB, 6000), "Chunks over 5s should shrink the size");
    }

    @Test
    public void testModerateChunkKeepsSize() {
        AdaptiveSizer sizer = new AdaptiveSizer(256 * 1024);
        // 5 MiB/s for 2s is neither fast nor slow
        assertEquals(256 * 1024, sizer.recordChunk(10L * MIB, 2000), "Moderate throughput should keep the size");
        assertEquals(0, sizer.getAdjustmentCount(), "No adjustment expected");
    }

    @Test
    public void testZeroDurationLeavesSizeUnchanged() {
        AdaptiveSizer sizer = new AdaptiveSizer(256 * 1024);
        assertEquals(256 * 1024, sizer.recordChunk(MIB, 0), "Zero duration should not change the size");
        assertEquals(256 * 1024, sizer.recordChunk(0, 10), "Zero bytes should not change the size");
    }

    @ParameterizedTest
    @CsvSource({
        "2097152, 1",
        "2097152, 999",
        "1, 100000",
        "9223372036854775807, 1",
        "1, 9223372036854775807"
    })
    public void testSizeAlwaysWithinBounds(long bytes, long durationMs) {
        AdaptiveSizer sizer = new AdaptiveSizer(TransferPlanner.DEFAULT_CHUNK_SIZE);
        for (int i = 0; i < 50; i++) {
            int size = sizer.recordChunk(bytes, durationMs);
            assertTrue(size >= TransferPlanner.MIN_CHUNK_SIZE && size <= TransferPlanner.MAX_CHUNK_SIZE,
                "Size " + size + " escaped the supported range");
        }
    }

    @Test
    public void testRepeatedGrowthStopsAtMaximum() {
        AdaptiveSizer sizer = new AdaptiveSizer(TransferPlanner.MAX_CHUNK_SIZE);
        assertEquals(TransferPlanner.MAX_CHUNK_SIZE, sizer.recordChunk(2L * MIB, 10), "Should stay at the maximum");
        assertEquals(0, sizer.getAdjustmentCount(), "Clamped growth is not an adjustment");
    }

    @Test
    public void testSeedIsClamped() {
        assertEquals(TransferPlanner.MIN_CHUNK_SIZE, new AdaptiveSizer(10).getCurrentChunkSize(),
            "Seed below the minimum should be clamped");
    }

    @Test
    public void testClassify() {
        assertEquals(AdaptiveSizer.Adjustment.GROW, AdaptiveSizer.classify(20.0 * MIB, 500), "Fast and short");
        assertEquals(AdaptiveSizer.Adjustment.KEEP, AdaptiveSizer.classify(20.0 * MIB, 1500), "Fast but not short");
        assertEquals(AdaptiveSizer.Adjustment.SHRINK, AdaptiveSizer.classify(0.5 * MIB, 500), "Slow");
    }
}

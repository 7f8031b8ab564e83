package io.github.amadeusitgroup.chunkedtransfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransferPlanner.
 */
public class TransferPlannerTest {

    private final TransferPlanner planner = new TransferPlanner();

    @ParameterizedTest
    @CsvSource({
        "1, 1",
        "1000, 1",
        "1000, 7",
        "1048576, 262144",
        "10485760, 1048576",
        "10485761, 1048576",
        "5000000, 32768"
    })
    public void testPlanIsContiguousAndCoversPayload(long totalBytes, int chunkSize) {
        List<ChunkDescriptor> chunks = planner.plan(totalBytes, chunkSize);

        assertEquals((totalBytes + chunkSize - 1) / chunkSize, chunks.size(), "Chunk count should be ceil(total/size)");
        long expectedStart = 0;
        long sum = 0;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkDescriptor chunk = chunks.get(i);
            assertEquals(i, chunk.getIndex(), "Indexes should follow plan order");
            assertEquals(expectedStart, chunk.getStart(), "Chunk " + i + " should start where the previous one ended");
            assertTrue(chunk.getSize() > 0 && chunk.getSize() <= chunkSize, "Chunk " + i + " size out of range");
            assertEquals(ChunkStatus.PENDING, chunk.getStatus(), "Planned chunks should be pending");
            expectedStart = chunk.getEnd();
            sum += chunk.getSize();
        }
        assertEquals(totalBytes, sum, "Chunk sizes should sum to the payload size");
        assertEquals(totalBytes, chunks.get(chunks.size() - 1).getEnd(), "Last chunk should end at the payload end");
    }

    @Test
    public void testPlanRejectsEmptyPayload() {
        InvalidPayloadSizeException e = assertThrows(InvalidPayloadSizeException.class, () -> planner.plan(0, 1024));
        assertEquals(0, e.getTotalBytes(), "Exception should carry the rejected size");
        assertThrows(InvalidPayloadSizeException.class, () -> planner.plan(-5, 1024),
            "Negative sizes should be rejected");
    }

    @Test
    public void testPlanRejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> planner.plan(100, 0), "Zero chunk size should be rejected");
    }

    @Test
    public void testTenMebibytesInOneMebibyteChunks() {
        List<ChunkDescriptor> chunks = planner.plan(10L * 1024 * 1024, 1024 * 1024);
        assertEquals(10, chunks.size(), "10 MiB at 1 MiB should be 10 chunks");
        assertEquals(3L * 1024 * 1024, chunks.get(3).getStart(), "Chunk 3 should start at 3 MiB");
        assertEquals(4L * 1024 * 1024 - 1, chunks.get(3).getEndInclusive(), "Range end should be inclusive");
    }

    @Test
    public void testInitialChunkSizeScalesWithNetworkQuality() {
        assertEquals(TransferPlanner.DEFAULT_CHUNK_SIZE,
            planner.initialChunkSize(1000, null, NetworkQuality.MEDIUM, false), "Medium should keep the default");
        assertEquals(384 * 1024, planner.initialChunkSize(1000, null, NetworkQuality.FAST, false),
            "Fast should scale by 1.5");
        assertEquals(128 * 1024, planner.initialChunkSize(1000, null, NetworkQuality.SLOW, false),
            "Slow should scale by 0.5");
        assertEquals(TransferPlanner.DEFAULT_CHUNK_SIZE, planner.initialChunkSize(1000, null, null, false),
            "Missing quality should act as medium");
    }

    @Test
    public void testInitialChunkSizeIsClamped() {
        assertEquals(TransferPlanner.MAX_CHUNK_SIZE,
            planner.initialChunkSize(1000, 4 * 1024 * 1024, NetworkQuality.FAST, false), "Should clamp to the maximum");
        assertEquals(TransferPlanner.MIN_CHUNK_SIZE,
            planner.initialChunkSize(1000, 1024, NetworkQuality.SLOW, false), "Should clamp to the minimum");
    }

    @Test
    public void testInitialChunkSizeHonoursConfiguredBounds() {
        assertEquals(128 * 1024, planner.initialChunkSize(1000, 1024 * 1024, NetworkQuality.MEDIUM, false,
            64 * 1024, 128 * 1024), "Should clamp to the configured maximum");
        assertEquals(64 * 1024, planner.initialChunkSize(1000, 40 * 1024, NetworkQuality.MEDIUM, false,
            64 * 1024, 128 * 1024), "Should clamp to the configured minimum");
    }

    @Test
    public void testRecommendationOnlyWithoutExplicitChunkSize() {
        AdvancedPerformanceMonitor monitor = new AdvancedPerformanceMonitor();
        TransferPlanner withMonitor = new TransferPlanner(monitor);

        assertEquals(64 * 1024, withMonitor.initialChunkSize(1000, null, NetworkQuality.MEDIUM, true),
            "Small payloads should use the small bucket recommendation");
        assertEquals(1024 * 1024, withMonitor.initialChunkSize(200L * 1024 * 1024, null, NetworkQuality.MEDIUM, true),
            "Large payloads should use the large bucket recommendation");
        assertEquals(512 * 1024, withMonitor.initialChunkSize(200L * 1024 * 1024, 512 * 1024, NetworkQuality.MEDIUM, true),
            "An explicit chunk size should win over the recommendation");
        assertEquals(TransferPlanner.DEFAULT_CHUNK_SIZE, withMonitor.initialChunkSize(1000, null, NetworkQuality.MEDIUM, false),
            "Recommendation should be ignored when disabled");
    }
}

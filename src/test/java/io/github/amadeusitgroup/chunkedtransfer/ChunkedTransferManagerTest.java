package io.github.amadeusitgroup.chunkedtransfer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session-level scenarios of ChunkedTransferManager over an in-memory transport.
 */
public class ChunkedTransferManagerTest {

    private static final int MIB = 1024 * 1024;
    private static final String ENDPOINT = "http://files.example.com";

    private FakeClock clock;
    private FakeTransport transport;
    private ConnectionPool pool;
    private ChunkedTransferManager manager;

    private byte[] payload;
    private final Set<Long> failingOffsets = ConcurrentHashMap.newKeySet();
    private final AtomicInteger concurrentRanges = new AtomicInteger();
    private final AtomicInteger maxConcurrentRanges = new AtomicInteger();
    private boolean advertiseRanges = true;
    private long advertisedLength = -1;
    private boolean base64ContentMd5;
    private final Set<Long> corruptOnceOffsets = ConcurrentHashMap.newKeySet();

    // upload side
    private final WireCodec codec = new WireCodec();
    private final ChecksumHandler checksumHandler = new ChecksumHandler();
    private final Map<Integer, byte[]> receivedChunks = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicInteger> chunkPosts = new ConcurrentHashMap<>();
    private final Set<Integer> rejectedChunks = ConcurrentHashMap.newKeySet();
    private volatile UploadFinalizeMessage finalizeMessage;

    @BeforeEach
    public void setUp() {
        clock = new FakeClock();
        payload = AssemblyStageTest.payload(10 * MIB);
        transport = new FakeTransport(this::handle);
        pool = new ConnectionPool(key -> transport, clock, ConnectionPool.DEFAULT_IDLE_TTL_MS, 0);
        CapabilityNegotiator negotiator = new CapabilityNegotiator(pool, clock, 300000, 3, 5000);
        manager = new ChunkedTransferManager(pool, negotiator, new RetryManager(3, 1000, 10000, clock),
            new AdvancedPerformanceMonitor(1000, 0, clock), clock, 0, 50, 30000);
    }

    @AfterEach
    public void tearDown() {
        manager.close();
        pool.close();
    }

    @Test
    public void testTenMebibyteDownloadSucceeds() {
        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(4))
            .build());

        assertTrue(result.isSuccess(), "Download should succeed: " + result);
        assertEquals(10, result.getChunksCompleted(), "Exactly 10 chunks should complete");
        assertEquals(0, result.getChunksFailed(), "No chunk should fail");
        assertEquals(10L * MIB, result.getBytesTransferred(), "All bytes should be transferred");
        assertArrayEquals(payload, result.getData(), "Artifact should match the remote resource");
        assertTrue(maxConcurrentRanges.get() <= 4, "At most 4 ranges in flight, saw " + maxConcurrentRanges.get());
        assertEquals(10, manager.getPerformanceMonitor().getSampleCount(ChunkedTransferManager.DOWNLOAD_CHUNK_KEY),
            "One sample per completed chunk");
        assertEquals(0, pool.getEntryStats(ENDPOINT).getReferenceCount(), "Transport should be released");
    }

    @Test
    public void testOneFailingChunkFailsSession() {
        failingOffsets.add(3L * MIB);

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(4))
            .build());

        assertEquals(TransferResult.Outcome.FAILED, result.getOutcome(), "Session should fail");
        assertEquals(1, result.getChunksFailed(), "Exactly one chunk should fail");
        assertEquals(9, result.getChunksCompleted(), "The other nine should complete");
        assertEquals(3, result.getRetryCount(), "Failing chunk should use all retries");
        assertNull(result.getData(), "No partial artifact");
        assertTrue(result.getError() instanceof SessionFailedException, "Error should be the aggregate");
        assertEquals(1, manager.getStats().getSessionsFailed(), "Failure should be counted");
    }

    @Test
    public void testProgressIsReported() {
        AtomicInteger events = new AtomicInteger();
        double[] lastPercent = new double[1];

        manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(2))
            .progressListener((loaded, total, percent) -> {
                events.incrementAndGet();
                synchronized (lastPercent) {
                    lastPercent[0] = Math.max(lastPercent[0], percent);
                }
            })
            .build());

        assertEquals(10, events.get(), "One progress event per chunk");
        assertEquals(100.0, lastPercent[0], 0.001, "Progress should reach 100%");
    }

    @Test
    public void testFallsBackToSingleRequestWithoutRangeSupport() {
        advertiseRanges = false;

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(4))
            .build());

        assertTrue(result.isSuccess(), "Fallback download should succeed");
        assertEquals(1, result.getChunksCompleted(), "Fallback is reported as one chunk");
        assertArrayEquals(payload, result.getData(), "Artifact should match the remote resource");
        assertTrue(transport.getRequests().stream().noneMatch(r -> r.getHeader("Range") != null),
            "No range requests expected");
    }

    @Test
    public void testChunkSizeBoundsLimitPlannedChunks() {
        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(4).toBuilder().chunkSizeBounds(64 * 1024, MIB / 2).build())
            .build());

        assertTrue(result.isSuccess(), "Download should succeed");
        assertEquals(20, result.getChunksCompleted(), "Chunks should be capped at half a mebibyte");
        assertArrayEquals(payload, result.getData(), "Artifact should match the remote resource");
    }

    @Test
    public void testOversizedRangedDownloadIsRejectedBeforeFetching() {
        advertisedLength = 3L * 1024 * MIB;

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/huge.bin")
            .options(options(4))
            .build());

        assertEquals(TransferResult.Outcome.FAILED, result.getOutcome(), "Oversized download should fail");
        assertTrue(result.getError().getMessage().contains("too large"), "Error should name the size problem");
        assertEquals(0, result.getChunksCompleted(), "No chunk should be fetched");
        assertTrue(transport.getRequests().stream().noneMatch(r -> "GET".equals(r.getMethod())),
            "No GET should be sent for an oversized payload");
    }

    @Test
    public void testBase64ContentMd5IsVerified() {
        base64ContentMd5 = true;
        corruptOnceOffsets.add(2L * MIB);

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(4))
            .build());

        assertTrue(result.isSuccess(), "Download should succeed after the corrupted chunk is refetched");
        assertEquals(1, result.getRetryCount(), "The corrupted chunk should be retried once");
        assertArrayEquals(payload, result.getData(), "Artifact should match the remote resource");
    }

    @Test
    public void testCancellationStopsRemainingChunks() {
        CancellationToken token = new CancellationToken();
        AtomicInteger completions = new AtomicInteger();

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin")
            .options(options(1))
            .cancellationToken(token)
            .progressListener((loaded, total, percent) -> {
                if (completions.incrementAndGet() == 2) {
                    token.cancel("enough");
                }
            })
            .build());

        assertTrue(result.isCancelled(), "Outcome should be cancelled, not failed");
        assertEquals(2, result.getChunksCompleted(), "Only the chunks finished before cancelling count");
        assertEquals(8, result.getChunksFailed(), "Remaining chunks end failed without attempts");
        long rangeRequests = transport.getRequests().stream().filter(r -> r.getHeader("Range") != null).count();
        assertEquals(2, rangeRequests, "No range request after cancellation");
    }

    @Test
    public void testDownloadWritesTargetFile(@TempDir Path tempDir) throws IOException {
        File target = tempDir.resolve("out/big.bin").toFile();

        TransferResult result = manager.download(DownloadRequest.builder(ENDPOINT, "artifacts/big.bin")
            .options(options(4))
            .targetFile(target)
            .build());

        assertTrue(result.isSuccess(), "Download should succeed");
        assertArrayEquals(payload, java.nio.file.Files.readAllBytes(target.toPath()), "Target should hold the artifact");
    }

    @Test
    public void testSessionLifecycleIsLogged() {
        Logger logger = (Logger) LoggerFactory.getLogger(ChunkedTransferManager.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            manager.download(DownloadRequest.builder(ENDPOINT, "/artifacts/big.bin").options(options(4)).build());
        } finally {
            logger.detachAppender(appender);
        }

        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.INFO
            && e.getFormattedMessage().startsWith("Starting DOWNLOAD session")), "Session start should be logged");
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.INFO
            && e.getFormattedMessage().startsWith("Finished DOWNLOAD session")
            && e.getFormattedMessage().contains("10 completed")), "Session finish should be logged");
    }

    @Test
    public void testUploadSendsChunksAndFinalizes() throws Exception {
        TransferResult result = manager.upload(UploadRequest.builder(ENDPOINT, "big.bin",
            new ByteArrayChunkSource(payload)).options(options(4)).build());

        assertTrue(result.isSuccess(), "Upload should succeed: " + result);
        assertEquals(10, result.getChunksCompleted(), "All chunks should be confirmed");
        assertEquals(10, receivedChunks.size(), "Server should have every chunk");
        assertArrayEquals(payload, reassemble(), "Server side bytes should match the payload");
        assertNotNull(finalizeMessage, "Finalize should be sent");
        assertEquals(checksumHandler.md5Hex(payload), finalizeMessage.getFileChecksum(), "File checksum expected");
        assertEquals(10, finalizeMessage.getTotalChunks(), "Finalize should carry the chunk count");
        assertEquals("completed", result.getConfirmation().getStatus(), "Receipt should be returned");
        assertTrue(transport.getRequests().stream()
            .filter(r -> r.getPath().equals("/upload/chunk"))
            .allMatch(r -> WireFormat.BINARY.getContentType().equals(r.getHeader("Content-Type"))),
            "Chunks should use the negotiated binary format");
    }

    @Test
    public void testUploadResumesFromCheckpoint(@TempDir Path tempDir) {
        SessionCheckpoint checkpoint = new SessionCheckpoint(tempDir.toFile());
        rejectedChunks.add(7);

        TransferResult first = manager.upload(UploadRequest.builder(ENDPOINT, "big.bin",
            new ByteArrayChunkSource(payload)).options(options(4)).checkpoint(checkpoint).build());

        assertEquals(TransferResult.Outcome.FAILED, first.getOutcome(), "First upload should fail on chunk 7");
        assertNull(finalizeMessage, "Finalize must not run after a failed chunk");
        assertEquals(1, tempDir.toFile().listFiles().length, "Checkpoint should be written");

        rejectedChunks.clear();
        chunkPosts.clear();
        TransferResult second = manager.upload(UploadRequest.builder(ENDPOINT, "big.bin",
            new ByteArrayChunkSource(payload)).options(options(4)).checkpoint(checkpoint).build());

        assertTrue(second.isSuccess(), "Resumed upload should succeed");
        assertEquals(Collections.singleton(7), chunkPosts.keySet(), "Only the missing chunk should be sent again");
        assertArrayEquals(payload, reassemble(), "Server side bytes should match the payload");
        assertEquals(0, tempDir.toFile().listFiles().length, "Checkpoint should be removed after finalize");
    }

    @Test
    public void testEmptyUploadIsRejected() {
        assertThrows(InvalidPayloadSizeException.class, () -> manager.upload(UploadRequest.builder(ENDPOINT,
            "empty.bin", new ByteArrayChunkSource(new byte[0])).build()), "Empty payload should be rejected");
        assertTrue(transport.getRequests().isEmpty(), "Nothing should be sent");
    }

    @Test
    public void testEngineStats() {
        failingOffsets.add(0L);
        manager.download(DownloadRequest.builder(ENDPOINT, "/a").options(options(4)).build());
        failingOffsets.clear();
        manager.download(DownloadRequest.builder(ENDPOINT, "/b").options(options(4)).build());

        ChunkedTransferManager.EngineStats stats = manager.getStats();
        assertEquals(2, stats.getSessionsStarted(), "Two sessions started");
        assertEquals(1, stats.getSessionsSucceeded(), "One session succeeded");
        assertEquals(1, stats.getSessionsFailed(), "One session failed");
        assertEquals(10L * MIB + 9L * MIB, stats.getBytesTransferred(), "Bytes of both sessions");
    }

    @Test
    public void testCreateFromConfiguration() {
        ConfigurationManager config = new ConfigurationManager(Collections.<String, String>emptyMap());
        config.setInt("transfer.maxConcurrency", 2);
        try (ChunkedTransferManager created = ChunkedTransferManager.create(config)) {
            assertFalse(created.isShutdown(), "New manager should be open");
            assertTrue(created.getPerformanceMonitor().isRunning(), "Owned monitor should be started");
            assertNotNull(created.getCapabilityNegotiator(), "Negotiator should be wired");
            assertNotNull(created.getConnectionPool(), "Pool should be wired");
        }
    }

    @Test
    public void testClosedManagerRejectsWork() {
        manager.close();
        assertTrue(manager.isShutdown(), "Manager should report shutdown");
        assertThrows(IllegalStateException.class,
            () -> manager.download(DownloadRequest.builder(ENDPOINT, "/a").build()), "Closed manager rejects work");
    }

    private TransferOptions options(int concurrency) {
        return TransferOptions.builder()
            .chunkSize(MIB)
            .maxConcurrency(concurrency)
            .adaptiveChunkSize(false)
            .timeoutMs(10000)
            .build();
    }

    private static byte[] md5(byte[] data) {
        try {
            return MessageDigest.getInstance("MD5").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private byte[] reassemble() {
        byte[] result = new byte[payload.length];
        for (Map.Entry<Integer, byte[]> entry : receivedChunks.entrySet()) {
            System.arraycopy(entry.getValue(), 0, result, entry.getKey() * MIB, entry.getValue().length);
        }
        return result;
    }

    // Fake server

    private TransportResponse handle(TransportRequest request) throws IOException {
        Map<String, String> headers = new HashMap<>();
        switch (request.getMethod()) {
            case "HEAD":
                headers.put("Content-Length", String.valueOf(advertisedLength > 0 ? advertisedLength : payload.length));
                if (advertiseRanges) {
                    headers.put("Accept-Ranges", "bytes");
                }
                return new TransportResponse(200, headers, null);
            case "GET":
                return handleGet(request);
            case "OPTIONS":
                headers.put("Accept", "application/json, application/x-protobuf");
                headers.put("Server", "fake/1.0");
                return new TransportResponse(200, headers, null);
            case "POST":
                return handlePost(request);
            default:
                return new TransportResponse(405, headers, null);
        }
    }

    private TransportResponse handleGet(TransportRequest request) {
        String range = request.getHeader("Range");
        if (range == null) {
            return new TransportResponse(200, Collections.emptyMap(), payload);
        }
        String[] bounds = range.substring("bytes=".length()).split("-");
        long start = Long.parseLong(bounds[0]);
        long end = Long.parseLong(bounds[1]);
        if (failingOffsets.contains(start)) {
            return new TransportResponse(500, Collections.emptyMap(), null);
        }
        int current = concurrentRanges.incrementAndGet();
        maxConcurrentRanges.accumulateAndGet(current, Math::max);
        try {
            Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            concurrentRanges.decrementAndGet();
        }
        byte[] slice = Arrays.copyOfRange(payload, (int) start, (int) end + 1);
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Range", "bytes " + start + "-" + end + "/" + payload.length);
        if (base64ContentMd5) {
            headers.put("Content-MD5", Base64.getEncoder().encodeToString(md5(slice)));
        } else {
            headers.put("X-Chunk-Checksum", checksumHandler.md5Hex(slice));
        }
        if (corruptOnceOffsets.remove(start)) {
            slice = slice.clone();
            slice[0] ^= 0x7f;
        }
        return new TransportResponse(206, headers, slice);
    }

    private TransportResponse handlePost(TransportRequest request) throws IOException {
        WireFormat format = WireFormat.fromContentHeaders(request.getHeader("Content-Type"),
            request.getHeader("Content-Encoding"));
        if (request.getPath().equals("/upload/chunk")) {
            ChunkUploadMessage message = codec.decode(request.getBody(), format, ChunkUploadMessage.class);
            chunkPosts.computeIfAbsent(message.getChunkIndex(), i -> new AtomicInteger()).incrementAndGet();
            if (rejectedChunks.contains(message.getChunkIndex())) {
                return new TransportResponse(500, Collections.emptyMap(), null);
            }
            String checksum = checksumHandler.md5Hex(message.getData());
            if (!checksum.equals(request.getHeader("X-Chunk-Checksum"))) {
                return new TransportResponse(400, Collections.emptyMap(), null);
            }
            receivedChunks.put(message.getChunkIndex(), message.getData());
            return new TransportResponse(200, Collections.singletonMap("X-Chunk-Checksum", checksum), null);
        }
        if (request.getPath().equals("/upload/finalize")) {
            finalizeMessage = codec.decode(request.getBody(), format, UploadFinalizeMessage.class);
            UploadReceipt receipt = new UploadReceipt(finalizeMessage.getSessionId(), "completed",
                finalizeMessage.getTotalBytes(), finalizeMessage.getTotalChunks(), "/files/big.bin", 1L);
            return new TransportResponse(200, Collections.singletonMap("Content-Type", "application/json"),
                codec.encode(receipt, WireFormat.TEXT));
        }
        return new TransportResponse(404, Collections.emptyMap(), null);
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the engine. Plans a session, runs its chunks through bounded workers and
 * assembles the outcome for chunked downloads and uploads.
 */
public class ChunkedTransferManager implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedTransferManager.class);

    public static final String DOWNLOAD_CHUNK_KEY = "DOWNLOAD_CHUNK";
    public static final String UPLOAD_CHUNK_KEY = "UPLOAD_CHUNK";
    public static final String FINALIZE_KEY = "FINALIZE";

    static final String HEADER_SESSION_ID = "X-Session-Id";
    static final String HEADER_CHUNK_INDEX = "X-Chunk-Index";
    static final String HEADER_CHUNK_TOTAL = "X-Chunk-Total";
    static final String HEADER_CHUNK_CHECKSUM = "X-Chunk-Checksum";

    private final ConnectionPool connectionPool;
    private final CapabilityNegotiator capabilityNegotiator;
    private final RetryManager retryManager;
    private final AdvancedPerformanceMonitor performanceMonitor;
    private final TransferClock clock;
    private final TransferPlanner planner;
    private final AssemblyStage assemblyStage;
    private final WireCodec codec = new WireCodec();
    private final ChecksumHandler checksumHandler = new ChecksumHandler();
    private final ExecutorService workerExecutor;
    private final ExecutorService attemptExecutor;

    private final long healthTickMs;
    private final int healthMinScore;
    private final long healthStallThresholdMs;
    private final boolean ownsCollaborators;

    // Statistics
    private final AtomicLong sessionsStarted = new AtomicLong();
    private final AtomicLong sessionsSucceeded = new AtomicLong();
    private final AtomicLong sessionsFailed = new AtomicLong();
    private final AtomicLong sessionsCancelled = new AtomicLong();
    private final AtomicLong bytesTransferred = new AtomicLong();

    private volatile boolean shutdown;

    public ChunkedTransferManager(ConnectionPool connectionPool, CapabilityNegotiator capabilityNegotiator,
                                  RetryManager retryManager, AdvancedPerformanceMonitor performanceMonitor,
                                  TransferClock clock) {
        this(connectionPool, capabilityNegotiator, retryManager, performanceMonitor, clock,
            TransferHealthMonitor.DEFAULT_TICK_MS, TransferHealthMonitor.DEFAULT_MIN_SCORE,
            TransferHealthMonitor.DEFAULT_STALL_THRESHOLD_MS, false);
    }

    public ChunkedTransferManager(ConnectionPool connectionPool, CapabilityNegotiator capabilityNegotiator,
                                  RetryManager retryManager, AdvancedPerformanceMonitor performanceMonitor,
                                  TransferClock clock, long healthTickMs, int healthMinScore,
                                  long healthStallThresholdMs) {
        this(connectionPool, capabilityNegotiator, retryManager, performanceMonitor, clock,
            healthTickMs, healthMinScore, healthStallThresholdMs, false);
    }

    private ChunkedTransferManager(ConnectionPool connectionPool, CapabilityNegotiator capabilityNegotiator,
                                   RetryManager retryManager, AdvancedPerformanceMonitor performanceMonitor,
                                   TransferClock clock, long healthTickMs, int healthMinScore,
                                   long healthStallThresholdMs, boolean ownsCollaborators) {
        this.connectionPool = connectionPool;
        this.capabilityNegotiator = capabilityNegotiator;
        this.retryManager = retryManager;
        this.performanceMonitor = performanceMonitor;
        this.clock = clock;
        this.planner = new TransferPlanner(performanceMonitor);
        this.assemblyStage = new AssemblyStage(clock);
        this.healthTickMs = healthTickMs;
        this.healthMinScore = healthMinScore;
        this.healthStallThresholdMs = healthStallThresholdMs;
        this.ownsCollaborators = ownsCollaborators;
        this.workerExecutor = Executors.newCachedThreadPool(daemonFactory("chunk-worker-"));
        this.attemptExecutor = Executors.newCachedThreadPool(daemonFactory("chunk-attempt-"));
    }

    /**
     * Build an engine and all of its collaborators from configuration. Closing the engine closes them too.
     */
    public static ChunkedTransferManager create(ConfigurationManager config) {
        TransferClock clock = TransferClock.SYSTEM;
        ConnectionPool pool = ConnectionPool.fromConfiguration(config, clock);
        CapabilityNegotiator negotiator = CapabilityNegotiator.fromConfiguration(config, pool, clock);
        RetryManager retryManager = RetryManager.fromConfiguration(config, clock);
        AdvancedPerformanceMonitor monitor = AdvancedPerformanceMonitor.fromConfiguration(config, clock);
        monitor.start();
        return new ChunkedTransferManager(pool, negotiator, retryManager, monitor, clock,
            config.getLong("health.tickMs", TransferHealthMonitor.DEFAULT_TICK_MS),
            config.getInt("health.minScore", TransferHealthMonitor.DEFAULT_MIN_SCORE),
            config.getLong("health.stallThresholdMs", TransferHealthMonitor.DEFAULT_STALL_THRESHOLD_MS),
            true);
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // Download

    /**
     * Download a resource in byte ranges, or with a single request when the endpoint does not
     * advertise range support and a size.
     */
    public TransferResult download(DownloadRequest request) {
        ensureOpen();
        TransferOptions options = request.getOptions();
        CancellationToken token = request.getCancellationToken();
        String endpointKey = ConnectionPool.normalizeEndpoint(request.getEndpoint());
        long startTime = clock.currentTimeMillis();
        sessionsStarted.incrementAndGet();

        Transport transport;
        try {
            transport = connectionPool.acquire(endpointKey);
        } catch (IOException e) {
            logger.error("Could not connect to {}: {}", endpointKey, e.getMessage());
            return record(failedResult(e, startTime));
        }

        try {
            long totalBytes = options.isRangeRequestsEnabled()
                ? probeRangeSupport(transport, request.getPath(), options, token) : -1;
            TransferResult result;
            if (totalBytes > 0) {
                result = rangedDownload(transport, request, totalBytes);
            } else {
                result = singleDownload(transport, request, startTime);
            }
            if (result.isSuccess() && request.getTargetFile() != null) {
                result = writeTarget(result, request);
            }
            return record(result);
        } finally {
            connectionPool.release(endpointKey);
        }
    }

    /**
     * @return the resource size when ranged requests can be used, -1 otherwise
     */
    private long probeRangeSupport(Transport transport, String path, TransferOptions options,
                                   CancellationToken token) {
        TransportRequest head = TransportRequest.builder("HEAD", path).timeoutMs(options.getTimeoutMs()).build();
        try {
            TransportResponse response = retryManager.execute(RetryManager.OperationType.HEAD, () -> {
                TransportResponse r = transport.send(head, token);
                if (r.getStatusCode() >= 500 || r.getStatusCode() == 429) {
                    throw new TransferException("HEAD " + path + " returned HTTP " + r.getStatusCode(),
                        r.getStatusCode());
                }
                return r;
            });
            long length = response.getLongHeader("Content-Length");
            String acceptRanges = response.getHeader("Accept-Ranges");
            if (response.isSuccessful() && length > 0 && acceptRanges != null
                    && acceptRanges.toLowerCase(Locale.ROOT).contains("bytes")) {
                return length;
            }
            logger.warn("Range requests not supported for {} (status {}, length {}, Accept-Ranges {}), "
                + "falling back to a single request", path, response.getStatusCode(), length, acceptRanges);
        } catch (IOException e) {
            logger.warn("Range probe of {} failed, falling back to a single request: {}", path, e.getMessage());
        }
        return -1;
    }

    private TransferResult singleDownload(Transport transport, DownloadRequest request, long startTime) {
        TransferOptions options = request.getOptions();
        CancellationToken token = request.getCancellationToken();
        TransportRequest get = TransportRequest.builder("GET", request.getPath())
            .timeoutMs(options.getTimeoutMs())
            .build();
        try {
            TransportResponse response = retryManager.execute(RetryManager.OperationType.GET,
                () -> transport.send(get, token).requireSuccess("GET " + request.getPath()));
            byte[] data = response.getBody();
            long elapsed = clock.currentTimeMillis() - startTime;
            performanceMonitor.record(new PerformanceSample(DOWNLOAD_CHUNK_KEY, elapsed, true, data.length,
                clock.currentTimeMillis()));
            if (request.getProgressListener() != null) {
                request.getProgressListener().onProgress(data.length, data.length, 100.0);
            }
            logger.info("Downloaded {} bytes from {} in a single request", data.length, request.getPath());
            return TransferResult.builder(TransferResult.Outcome.SUCCESS)
                .bytesTransferred(data.length)
                .chunksCompleted(1)
                .totalTimeMs(elapsed)
                .data(data)
                .finalChunkSize(data.length)
                .build();
        } catch (TransferCancelledException e) {
            return TransferResult.builder(TransferResult.Outcome.CANCELLED)
                .error(e)
                .totalTimeMs(clock.currentTimeMillis() - startTime)
                .build();
        } catch (IOException e) {
            logger.error("Download of {} failed: {}", request.getPath(), e.getMessage());
            return failedResult(e, startTime);
        }
    }

    private TransferResult rangedDownload(Transport transport, DownloadRequest request, long totalBytes) {
        TransferOptions options = request.getOptions();
        if (totalBytes > AssemblyStage.MAX_IN_MEMORY_BYTES) {
            logger.error("Refusing ranged download of {}: {} bytes cannot be assembled in memory",
                request.getPath(), totalBytes);
            return TransferResult.builder(TransferResult.Outcome.FAILED)
                .error(new TransferException("Payload of " + totalBytes + " bytes is too large to assemble in memory",
                    -1, ErrorCategory.NON_RETRYABLE, null))
                .build();
        }
        int chunkSize = planner.initialChunkSize(totalBytes, options.getChunkSize(), options.getNetworkQuality(),
            options.isAdaptiveChunkSize(), options.getMinChunkSize(), options.getMaxChunkSize());
        List<ChunkDescriptor> chunks = planner.plan(totalBytes, chunkSize);
        TransferSession session = new TransferSession(UUID.randomUUID().toString(), TransferDirection.DOWNLOAD,
            totalBytes, chunkSize, options.getMaxConcurrency(), chunks, clock.currentTimeMillis(),
            request.getCancellationToken());

        ChunkTransfer transfer = (chunk, token) -> {
            TransportRequest get = TransportRequest.builder("GET", request.getPath())
                .header("Range", "bytes=" + chunk.getStart() + "-" + chunk.getEndInclusive())
                .timeoutMs(options.getTimeoutMs())
                .build();
            TransportResponse response = transport.send(get, token);
            if (response.getStatusCode() != 206) {
                if (response.isSuccessful()) {
                    throw new TransferException("Range request for chunk " + chunk.getIndex()
                        + " was answered with HTTP " + response.getStatusCode(), response.getStatusCode(),
                        ErrorCategory.NON_RETRYABLE, null);
                }
                throw new TransferException("Range request for chunk " + chunk.getIndex() + " failed with HTTP "
                    + response.getStatusCode(), response.getStatusCode());
            }
            return ChunkPayload.received(response.getBody(), reportedChecksum(response));
        };

        runSession(session, transfer, request, null, null);
        return assemblyStage.assembleDownload(session);
    }

    private String reportedChecksum(TransportResponse response) {
        String checksum = response.getHeader(HEADER_CHUNK_CHECKSUM);
        if (checksum == null) {
            checksum = response.getHeader("Content-MD5");
        }
        return ChecksumHandler.md5HeaderToHex(checksum);
    }

    private TransferResult writeTarget(TransferResult result, DownloadRequest request) {
        try {
            assemblyStage.writeArtifact(result.getData(), request.getTargetFile());
            return result;
        } catch (IOException e) {
            logger.error("Could not write {}: {}", request.getTargetFile(), e.getMessage());
            return TransferResult.builder(TransferResult.Outcome.FAILED)
                .bytesTransferred(result.getBytesTransferred())
                .chunksCompleted(result.getChunksCompleted())
                .retryCount(result.getRetryCount())
                .totalTimeMs(result.getTotalTimeMs())
                .finalChunkSize(result.getFinalChunkSize())
                .error(new TransferException("Could not write " + request.getTargetFile() + ": " + e.getMessage(),
                    -1, ErrorCategory.NON_RETRYABLE, e))
                .build();
        }
    }

    // Upload

    /**
     * Upload a payload chunk by chunk in the negotiated wire format, then finalize it.
     *
     * @throws InvalidPayloadSizeException when the source is empty
     */
    public TransferResult upload(UploadRequest request) {
        ensureOpen();
        TransferOptions options = request.getOptions();
        String endpointKey = ConnectionPool.normalizeEndpoint(request.getEndpoint());
        long startTime = clock.currentTimeMillis();

        long totalBytes;
        String fileChecksum;
        try {
            totalBytes = request.getSource().size();
            if (totalBytes <= 0) {
                throw new InvalidPayloadSizeException(totalBytes);
            }
            fileChecksum = checksumHandler.checksum(request.getSource(), ChecksumHandler.MD5);
        } catch (IOException e) {
            sessionsStarted.incrementAndGet();
            logger.error("Could not read upload source for {}: {}", request.getFileName(), e.getMessage());
            return record(failedResult(e, startTime));
        }
        sessionsStarted.incrementAndGet();

        CapabilityProfile profile = capabilityNegotiator.negotiate(endpointKey);
        WireFormat format = profile.resolveFormat(options.getPreferredFormat());

        SessionCheckpoint checkpoint = request.getCheckpoint();
        String checkpointKey = checkpoint != null
            ? SessionCheckpoint.checkpointKey(endpointKey, request.getFileName(), fileChecksum, totalBytes) : null;
        SessionCheckpoint.State saved = checkpoint != null ? checkpoint.load(checkpointKey) : null;

        int chunkSize = saved != null && saved.getChunkSize() > 0
            ? saved.getChunkSize()
            : planner.initialChunkSize(totalBytes, options.getChunkSize(), options.getNetworkQuality(),
                options.isAdaptiveChunkSize(), options.getMinChunkSize(), options.getMaxChunkSize());
        List<ChunkDescriptor> chunks = planner.plan(totalBytes, chunkSize);
        String sessionId = saved != null && saved.getSessionId() != null
            ? saved.getSessionId() : UUID.randomUUID().toString();
        TransferSession session = new TransferSession(sessionId, TransferDirection.UPLOAD, totalBytes, chunkSize,
            options.getMaxConcurrency(), chunks, clock.currentTimeMillis(), request.getCancellationToken());

        Transport transport;
        try {
            transport = connectionPool.acquire(endpointKey);
        } catch (IOException e) {
            logger.error("Could not connect to {}: {}", endpointKey, e.getMessage());
            return record(failedResult(e, startTime));
        }

        try {
            String chunkPath = options.getUploadPath() + "/chunk";
            ChunkTransfer transfer = (chunk, token) -> {
                byte[] data = request.getSource().read(chunk.getStart(), (int) chunk.getSize());
                String checksum = checksumHandler.md5Hex(data);
                chunk.setChecksum(checksum);
                ChunkUploadMessage message = new ChunkUploadMessage(sessionId, chunk.getIndex(), chunks.size(),
                    chunk.getStart(), chunk.getSize(), checksum, data);
                TransportRequest.Builder builder = TransportRequest.builder("POST", chunkPath)
                    .header(HEADER_SESSION_ID, sessionId)
                    .header(HEADER_CHUNK_INDEX, String.valueOf(chunk.getIndex()))
                    .header(HEADER_CHUNK_TOTAL, String.valueOf(chunks.size()))
                    .header(HEADER_CHUNK_CHECKSUM, checksum)
                    .header("Content-Type", format.getContentType())
                    .body(codec.encode(message, format))
                    .timeoutMs(options.getTimeoutMs());
                if (format.getContentEncoding() != null) {
                    builder.header("Content-Encoding", format.getContentEncoding());
                }
                TransportResponse response = transport.send(builder.build(), token);
                response.requireSuccess("Upload of chunk " + chunk.getIndex());
                return ChunkPayload.sent(data.length, response.getHeader(HEADER_CHUNK_CHECKSUM));
            };

            AssemblyStage.UploadFinalizer finalizer = () -> finalizeUpload(transport, request, session,
                fileChecksum, format);
            runSession(session, transfer, request, format,
                checkpoint != null ? new CheckpointBinding(checkpoint, checkpointKey, saved, chunkSize) : null);
            TransferResult result = assemblyStage.assembleUpload(session, finalizer);
            if (result.isSuccess() && checkpoint != null) {
                checkpoint.clear(checkpointKey);
            }
            return record(result);
        } finally {
            connectionPool.release(endpointKey);
        }
    }

    private UploadReceipt finalizeUpload(Transport transport, UploadRequest request, TransferSession session,
                                         String fileChecksum, WireFormat format) throws IOException {
        TransferOptions options = request.getOptions();
        UploadFinalizeMessage message = new UploadFinalizeMessage(session.getSessionId(), request.getFileName(),
            session.getTotalBytes(), session.getChunks().size(), fileChecksum, clock.currentTimeMillis());
        TransportRequest.Builder builder = TransportRequest.builder("POST", options.getUploadPath() + "/finalize")
            .header(HEADER_SESSION_ID, session.getSessionId())
            .header("Content-Type", format.getContentType())
            .header("Accept", format.getContentType())
            .body(codec.encode(message, format))
            .timeoutMs(options.getTimeoutMs());
        if (format.getContentEncoding() != null) {
            builder.header("Content-Encoding", format.getContentEncoding());
        }
        TransportRequest finalizeRequest = builder.build();

        long started = clock.currentTimeMillis();
        boolean success = false;
        try {
            UploadReceipt receipt = retryManager.execute(session.getSessionId() + "-finalize",
                RetryManager.OperationType.FINALIZE, () -> {
                    TransportResponse response = transport.send(finalizeRequest, request.getCancellationToken())
                        .requireSuccess("Finalize of " + request.getFileName());
                    if (response.getBody().length == 0) {
                        return new UploadReceipt(session.getSessionId(), "completed", session.getTotalBytes(),
                            session.getChunks().size(), null, clock.currentTimeMillis());
                    }
                    WireFormat responseFormat = WireFormat.fromContentHeaders(response.getHeader("Content-Type"),
                        response.getHeader("Content-Encoding"));
                    return codec.decode(response.getBody(), responseFormat, UploadReceipt.class);
                });
            success = true;
            logger.info("Finalized upload {} of {} ({} bytes, status {})", session.getSessionId(),
                request.getFileName(), session.getTotalBytes(), receipt.getStatus());
            return receipt;
        } finally {
            performanceMonitor.record(new PerformanceSample(FINALIZE_KEY,
                clock.currentTimeMillis() - started, success, finalizeRequest.getBody().length, format, false,
                clock.currentTimeMillis()));
        }
    }

    // Session execution

    /**
     * Drive every non-terminal chunk of a session to a terminal state. Chunks start in plan order,
     * at most {@code concurrencyLimit} at a time.
     */
    void runSession(TransferSession session, ChunkTransfer transfer, TransferRequest request, WireFormat format,
                    CheckpointBinding checkpoint) {
        TransferOptions options = request.getOptions();
        CancellationToken token = session.getCancellationToken();
        List<ChunkDescriptor> chunks = session.getChunks();

        ConcurrencyGate gate = new ConcurrencyGate(session.getConcurrencyLimit());
        ProgressAggregator progress = new ProgressAggregator(session.getTotalBytes(), chunks.size(), clock);
        progress.register(request.getProgressListener());
        AdaptiveSizer sizer = new AdaptiveSizer(session.getChunkSize(),
            Math.min(options.getMinChunkSize(), session.getChunkSize()),
            Math.max(options.getMaxChunkSize(), session.getChunkSize()));
        TransferHealthMonitor health = new TransferHealthMonitor(session.getTotalBytes(), chunks.size(), clock,
            healthTickMs, healthMinScore, healthStallThresholdMs);
        if (request.getHealthListener() != null) {
            health.register(request.getHealthListener());
        }
        ChunkWorker worker = new ChunkWorker(attemptExecutor, clock, options);
        SessionListener listener = new SessionListener(session, progress, sizer, health, format,
            options.isAdaptiveChunkSize(), checkpoint);

        if (checkpoint != null) {
            checkpoint.restore(session, listener);
        }

        logger.info("Starting {} session {}: {} bytes in {} chunks of {} bytes, concurrency {}",
            session.getDirection(), session.getSessionId(), session.getTotalBytes(), chunks.size(),
            session.getChunkSize(), session.getConcurrencyLimit());

        health.start();
        boolean interrupted = false;
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (ChunkDescriptor chunk : chunks) {
                if (chunk.isTerminal()) {
                    continue;
                }
                if (token.isCancelled()) {
                    chunk.markFailed(new TransferCancelledException("Cancelled before start"));
                    progress.onChunkFailed(chunk);
                    continue;
                }
                if (health.shouldPause()) {
                    interrupted |= pause(health);
                }
                try {
                    gate.acquire();
                } catch (InterruptedException e) {
                    interrupted = true;
                    token.cancel("Interrupted while waiting for a transfer slot");
                    chunk.markFailed(new TransferCancelledException("Interrupted before start"));
                    progress.onChunkFailed(chunk);
                    continue;
                }
                try {
                    futures.add(workerExecutor.submit(() -> {
                        try {
                            worker.execute(chunk, transfer, token, listener);
                        } finally {
                            gate.release();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    gate.release();
                    chunk.markFailed(new TransferException("Worker pool rejected chunk " + chunk.getIndex(), e));
                    progress.onChunkFailed(chunk);
                }
            }
            interrupted |= awaitAll(futures, token);
        } finally {
            health.stop();
            for (ChunkDescriptor chunk : chunks) {
                if (!chunk.isTerminal()) {
                    chunk.markFailed(new TransferException("Chunk " + chunk.getIndex() + " did not finish"));
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        logger.info("Finished {} session {}: {} completed, {} failed, {} retries, {} bytes in {}ms, final chunk size {}",
            session.getDirection(), session.getSessionId(), session.getCompletedCount(), session.getFailedCount(),
            session.getTotalRetries(), session.getTransferredBytes(),
            clock.currentTimeMillis() - session.getStartTime(), session.getChunkSize());
    }

    /**
     * @return true when the pause was interrupted
     */
    private boolean pause(TransferHealthMonitor health) {
        long pauseMs = health.getSuggestedPauseMs();
        if (pauseMs <= 0) {
            return false;
        }
        health.recordPause();
        logger.debug("Health below threshold, pausing dispatch for {}ms", pauseMs);
        try {
            clock.sleep(pauseMs);
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    /**
     * Wait for every worker. An interrupt cancels the session, then waiting continues so that
     * in-flight chunks abort through their own I/O before the session is assembled.
     *
     * @return true when the calling thread was interrupted
     */
    private boolean awaitAll(List<Future<?>> futures, CancellationToken token) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    token.cancel("Interrupted while waiting for chunks");
                } catch (ExecutionException e) {
                    logger.error("Chunk worker failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                    break;
                }
            }
        }
        return interrupted;
    }

    /**
     * Routes worker events to progress, adaptive sizing, health, the performance monitor and the checkpoint.
     */
    private final class SessionListener implements ChunkListener {
        private final TransferSession session;
        private final ProgressAggregator progress;
        private final AdaptiveSizer sizer;
        private final TransferHealthMonitor health;
        private final WireFormat format;
        private final boolean adaptive;
        private final CheckpointBinding checkpoint;
        private final String sampleKey;
        private final Map<Integer, Long> attemptStarts = new ConcurrentHashMap<>();

        SessionListener(TransferSession session, ProgressAggregator progress, AdaptiveSizer sizer,
                        TransferHealthMonitor health, WireFormat format, boolean adaptive,
                        CheckpointBinding checkpoint) {
            this.session = session;
            this.progress = progress;
            this.sizer = sizer;
            this.health = health;
            this.format = format;
            this.adaptive = adaptive;
            this.checkpoint = checkpoint;
            this.sampleKey = session.getDirection() == TransferDirection.UPLOAD ? UPLOAD_CHUNK_KEY : DOWNLOAD_CHUNK_KEY;
        }

        @Override
        public void onChunkStarted(ChunkDescriptor chunk) {
            progress.onChunkStarted(chunk);
        }

        @Override
        public void onAttemptStarted(ChunkDescriptor chunk, int attempt) {
            attemptStarts.put(chunk.getIndex(), clock.currentTimeMillis());
        }

        @Override
        public void onAttemptFailed(ChunkDescriptor chunk, int attempt, Exception error, boolean willRetry) {
            Long started = attemptStarts.get(chunk.getIndex());
            long now = clock.currentTimeMillis();
            long duration = started != null ? now - started : 0;
            performanceMonitor.record(new PerformanceSample(sampleKey, duration, false, 0, format, false, now));
            if (willRetry) {
                health.recordRetry();
            }
        }

        @Override
        public void onChunkCompleted(ChunkDescriptor chunk) {
            attemptStarts.remove(chunk.getIndex());
            long transferred = session.recordCompleted(chunk);
            if (adaptive) {
                session.setChunkSize(sizer.recordChunk(chunk.getSize(), chunk.getMeasuredDurationMs()));
            }
            performanceMonitor.record(new PerformanceSample(sampleKey, chunk.getMeasuredDurationMs(), true,
                chunk.getSize(), format, false, clock.currentTimeMillis()));
            health.recordProgress(transferred, session.getCompletedCount());
            progress.onChunkCompleted(chunk);
            if (checkpoint != null) {
                checkpoint.record(session, chunk);
            }
        }

        @Override
        public void onChunkFailed(ChunkDescriptor chunk) {
            attemptStarts.remove(chunk.getIndex());
            health.recordChunkFailed();
            progress.onChunkFailed(chunk);
        }

        void onChunkRestored(ChunkDescriptor chunk) {
            long transferred = session.recordCompleted(chunk);
            health.recordProgress(transferred, session.getCompletedCount());
            progress.onChunkCompleted(chunk);
        }
    }

    /**
     * Checkpoint store bound to one upload.
     */
    static final class CheckpointBinding {
        private final SessionCheckpoint checkpoint;
        private final String key;
        private final SessionCheckpoint.State saved;
        private final int plannedChunkSize;

        CheckpointBinding(SessionCheckpoint checkpoint, String key, SessionCheckpoint.State saved,
                          int plannedChunkSize) {
            this.checkpoint = checkpoint;
            this.key = key;
            this.saved = saved;
            this.plannedChunkSize = plannedChunkSize;
        }

        private void restore(TransferSession session, SessionListener listener) {
            if (saved == null || saved.getChunkSize() != plannedChunkSize
                    || saved.getTotalBytes() != session.getTotalBytes()) {
                return;
            }
            int restored = 0;
            for (Map.Entry<Integer, String> entry : saved.getCompletedChunks().entrySet()) {
                int index = entry.getKey();
                if (index < 0 || index >= session.getChunks().size()) {
                    continue;
                }
                ChunkDescriptor chunk = session.getChunks().get(index);
                chunk.markRestored(entry.getValue(), saved.getUpdatedAt());
                listener.onChunkRestored(chunk);
                restored++;
            }
            logger.info("Resuming upload session {}: {} of {} chunks already confirmed", session.getSessionId(),
                restored, session.getChunks().size());
        }

        private void record(TransferSession session, ChunkDescriptor chunk) {
            try {
                checkpoint.recordCompleted(key, session.getSessionId(), session.getTotalBytes(),
                    plannedChunkSize, chunk.getIndex(), chunk.getChecksum());
            } catch (IOException e) {
                logger.warn("Could not update checkpoint for session {}: {}", session.getSessionId(), e.getMessage());
            }
        }
    }

    // Results and statistics

    private TransferResult failedResult(IOException error, long startTime) {
        if (error instanceof TransferCancelledException) {
            return TransferResult.builder(TransferResult.Outcome.CANCELLED)
                .error(error)
                .totalTimeMs(clock.currentTimeMillis() - startTime)
                .build();
        }
        return TransferResult.builder(TransferResult.Outcome.FAILED)
            .error(error)
            .totalTimeMs(clock.currentTimeMillis() - startTime)
            .build();
    }

    private TransferResult record(TransferResult result) {
        switch (result.getOutcome()) {
            case SUCCESS:
                sessionsSucceeded.incrementAndGet();
                break;
            case CANCELLED:
                sessionsCancelled.incrementAndGet();
                break;
            default:
                sessionsFailed.incrementAndGet();
                break;
        }
        bytesTransferred.addAndGet(result.getBytesTransferred());
        return result;
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new IllegalStateException("ChunkedTransferManager is shut down");
        }
    }

    public EngineStats getStats() {
        return new EngineStats(sessionsStarted.get(), sessionsSucceeded.get(), sessionsFailed.get(),
            sessionsCancelled.get(), bytesTransferred.get());
    }

    public AdvancedPerformanceMonitor getPerformanceMonitor() {
        return performanceMonitor;
    }

    public CapabilityNegotiator getCapabilityNegotiator() {
        return capabilityNegotiator;
    }

    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stop the worker pools. Collaborators built by {@link #create(ConfigurationManager)} are closed too.
     */
    @Override
    public void close() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        workerExecutor.shutdown();
        attemptExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
            if (!attemptExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                attemptExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            attemptExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownsCollaborators) {
            performanceMonitor.close();
            connectionPool.close();
        }
        logger.debug("Transfer engine closed: {}", getStats());
    }

    /**
     * Session counters of one engine instance.
     */
    public static class EngineStats {
        private final long sessionsStarted;
        private final long sessionsSucceeded;
        private final long sessionsFailed;
        private final long sessionsCancelled;
        private final long bytesTransferred;

        public EngineStats(long sessionsStarted, long sessionsSucceeded, long sessionsFailed, long sessionsCancelled,
                           long bytesTransferred) {
            this.sessionsStarted = sessionsStarted;
            this.sessionsSucceeded = sessionsSucceeded;
            this.sessionsFailed = sessionsFailed;
            this.sessionsCancelled = sessionsCancelled;
            this.bytesTransferred = bytesTransferred;
        }

        public long getSessionsStarted() { return sessionsStarted; }
        public long getSessionsSucceeded() { return sessionsSucceeded; }
        public long getSessionsFailed() { return sessionsFailed; }
        public long getSessionsCancelled() { return sessionsCancelled; }
        public long getBytesTransferred() { return bytesTransferred; }

        @Override
        public String toString() {
            return String.format("EngineStats{started=%d, succeeded=%d, failed=%d, cancelled=%d, bytes=%d}",
                sessionsStarted, sessionsSucceeded, sessionsFailed, sessionsCancelled, bytesTransferred);
        }
    }
}

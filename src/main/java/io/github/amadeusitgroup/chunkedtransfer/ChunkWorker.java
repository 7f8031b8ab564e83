package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one chunk to a terminal state: up to {@code maxRetries + 1} attempts, each raced against
 * a per-attempt timeout, with capped exponential backoff in between.
 * A failed chunk never aborts its siblings.
 */
public class ChunkWorker {

    private static final Logger logger = LoggerFactory.getLogger(ChunkWorker.class);

    private final ExecutorService attemptExecutor;
    private final TransferClock clock;
    private final ChecksumHandler checksumHandler;
    private final int maxRetries;
    private final long timeoutMs;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean verifyChecksum;

    public ChunkWorker(ExecutorService attemptExecutor, TransferClock clock, TransferOptions options) {
        this(attemptExecutor, clock, new ChecksumHandler(), options.getMaxRetries(), options.getTimeoutMs(),
            options.getRetryBaseDelayMs(), options.getRetryMaxDelayMs(), options.isChecksumEnabled());
    }

    public ChunkWorker(ExecutorService attemptExecutor, TransferClock clock, ChecksumHandler checksumHandler,
                       int maxRetries, long timeoutMs, long baseDelayMs, long maxDelayMs, boolean verifyChecksum) {
        this.attemptExecutor = attemptExecutor;
        this.clock = clock;
        this.checksumHandler = checksumHandler;
        this.maxRetries = maxRetries;
        this.timeoutMs = timeoutMs;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.verifyChecksum = verifyChecksum;
    }

    /**
     * Execute a chunk until it completes or exhausts its attempts.
     *
     * @return true when the chunk ended COMPLETED
     */
    public boolean execute(ChunkDescriptor chunk, ChunkTransfer transfer, CancellationToken token,
                           ChunkListener listener) {
        listener.onChunkStarted(chunk);
        Exception lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (token.isCancelled()) {
                return fail(chunk, new TransferCancelledException("Cancelled before attempt " + (attempt + 1)), listener);
            }

            chunk.markInFlight(attempt);
            listener.onAttemptStarted(chunk, attempt);
            long startTime = clock.currentTimeMillis();
            try {
                ChunkPayload payload = runAttempt(chunk, transfer, token);
                long duration = clock.currentTimeMillis() - startTime;
                verify(chunk, payload);
                chunk.markCompleted(payload.getData(), duration, clock.currentTimeMillis());
                logger.debug("Chunk {} completed in {}ms after {} retries", chunk.getIndex(), duration, attempt);
                listener.onChunkCompleted(chunk);
                return true;
            } catch (TransferCancelledException e) {
                return fail(chunk, e, listener);
            } catch (IOException e) {
                lastError = e;
                chunk.recordError(e);
                boolean retryable = !(e instanceof TransferException) || ((TransferException) e).isRetryable();
                boolean willRetry = retryable && attempt < maxRetries;
                listener.onAttemptFailed(chunk, attempt, e, willRetry);
                if (!willRetry) {
                    break;
                }

                long delay = calculateDelay(attempt);
                logger.warn("Chunk {} attempt {}/{} failed: {}. Retrying in {}ms", chunk.getIndex(), attempt + 1,
                    maxRetries + 1, e.getMessage(), delay);
                try {
                    clock.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(chunk, new TransferCancelledException("Interrupted during backoff"), listener);
                }
            }
        }

        logger.warn("Chunk {} failed after {} attempts: {}", chunk.getIndex(), chunk.getRetryCount() + 1,
            lastError != null ? lastError.getMessage() : "unknown error");
        return fail(chunk, lastError, listener);
    }

    /**
     * Backoff before retrying after the given zero-based attempt.
     */
    public long calculateDelay(int attempt) {
        long delay = baseDelayMs * (1L << Math.min(attempt, 30));
        return Math.min(delay, maxDelayMs);
    }

    private ChunkPayload runAttempt(ChunkDescriptor chunk, ChunkTransfer transfer, CancellationToken token)
            throws IOException {
        Future<ChunkPayload> future = attemptExecutor.submit(() -> transfer.transfer(chunk, token));
        Runnable abort = () -> future.cancel(true);
        token.addCallback(abort);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ChunkTimeoutException("Chunk " + chunk.getIndex() + " timed out after " + timeoutMs + "ms");
        } catch (CancellationException e) {
            throw new TransferCancelledException("Chunk " + chunk.getIndex() + " aborted");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Interrupted while transferring chunk " + chunk.getIndex());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (token.isCancelled()) {
                throw new TransferCancelledException("Chunk " + chunk.getIndex() + " aborted");
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new TransferException("Chunk " + chunk.getIndex() + " failed: " + cause, cause);
        } finally {
            token.removeCallback(abort);
        }
    }

    private void verify(ChunkDescriptor chunk, ChunkPayload payload) throws ChunkIntegrityException {
        if (payload == null) {
            throw new ChunkIntegrityException("Chunk " + chunk.getIndex() + " produced no result");
        }
        if (payload.getBytesTransferred() != chunk.getSize()) {
            throw new ChunkIntegrityException(String.format("Chunk %d size mismatch: expected %d, got %d",
                chunk.getIndex(), chunk.getSize(), payload.getBytesTransferred()));
        }
        if (!verifyChecksum || payload.getReportedChecksum() == null) {
            return;
        }
        String actual = payload.getData() != null ? checksumHandler.md5Hex(payload.getData()) : chunk.getChecksum();
        if (actual != null && !actual.equalsIgnoreCase(payload.getReportedChecksum().trim())) {
            throw new ChunkIntegrityException(String.format("Chunk %d checksum mismatch: expected %s, got %s",
                chunk.getIndex(), payload.getReportedChecksum(), actual));
        }
        if (payload.getData() != null && chunk.getChecksum() == null) {
            chunk.setChecksum(actual);
        }
    }

    private boolean fail(ChunkDescriptor chunk, Exception error, ChunkListener listener) {
        chunk.markFailed(error);
        listener.onChunkFailed(chunk);
        return false;
    }
}

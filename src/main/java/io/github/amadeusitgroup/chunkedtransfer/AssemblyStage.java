package io.github.amadeusitgroup.chunkedtransfer;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides the outcome of a terminal session and produces the final artifact:
 * the concatenated payload for downloads, the remote confirmation for uploads.
 */
public class AssemblyStage {

    private static final Logger logger = LoggerFactory.getLogger(AssemblyStage.class);

    /**
     * Largest payload that can be assembled into a single array.
     */
    public static final long MAX_IN_MEMORY_BYTES = Integer.MAX_VALUE - 8;

    private final TransferClock clock;

    public AssemblyStage(TransferClock clock) {
        this.clock = clock;
    }

    /**
     * Remote commit of an upload whose chunks were all accepted.
     */
    @FunctionalInterface
    public interface UploadFinalizer {
        UploadReceipt finalizeUpload() throws IOException;
    }

    /**
     * Assemble a terminal download session. No partial artifact is returned on failure.
     */
    public TransferResult assembleDownload(TransferSession session) {
        ensureTerminal(session);
        TransferResult failure = checkFailure(session);
        if (failure != null) {
            return failure;
        }

        List<ChunkDescriptor> ordered = new ArrayList<>(session.getChunks());
        ordered.sort(Comparator.comparingInt(ChunkDescriptor::getIndex));

        if (session.getTotalBytes() > MAX_IN_MEMORY_BYTES) {
            return failed(session, new TransferException("Payload of " + session.getTotalBytes()
                + " bytes is too large to assemble in memory"));
        }

        byte[] artifact = new byte[(int) session.getTotalBytes()];
        long expectedOffset = 0;
        for (ChunkDescriptor chunk : ordered) {
            byte[] payload = chunk.getPayload();
            if (chunk.getStart() != expectedOffset) {
                return failed(session, new ChunkIntegrityException("Gap or overlap before chunk " + chunk.getIndex()
                    + ": expected offset " + expectedOffset + ", found " + chunk.getStart()));
            }
            if (payload == null || payload.length != chunk.getSize()) {
                return failed(session, new ChunkIntegrityException("Chunk " + chunk.getIndex()
                    + " has no payload of the expected size"));
            }
            System.arraycopy(payload, 0, artifact, (int) chunk.getStart(), payload.length);
            expectedOffset = chunk.getEnd();
        }
        if (expectedOffset != session.getTotalBytes()) {
            return failed(session, new ChunkIntegrityException("Chunks cover " + expectedOffset + " of "
                + session.getTotalBytes() + " bytes"));
        }

        logger.debug("Assembled {} chunks into {} bytes for session {}", ordered.size(), artifact.length,
            session.getSessionId());
        return success(session).data(artifact).build();
    }

    /**
     * Assemble a terminal upload session, calling the finalizer only when every chunk completed.
     */
    public TransferResult assembleUpload(TransferSession session, UploadFinalizer finalizer) {
        ensureTerminal(session);
        TransferResult failure = checkFailure(session);
        if (failure != null) {
            return failure;
        }

        try {
            UploadReceipt receipt = finalizer.finalizeUpload();
            return success(session).confirmation(receipt).build();
        } catch (TransferCancelledException e) {
            return resultOf(session, TransferResult.Outcome.CANCELLED).error(e).build();
        } catch (IOException e) {
            logger.error("Finalize failed for session {}: {}", session.getSessionId(), e.getMessage());
            return failed(session, new SessionFailedException("Finalize failed: " + e.getMessage(), e));
        }
    }

    /**
     * Write an assembled download to disk, creating parent directories as needed.
     */
    public void writeArtifact(byte[] artifact, File target) throws IOException {
        FileUtils.writeByteArrayToFile(target, artifact);
        logger.debug("Wrote {} bytes to {}", artifact.length, target.getAbsolutePath());
    }

    /**
     * Apply the session success rule: every chunk completed and none failed.
     *
     * @return a failure or cancellation result, or null when the session succeeded
     */
    TransferResult checkFailure(TransferSession session) {
        int failedCount = session.getFailedCount();
        int completedCount = session.getCompletedCount();
        int totalChunks = session.getChunks().size();

        if (failedCount == 0 && completedCount == totalChunks) {
            return null;
        }
        if (session.getCancellationToken().isCancelled()) {
            return resultOf(session, TransferResult.Outcome.CANCELLED)
                .error(new TransferCancelledException(session.getCancellationToken().getReason() != null
                    ? session.getCancellationToken().getReason() : "Transfer cancelled"))
                .build();
        }
        return failed(session, new SessionFailedException(failedCount, session.getTotalRetries(), lastError(session)));
    }

    private Throwable lastError(TransferSession session) {
        for (ChunkDescriptor chunk : session.getChunks()) {
            if (chunk.getStatus() == ChunkStatus.FAILED && chunk.getLastError() != null) {
                return chunk.getLastError();
            }
        }
        return null;
    }

    private void ensureTerminal(TransferSession session) {
        if (!session.isTerminal()) {
            throw new IllegalStateException("Session " + session.getSessionId() + " still has chunks in progress");
        }
    }

    private TransferResult failed(TransferSession session, TransferException error) {
        return resultOf(session, TransferResult.Outcome.FAILED).error(error).build();
    }

    private TransferResult.Builder success(TransferSession session) {
        return resultOf(session, TransferResult.Outcome.SUCCESS);
    }

    private TransferResult.Builder resultOf(TransferSession session, TransferResult.Outcome outcome) {
        return TransferResult.builder(outcome)
            .bytesTransferred(session.getTransferredBytes())
            .chunksCompleted(session.getCompletedCount())
            .chunksFailed(session.getFailedCount())
            .retryCount(session.getTotalRetries())
            .totalTimeMs(clock.currentTimeMillis() - session.getStartTime())
            .finalChunkSize(session.getChunkSize());
    }
}

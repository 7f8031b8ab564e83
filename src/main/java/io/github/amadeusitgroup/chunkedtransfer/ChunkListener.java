package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Hooks invoked by {@link ChunkWorker} as a chunk moves through its lifecycle.
 */
public interface ChunkListener {

    default void onChunkStarted(ChunkDescriptor chunk) {
    }

    /**
     * @param attempt zero-based attempt number
     */
    default void onAttemptStarted(ChunkDescriptor chunk, int attempt) {
    }

    default void onAttemptFailed(ChunkDescriptor chunk, int attempt, Exception error, boolean willRetry) {
    }

    default void onChunkCompleted(ChunkDescriptor chunk) {
    }

    default void onChunkFailed(ChunkDescriptor chunk) {
    }
}

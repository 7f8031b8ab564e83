package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Lifecycle of a single chunk.
 */
public enum ChunkStatus {
    PENDING,
    IN_FLIGHT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

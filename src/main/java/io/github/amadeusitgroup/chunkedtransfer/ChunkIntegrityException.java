package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Size or checksum mismatch on a single chunk. Retryable.
 */
public class ChunkIntegrityException extends TransferException {

    private static final long serialVersionUID = 1L;

    public ChunkIntegrityException(String message) {
        super(message, -1, ErrorCategory.RETRYABLE, null);
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

/**
 * A chunk attempt did not finish within its per-attempt timeout.
 */
public class ChunkTimeoutException extends TransferException {

    private static final long serialVersionUID = 1L;

    public ChunkTimeoutException(String message) {
        super(message, -1, ErrorCategory.RETRYABLE, null);
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Raised when a cooperative cancellation interrupts a transfer.
 */
public class TransferCancelledException extends TransferException {

    private static final long serialVersionUID = 1L;

    public TransferCancelledException(String message) {
        super(message, -1, ErrorCategory.NON_RETRYABLE, null);
    }
}

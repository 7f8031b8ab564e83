package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;

/**
 * Base checked error of the transfer engine.
 */
public class TransferException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final ErrorCategory category;

    public TransferException(String message) {
        this(message, -1, ErrorCategory.RETRYABLE, null);
    }

    public TransferException(String message, Throwable cause) {
        this(message, -1, ErrorCategory.RETRYABLE, cause);
    }

    public TransferException(String message, int statusCode) {
        this(message, statusCode, ErrorCategory.fromStatusCode(statusCode), null);
    }

    public TransferException(String message, int statusCode, ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.category = category;
    }

    /**
     * Status code reported by the remote side, or -1 when there was none.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return category != ErrorCategory.NON_RETRYABLE;
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Thrown when a payload of zero or negative size is submitted for planning.
 */
public class InvalidPayloadSizeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final long totalBytes;

    public InvalidPayloadSizeException(long totalBytes) {
        super("Invalid payload size: " + totalBytes + " (must be positive)");
        this.totalBytes = totalBytes;
    }

    public long getTotalBytes() {
        return totalBytes;
    }
}

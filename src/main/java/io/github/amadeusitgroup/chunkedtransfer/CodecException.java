package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;

/**
 * Malformed or invalid wire payload.
 */
public class CodecException extends IOException {

    private static final long serialVersionUID = 1L;

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

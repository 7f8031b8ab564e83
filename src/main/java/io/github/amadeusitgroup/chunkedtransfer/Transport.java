package io.github.amadeusitgroup.chunkedtransfer;

import java.io.Closeable;
import java.io.IOException;

/**
 * Request/response primitive the engine rides on.
 */
public interface Transport extends Closeable {

    TransportResponse send(TransportRequest request) throws IOException;

    /**
     * Send with a cancellation token wired to abort the underlying I/O.
     */
    default TransportResponse send(TransportRequest request, CancellationToken token) throws IOException {
        if (token != null) {
            token.throwIfCancelled();
        }
        return send(request);
    }

    boolean isOpen();

    /**
     * Number of underlying connections opened so far.
     */
    int getConnectionsOpened();
}

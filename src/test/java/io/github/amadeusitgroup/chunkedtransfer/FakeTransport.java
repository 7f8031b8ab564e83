package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport answering requests through a handler.
 */
class FakeTransport implements Transport {

    @FunctionalInterface
    interface Handler {
        TransportResponse handle(TransportRequest request) throws IOException;
    }

    private final Handler handler;
    private final List<TransportRequest> requests = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    FakeTransport(Handler handler) {
        this.handler = handler;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException {
        if (!open) {
            throw new TransferException("closed");
        }
        requests.add(request);
        return handler.handle(request);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public int getConnectionsOpened() {
        return 1;
    }

    @Override
    public void close() {
        open = false;
    }

    List<TransportRequest> getRequests() {
        return requests;
    }
}

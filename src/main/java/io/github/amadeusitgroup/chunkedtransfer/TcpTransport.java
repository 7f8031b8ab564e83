package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport over a small set of persistent sockets to one host.
 * At most {@code maxSockets} requests are on the wire at once; idle sockets are reused.
 */
public class TcpTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(TcpTransport.class);

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final Semaphore socketPermits;
    private final BlockingDeque<Socket> idleSockets = new LinkedBlockingDeque<>();
    private final Set<Socket> busySockets = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionsOpened = new AtomicInteger(0);
    private final TcpFrameCodec frameCodec = new TcpFrameCodec();
    private volatile boolean open = true;

    public TcpTransport(String host, int port, int maxSockets, int connectTimeoutMs, int readTimeoutMs) {
        if (maxSockets <= 0) {
            throw new IllegalArgumentException("maxSockets must be positive");
        }
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.socketPermits = new Semaphore(maxSockets, true);
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException {
        return send(request, null);
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) throws IOException {
        if (!open) {
            throw new TransferException("Transport to " + host + ":" + port + " is closed");
        }
        if (token != null) {
            token.throwIfCancelled();
        }
        try {
            socketPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Interrupted waiting for a socket to " + host + ":" + port);
        }

        Socket socket = null;
        Runnable abort = null;
        try {
            socket = borrowSocket();
            final Socket active = socket;
            abort = () -> closeQuietly(active);
            if (token != null) {
                token.addCallback(abort);
            }
            if (request.getTimeoutMs() > 0) {
                socket.setSoTimeout((int) request.getTimeoutMs());
            }

            frameCodec.writeFrame(socket.getOutputStream(), frameCodec.encodeRequest(request));
            TransportResponse response = frameCodec.decodeResponse(frameCodec.readFrame(socket.getInputStream()));
            socket.setSoTimeout(readTimeoutMs);
            returnSocket(socket);
            socket = null;
            return response;
        } catch (IOException e) {
            if (token != null && token.isCancelled()) {
                throw new TransferCancelledException("Request " + request + " aborted");
            }
            throw e;
        } finally {
            if (token != null && abort != null) {
                token.removeCallback(abort);
            }
            if (socket != null) {
                busySockets.remove(socket);
                closeQuietly(socket);
            }
            socketPermits.release();
        }
    }

    private Socket borrowSocket() throws IOException {
        Socket socket;
        while ((socket = idleSockets.pollFirst()) != null) {
            if (!socket.isClosed() && socket.isConnected()) {
                busySockets.add(socket);
                return socket;
            }
        }
        socket = new Socket();
        socket.setKeepAlive(true);
        socket.setTcpNoDelay(true);
        socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
        socket.setSoTimeout(readTimeoutMs);
        connectionsOpened.incrementAndGet();
        busySockets.add(socket);
        logger.debug("Opened socket to {}:{} ({} total)", host, port, connectionsOpened.get());
        return socket;
    }

    private void returnSocket(Socket socket) {
        busySockets.remove(socket);
        if (open) {
            idleSockets.offerFirst(socket);
        } else {
            closeQuietly(socket);
        }
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket to {}:{}: {}", host, port, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public int getConnectionsOpened() {
        return connectionsOpened.get();
    }

    public int getIdleSocketCount() {
        return idleSockets.size();
    }

    @Override
    public void close() {
        open = false;
        Socket socket;
        while ((socket = idleSockets.pollFirst()) != null) {
            closeQuietly(socket);
        }
        for (Socket busy : busySockets) {
            closeQuietly(busy);
        }
        busySockets.clear();
    }
}

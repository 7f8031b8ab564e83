package io.github.amadeusitgroup.chunkedtransfer;

import java.net.URI;
import java.util.Locale;

/**
 * Creates an {@link HttpTransport} for http/https endpoints and a {@link TcpTransport} for tcp endpoints.
 */
public class DefaultTransportFactory implements TransportFactory {

    private final int maxSockets;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final long keepAliveMs;

    public DefaultTransportFactory() {
        this(ConnectionPool.DEFAULT_MAX_SOCKETS, 30000, 30000, ConnectionPool.DEFAULT_IDLE_TTL_MS);
    }

    public DefaultTransportFactory(int maxSockets, int connectTimeoutMs, int readTimeoutMs, long keepAliveMs) {
        this.maxSockets = maxSockets;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.keepAliveMs = keepAliveMs;
    }

    @Override
    public Transport create(String endpointKey) throws TransferException {
        URI uri = URI.create(endpointKey);
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        switch (scheme) {
            case "http":
            case "https":
                return new HttpTransport(endpointKey, connectTimeoutMs, readTimeoutMs, keepAliveMs);
            case "tcp":
                if (uri.getPort() < 0) {
                    throw new TransferException("TCP endpoint requires a port: " + endpointKey, -1,
                        ErrorCategory.NON_RETRYABLE, null);
                }
                return new TcpTransport(uri.getHost(), uri.getPort(), maxSockets, connectTimeoutMs, readTimeoutMs);
            default:
                throw new TransferException("Unsupported endpoint scheme: " + endpointKey, -1,
                    ErrorCategory.NON_RETRYABLE, null);
        }
    }
}

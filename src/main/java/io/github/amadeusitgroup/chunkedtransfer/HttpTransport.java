package io.github.amadeusitgroup.chunkedtransfer;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport over {@link HttpURLConnection} with keep-alive. The JDK keeps the underlying
 * sockets alive between requests to the same host; this class bounds the read/connect timeouts
 * and tracks in-flight connections so they can be aborted.
 */
public class HttpTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);

    static final String USER_AGENT = "ChunkedTransferEngine/1.0";

    private final String baseUrl;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final long keepAliveMs;
    private final Set<HttpURLConnection> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionsOpened = new AtomicInteger(0);
    private volatile boolean open = true;

    public HttpTransport(String baseUrl, int connectTimeoutMs, int readTimeoutMs, long keepAliveMs) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.keepAliveMs = keepAliveMs;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException {
        return send(request, null);
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) throws IOException {
        if (!open) {
            throw new TransferException("Transport to " + baseUrl + " is closed");
        }
        if (token != null) {
            token.throwIfCancelled();
        }

        HttpURLConnection connection = openConnection(request);
        Runnable abort = connection::disconnect;
        inFlight.add(connection);
        if (token != null) {
            token.addCallback(abort);
        }
        try {
            byte[] body = request.getBody();
            if (body != null && body.length > 0) {
                connection.setDoOutput(true);
                connection.setFixedLengthStreamingMode(body.length);
                try (OutputStream out = connection.getOutputStream()) {
                    out.write(body);
                }
            }

            int status = connection.getResponseCode();
            byte[] responseBody = readBody(connection, status, request.getMethod());
            logger.debug("{} {}{} -> {}", request.getMethod(), baseUrl, request.getPath(), status);
            return new TransportResponse(status, readHeaders(connection), responseBody);
        } catch (IOException e) {
            if (token != null && token.isCancelled()) {
                throw new TransferCancelledException("Request " + request + " aborted");
            }
            throw e;
        } finally {
            if (token != null) {
                token.removeCallback(abort);
            }
            inFlight.remove(connection);
        }
    }

    private HttpURLConnection openConnection(TransportRequest request) throws IOException {
        URL url = new URL(baseUrl + request.getPath());
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        connectionsOpened.incrementAndGet();

        connection.setRequestMethod(request.getMethod());
        connection.setConnectTimeout(connectTimeoutMs);
        connection.setReadTimeout(request.getTimeoutMs() > 0 ? (int) request.getTimeoutMs() : readTimeoutMs);
        connection.setUseCaches(false);
        connection.setRequestProperty("User-Agent", USER_AGENT);
        connection.setRequestProperty("Connection", "keep-alive");
        connection.setRequestProperty("Keep-Alive", "timeout=" + (keepAliveMs / 1000));
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            connection.setRequestProperty(header.getKey(), header.getValue());
        }
        return connection;
    }

    private byte[] readBody(HttpURLConnection connection, int status, String method) throws IOException {
        if ("HEAD".equals(method)) {
            return new byte[0];
        }
        InputStream stream = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
        if (stream == null) {
            return new byte[0];
        }
        try (InputStream in = stream) {
            return IOUtils.toByteArray(in);
        }
    }

    private Map<String, String> readHeaders(HttpURLConnection connection) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : connection.getHeaderFields().entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null && !entry.getValue().isEmpty()) {
                headers.put(entry.getKey(), String.join(", ", entry.getValue()));
            }
        }
        return headers;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public int getConnectionsOpened() {
        return connectionsOpened.get();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Abort in-flight requests and refuse new ones.
     */
    @Override
    public void close() {
        open = false;
        for (HttpURLConnection connection : inFlight) {
            connection.disconnect();
        }
        inFlight.clear();
    }
}

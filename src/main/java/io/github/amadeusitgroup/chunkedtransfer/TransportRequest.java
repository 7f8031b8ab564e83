package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single logical request sent over a {@link Transport}.
 */
public class TransportRequest {

    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final byte[] body;
    private final long timeoutMs;

    private TransportRequest(String method, String path, Map<String, String> headers, byte[] body, long timeoutMs) {
        this.method = method;
        this.path = path;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.timeoutMs = timeoutMs;
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody() { return body; }

    /**
     * Read timeout for this request, or 0 to use the transport default.
     */
    public long getTimeoutMs() { return timeoutMs; }

    public String getHeader(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return method + " " + path + (body != null ? " (" + body.length + " bytes)" : "");
    }

    public static class Builder {
        private final String method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private long timeoutMs;

        private Builder(String method, String path) {
            if (method == null || path == null) {
                throw new IllegalArgumentException("method and path are required");
            }
            this.method = method;
            this.path = path.startsWith("/") ? path : "/" + path;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public TransportRequest build() {
            return new TransportRequest(method, path, headers, body, timeoutMs);
        }
    }
}

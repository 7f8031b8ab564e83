package io.github.amadeusitgroup.chunkedtransfer;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response to a {@link TransportRequest}. Header lookup is case-insensitive.
 */
public class TransportResponse {

    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;

    public TransportResponse(int statusCode, Map<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            sorted.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(sorted);
        this.body = body != null ? body : EMPTY;
    }

    public int getStatusCode() { return statusCode; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody() { return body; }

    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * Numeric header value, or -1 when absent or malformed.
     */
    public long getLongHeader(String name) {
        String value = headers.get(name);
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Stream view of the body.
     */
    public InputStream openBody() {
        return new ByteArrayInputStream(body);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @throws TransferException carrying the status code when the response is not 2xx
     */
    public TransportResponse requireSuccess(String context) throws TransferException {
        if (!isSuccessful()) {
            throw new TransferException(context + " failed with HTTP " + statusCode, statusCode);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("TransportResponse{status=%d, bodyLength=%d}", statusCode, body.length);
    }
}

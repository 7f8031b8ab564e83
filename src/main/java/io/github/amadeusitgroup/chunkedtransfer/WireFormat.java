package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Locale;

/**
 * Payload encodings an endpoint may support, in descending preference.
 */
public enum WireFormat {
    BINARY("protobuf", "application/x-protobuf", null),
    COMPRESSED_TEXT("json-compressed", "application/json", "gzip"),
    TEXT("json", "application/json", null);

    private final String token;
    private final String contentType;
    private final String contentEncoding;

    WireFormat(String token, String contentType, String contentEncoding) {
        this.token = token;
        this.contentType = contentType;
        this.contentEncoding = contentEncoding;
    }

    /**
     * Name used in capability headers and bodies.
     */
    public String getToken() { return token; }
    public String getContentType() { return contentType; }
    public String getContentEncoding() { return contentEncoding; }

    /**
     * @return the format for a capability token, or null when unknown
     */
    public static WireFormat fromToken(String token) {
        if (token == null) {
            return null;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (WireFormat format : values()) {
            if (format.token.equals(normalized) || format.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return format;
            }
        }
        if ("binary".equals(normalized)) {
            return BINARY;
        }
        if ("compressed-text".equals(normalized)) {
            return COMPRESSED_TEXT;
        }
        if ("text".equals(normalized)) {
            return TEXT;
        }
        return null;
    }

    /**
     * Infer the format of a response body from its content headers.
     */
    public static WireFormat fromContentHeaders(String contentType, String contentEncoding) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("protobuf")) {
            return BINARY;
        }
        if (contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return COMPRESSED_TEXT;
        }
        return TEXT;
    }
}

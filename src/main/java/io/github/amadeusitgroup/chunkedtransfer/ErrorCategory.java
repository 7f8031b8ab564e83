package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Locale;

/**
 * Coarse classification of transfer errors used to decide whether to retry.
 */
public enum ErrorCategory {
    RETRYABLE,
    NON_RETRYABLE,
    RATE_LIMITED;

    /**
     * Classify an HTTP-like status code.
     */
    public static ErrorCategory fromStatusCode(int statusCode) {
        switch (statusCode) {
            case 429:
            case 503:
            case 509:
                return RATE_LIMITED;
            case 408:
            case 500:
            case 502:
            case 504:
                return RETRYABLE;
            default:
                if (statusCode >= 400 && statusCode < 500) {
                    return NON_RETRYABLE;
                }
                return RETRYABLE;
        }
    }

    /**
     * Classify a free-form error message by well known keywords.
     */
    public static ErrorCategory fromMessage(String message) {
        if (message == null) {
            return RETRYABLE;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("too many requests") || lower.contains("rate limit")) {
            return RATE_LIMITED;
        }
        if (lower.contains("not found") || lower.contains("unauthorized") || lower.contains("forbidden")
                || lower.contains("permission denied") || lower.contains("access denied")
                || lower.contains("invalid credentials")) {
            return NON_RETRYABLE;
        }
        return RETRYABLE;
    }
}

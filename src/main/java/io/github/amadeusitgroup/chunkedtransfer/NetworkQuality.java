package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Locale;

/**
 * Caller supplied hint about the link, scaling the initial chunk size.
 */
public enum NetworkQuality {
    FAST(1.5),
    MEDIUM(1.0),
    SLOW(0.5);

    private final double multiplier;

    NetworkQuality(double multiplier) {
        this.multiplier = multiplier;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public static NetworkQuality fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown network quality: " + value, e);
        }
    }
}

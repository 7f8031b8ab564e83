package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * What an endpoint supports, as discovered by {@link CapabilityNegotiator}.
 */
public class CapabilityProfile {

    public static final String FEATURE_RANGE_REQUESTS = "range-requests";
    public static final String FEATURE_COMPRESSION = "compression";
    public static final String FEATURE_CHUNKED_TRANSFER = "chunked-transfer";
    public static final String FEATURE_RESUME_UPLOAD = "resume-upload";

    private final String endpointKey;
    private final Set<WireFormat> supportedFormats;
    private final Set<String> supportedFeatures;
    private final WireFormat recommendedFormat;
    private final String serverInfo;
    private final long cachedUntil;

    public CapabilityProfile(String endpointKey, Set<WireFormat> supportedFormats, Set<String> supportedFeatures,
                             WireFormat recommendedFormat, String serverInfo, long cachedUntil) {
        this.endpointKey = endpointKey;
        this.supportedFormats = supportedFormats.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(WireFormat.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(supportedFormats));
        this.supportedFeatures = Collections.unmodifiableSet(new LinkedHashSet<>(supportedFeatures));
        this.recommendedFormat = recommendedFormat;
        this.serverInfo = serverInfo;
        this.cachedUntil = cachedUntil;
    }

    /**
     * Conservative profile used when negotiation fails: text only, no features.
     */
    public static CapabilityProfile fallback(String endpointKey) {
        return new CapabilityProfile(endpointKey, EnumSet.of(WireFormat.TEXT), Collections.<String>emptySet(),
            WireFormat.TEXT, null, 0);
    }

    /**
     * Pick the best format: binary, then compressed text when compression is a feature, then text.
     */
    public static WireFormat selectRecommendedFormat(Set<WireFormat> formats, Set<String> features) {
        if (formats.contains(WireFormat.BINARY)) {
            return WireFormat.BINARY;
        }
        if (features.contains(FEATURE_COMPRESSION) && formats.contains(WireFormat.TEXT)) {
            return WireFormat.COMPRESSED_TEXT;
        }
        return WireFormat.TEXT;
    }

    public String getEndpointKey() { return endpointKey; }
    public Set<WireFormat> getSupportedFormats() { return supportedFormats; }
    public Set<String> getSupportedFeatures() { return supportedFeatures; }
    public WireFormat getRecommendedFormat() { return recommendedFormat; }
    public String getServerInfo() { return serverInfo; }
    public long getCachedUntil() { return cachedUntil; }

    public boolean supportsFormat(WireFormat format) {
        return supportedFormats.contains(format);
    }

    public boolean supportsFeature(String feature) {
        return supportedFeatures.contains(feature);
    }

    public boolean isExpired(long now) {
        return now >= cachedUntil;
    }

    /**
     * Choose the format to use given an optional caller preference.
     */
    public WireFormat resolveFormat(WireFormat preferred) {
        if (preferred != null && (supportedFormats.contains(preferred)
                || (preferred == WireFormat.COMPRESSED_TEXT && supportsFeature(FEATURE_COMPRESSION)))) {
            return preferred;
        }
        return recommendedFormat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapabilityProfile)) return false;
        CapabilityProfile that = (CapabilityProfile) o;
        return Objects.equals(endpointKey, that.endpointKey)
            && supportedFormats.equals(that.supportedFormats)
            && supportedFeatures.equals(that.supportedFeatures)
            && recommendedFormat == that.recommendedFormat;
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpointKey, supportedFormats, supportedFeatures, recommendedFormat);
    }

    @Override
    public String toString() {
        return String.format("CapabilityProfile{endpoint=%s, formats=%s, features=%s, recommended=%s, server=%s}",
            endpointKey, supportedFormats, supportedFeatures, recommendedFormat, serverInfo);
    }
}

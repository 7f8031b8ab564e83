package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Discovers and caches the wire formats and features an endpoint supports.
 * Negotiation failures are absorbed: after the last probe attempt a conservative fallback profile
 * is returned.
 */
public class CapabilityNegotiator {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityNegotiator.class);

    public static final String CAPABILITIES_PATH = "/api/capabilities";
    public static final String CLIENT_VERSION = "2.0.0";
    public static final long DEFAULT_CACHE_TTL_MS = 300000;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 5000;

    static final List<String> CLIENT_CAPABILITIES = Arrays.asList(
        WireFormat.TEXT.getToken(),
        WireFormat.BINARY.getToken(),
        CapabilityProfile.FEATURE_CHUNKED_TRANSFER,
        CapabilityProfile.FEATURE_RANGE_REQUESTS,
        CapabilityProfile.FEATURE_COMPRESSION,
        CapabilityProfile.FEATURE_RESUME_UPLOAD);

    private final ConnectionPool connectionPool;
    private final TransferClock clock;
    private final long cacheTtlMs;
    private final int maxAttempts;
    private final long probeTimeoutMs;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, CapabilityProfile> cache = new ConcurrentHashMap<>();

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();

    public CapabilityNegotiator(ConnectionPool connectionPool) {
        this(connectionPool, TransferClock.SYSTEM, DEFAULT_CACHE_TTL_MS, DEFAULT_MAX_ATTEMPTS, DEFAULT_PROBE_TIMEOUT_MS);
    }

    public CapabilityNegotiator(ConnectionPool connectionPool, TransferClock clock, long cacheTtlMs, int maxAttempts,
                                long probeTimeoutMs) {
        this.connectionPool = connectionPool;
        this.clock = clock;
        this.cacheTtlMs = cacheTtlMs;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public static CapabilityNegotiator fromConfiguration(ConfigurationManager config, ConnectionPool pool,
                                                         TransferClock clock) {
        return new CapabilityNegotiator(pool, clock,
            config.getLong("capability.cacheTtlMs", DEFAULT_CACHE_TTL_MS),
            config.getInt("capability.maxAttempts", DEFAULT_MAX_ATTEMPTS),
            DEFAULT_PROBE_TIMEOUT_MS);
    }

    /**
     * Cached profile when still valid, otherwise a fresh probe. Never throws for probe failures.
     */
    public CapabilityProfile negotiate(String endpoint) {
        String key = ConnectionPool.normalizeEndpoint(endpoint);
        CapabilityProfile cached = cache.get(key);
        if (cached != null && !cached.isExpired(clock.currentTimeMillis())) {
            cacheHits.incrementAndGet();
            logger.debug("Using cached capabilities for {}", key);
            return cached;
        }
        cacheMisses.incrementAndGet();
        return probe(key);
    }

    /**
     * Drop any cached profile and probe again.
     */
    public CapabilityProfile refresh(String endpoint) {
        String key = ConnectionPool.normalizeEndpoint(endpoint);
        cache.remove(key);
        return probe(key);
    }

    private CapabilityProfile probe(String key) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                CapabilityProfile profile = sendProbe(key);
                cache.put(key, profile);
                logger.info("Negotiated capabilities for {}: formats={}, features={}, recommended={}",
                    key, profile.getSupportedFormats(), profile.getSupportedFeatures(), profile.getRecommendedFormat());
                return profile;
            } catch (IOException e) {
                logger.warn("Capability probe of {} failed (attempt {}/{}): {}", key, attempt, maxAttempts,
                    e.getMessage());
                if (attempt < maxAttempts && !backoff(attempt)) {
                    break;
                }
            }
        }
        fallbacks.incrementAndGet();
        CapabilityProfile fallback = CapabilityProfile.fallback(key);
        logger.info("Using fallback capabilities for {}", key);
        return fallback;
    }

    private boolean backoff(int attempt) {
        try {
            clock.sleep(1000L * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Capability negotiation interrupted");
            return false;
        }
    }

    private CapabilityProfile sendProbe(String key) throws IOException {
        TransportRequest request = TransportRequest.builder("OPTIONS", CAPABILITIES_PATH)
            .header("Accept", WireFormat.TEXT.getContentType() + ", " + WireFormat.BINARY.getContentType())
            .header("X-Client-Capabilities", objectMapper.writeValueAsString(CLIENT_CAPABILITIES))
            .header("X-Client-Version", CLIENT_VERSION)
            .timeoutMs(probeTimeoutMs)
            .build();

        Transport transport = connectionPool.acquire(key);
        try {
            TransportResponse response = transport.send(request);
            if (response.getStatusCode() >= 500) {
                throw new TransferException("Capability probe returned HTTP " + response.getStatusCode(),
                    response.getStatusCode());
            }
            return parseResponse(key, response);
        } finally {
            connectionPool.release(key);
        }
    }

    CapabilityProfile parseResponse(String key, TransportResponse response) {
        Set<WireFormat> formats = EnumSet.of(WireFormat.TEXT);
        Set<String> features = new LinkedHashSet<>();

        String accept = response.getHeader("Accept");
        if (accept != null && accept.contains(WireFormat.BINARY.getContentType())) {
            formats.add(WireFormat.BINARY);
        }

        String serverCapabilities = response.getHeader("X-Server-Capabilities");
        if (serverCapabilities != null && !serverCapabilities.isEmpty()) {
            try {
                mergeDeclared(objectMapper.readTree(serverCapabilities), formats, features);
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring malformed X-Server-Capabilities header from {}: {}", key, e.getOriginalMessage());
            }
        }

        String acceptRanges = response.getHeader("Accept-Ranges");
        if (acceptRanges != null && acceptRanges.toLowerCase(Locale.ROOT).contains("bytes")) {
            features.add(CapabilityProfile.FEATURE_RANGE_REQUESTS);
        }
        String acceptEncoding = response.getHeader("Accept-Encoding");
        if (acceptEncoding != null && acceptEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            features.add(CapabilityProfile.FEATURE_COMPRESSION);
        }

        byte[] body = response.getBody();
        if (body != null && body.length > 0) {
            try {
                JsonNode root = objectMapper.readTree(body);
                if (root != null && root.has("capabilities")) {
                    mergeDeclared(root.get("capabilities"), formats, features);
                }
            } catch (IOException e) {
                logger.debug("Capability body from {} is not JSON: {}", key, e.getMessage());
            }
        }

        WireFormat recommended = CapabilityProfile.selectRecommendedFormat(formats, features);
        if (recommended == WireFormat.COMPRESSED_TEXT) {
            formats.add(WireFormat.COMPRESSED_TEXT);
        }
        return new CapabilityProfile(key, formats, features, recommended, response.getHeader("Server"),
            clock.currentTimeMillis() + cacheTtlMs);
    }

    private void mergeDeclared(JsonNode declared, Set<WireFormat> formats, Set<String> features) {
        if (declared == null || !declared.isObject()) {
            return;
        }
        JsonNode declaredFormats = declared.get("formats");
        if (declaredFormats instanceof ArrayNode) {
            for (Iterator<JsonNode> it = declaredFormats.elements(); it.hasNext(); ) {
                WireFormat format = WireFormat.fromToken(it.next().asText());
                if (format != null) {
                    formats.add(format);
                }
            }
        }
        JsonNode declaredFeatures = declared.get("features");
        if (declaredFeatures instanceof ArrayNode) {
            for (Iterator<JsonNode> it = declaredFeatures.elements(); it.hasNext(); ) {
                features.add(it.next().asText());
            }
        }
    }

    // Cache maintenance

    /**
     * @return number of removed entries
     */
    public int clearExpired() {
        long now = clock.currentTimeMillis();
        int before = cache.size();
        cache.values().removeIf(profile -> profile.isExpired(now));
        return before - cache.size();
    }

    public void clearAll() {
        cache.clear();
    }

    public CacheStats getCacheStats() {
        long now = clock.currentTimeMillis();
        int valid = 0;
        for (CapabilityProfile profile : cache.values()) {
            if (!profile.isExpired(now)) {
                valid++;
            }
        }
        return new CacheStats(cache.size(), valid, cacheHits.get(), cacheMisses.get(), fallbacks.get());
    }

    public static class CacheStats {
        private final int totalEntries;
        private final int validEntries;
        private final long hits;
        private final long misses;
        private final long fallbacks;

        public CacheStats(int totalEntries, int validEntries, long hits, long misses, long fallbacks) {
            this.totalEntries = totalEntries;
            this.validEntries = validEntries;
            this.hits = hits;
            this.misses = misses;
            this.fallbacks = fallbacks;
        }

        public int getTotalEntries() { return totalEntries; }
        public int getValidEntries() { return validEntries; }
        public int getExpiredEntries() { return totalEntries - validEntries; }
        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getFallbacks() { return fallbacks; }

        @Override
        public String toString() {
            return String.format("CacheStats{entries=%d, valid=%d, hits=%d, misses=%d, fallbacks=%d}",
                totalEntries, validEntries, hits, misses, fallbacks);
        }
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted pool of transports keyed by normalized endpoint (scheme + host + port).
 * Every session targeting the same endpoint shares one entry. Entries whose reference count
 * dropped to zero stay warm until an idle sweep evicts them after the idle TTL; the sweep only
 * runs while the pool holds entries.
 */
public class ConnectionPool implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    public static final int DEFAULT_MAX_SOCKETS = 8;
    public static final long DEFAULT_IDLE_TTL_MS = 300000; // 5 minutes
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60000;

    private final TransportFactory transportFactory;
    private final TransferClock clock;
    private final long idleTtlMs;
    private final long sweepIntervalMs;

    private final Map<String, PoolEntry> entries = new HashMap<>();
    private final ReentrantLock poolLock = new ReentrantLock();
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong connectionsCreated = new AtomicLong(0);
    private final AtomicLong connectionsReused = new AtomicLong(0);

    private ScheduledExecutorService sweeper;
    private boolean shutdown;

    public ConnectionPool() {
        this(new DefaultTransportFactory(), TransferClock.SYSTEM, DEFAULT_IDLE_TTL_MS, DEFAULT_SWEEP_INTERVAL_MS);
    }

    public ConnectionPool(TransportFactory transportFactory, TransferClock clock, long idleTtlMs, long sweepIntervalMs) {
        this.transportFactory = transportFactory;
        this.clock = clock;
        this.idleTtlMs = idleTtlMs;
        this.sweepIntervalMs = sweepIntervalMs;
    }

    /**
     * Build a pool from {@code pool.*} configuration keys.
     */
    public static ConnectionPool fromConfiguration(ConfigurationManager config, TransferClock clock) {
        int maxSockets = config.getInt("pool.maxSockets", DEFAULT_MAX_SOCKETS);
        int connectTimeout = config.getInt("pool.connectTimeoutMs", 30000);
        int readTimeout = config.getInt("transfer.timeoutMs", 30000);
        long idleTtl = config.getLong("pool.idleTtlMs", DEFAULT_IDLE_TTL_MS);
        long sweepInterval = config.getLong("pool.sweepIntervalMs", DEFAULT_SWEEP_INTERVAL_MS);
        return new ConnectionPool(new DefaultTransportFactory(maxSockets, connectTimeout, readTimeout, idleTtl),
            clock, idleTtl, sweepInterval);
    }

    /**
     * Get the shared transport for an endpoint, creating the entry on first use.
     */
    public Transport acquire(String endpoint) throws IOException {
        String key = normalizeEndpoint(endpoint);
        long now = clock.currentTimeMillis();
        totalRequests.incrementAndGet();

        poolLock.lock();
        try {
            if (shutdown) {
                throw new TransferException("Connection pool is shut down");
            }

            PoolEntry entry = entries.get(key);
            if (entry != null && (entry.referenceCount > 0 || !entry.isIdleExpired(now, idleTtlMs))
                    && entry.transport.isOpen()) {
                entry.referenceCount++;
                entry.lastUsedAt = now;
                entry.reused++;
                connectionsReused.incrementAndGet();
                return entry.transport;
            }

            int inheritedReferences = 0;
            if (entry != null) {
                entries.remove(key);
                // holders of the dead transport still release against this key
                inheritedReferences = entry.referenceCount;
                if (inheritedReferences > 0) {
                    logger.debug("Replacing closed transport for {} with {} holders", key, inheritedReferences);
                }
                closeTransport(entry);
            }

            Transport transport = transportFactory.create(key);
            entry = new PoolEntry(key, transport, now);
            entry.referenceCount += inheritedReferences;
            entries.put(key, entry);
            connectionsCreated.incrementAndGet();
            logger.debug("Created pool entry for {}", key);
            ensureSweeper();
            return transport;
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Drop one reference. At zero the entry stays warm but becomes eligible for the idle sweep.
     */
    public void release(String endpoint) {
        String key = normalizeEndpoint(endpoint);
        poolLock.lock();
        try {
            PoolEntry entry = entries.get(key);
            if (entry == null) {
                logger.debug("Release for unknown endpoint {}", key);
                return;
            }
            if (entry.referenceCount == 0) {
                logger.warn("Unbalanced release for {}", key);
                return;
            }
            entry.referenceCount--;
            entry.lastUsedAt = clock.currentTimeMillis();
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Evict unreferenced entries idle for longer than the TTL. Stops the sweeper once the pool is empty.
     *
     * @return number of evicted entries
     */
    public int sweepIdle() {
        long now = clock.currentTimeMillis();
        List<PoolEntry> evicted = new ArrayList<>();
        poolLock.lock();
        try {
            Iterator<PoolEntry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                PoolEntry entry = iterator.next();
                if (entry.referenceCount == 0 && entry.isIdleExpired(now, idleTtlMs)) {
                    iterator.remove();
                    evicted.add(entry);
                }
            }
            if (entries.isEmpty()) {
                stopSweeper();
            }
        } finally {
            poolLock.unlock();
        }

        for (PoolEntry entry : evicted) {
            logger.debug("Evicted idle pool entry {}", entry.endpointKey);
            closeTransport(entry);
        }
        return evicted.size();
    }

    /**
     * Whether the idle sweep may evict the entry once its TTL elapses.
     */
    public boolean isSweepEligible(String endpoint) {
        poolLock.lock();
        try {
            PoolEntry entry = entries.get(normalizeEndpoint(endpoint));
            return entry != null && entry.referenceCount == 0;
        } finally {
            poolLock.unlock();
        }
    }

    public boolean isSweeperRunning() {
        poolLock.lock();
        try {
            return sweeper != null;
        } finally {
            poolLock.unlock();
        }
    }

    public EntryStats getEntryStats(String endpoint) {
        poolLock.lock();
        try {
            PoolEntry entry = entries.get(normalizeEndpoint(endpoint));
            if (entry == null) {
                return null;
            }
            return new EntryStats(entry.endpointKey, entry.referenceCount, entry.created, entry.reused,
                entry.lastUsedAt, entry.transport.getConnectionsOpened());
        } finally {
            poolLock.unlock();
        }
    }

    public PoolStats getPoolStats() {
        int pools;
        poolLock.lock();
        try {
            pools = entries.size();
        } finally {
            poolLock.unlock();
        }
        return new PoolStats(pools, totalRequests.get(), connectionsCreated.get(), connectionsReused.get());
    }

    /**
     * Close every transport and stop the sweeper.
     */
    public void shutdown() {
        List<PoolEntry> closing;
        poolLock.lock();
        try {
            shutdown = true;
            closing = new ArrayList<>(entries.values());
            entries.clear();
            stopSweeper();
        } finally {
            poolLock.unlock();
        }
        for (PoolEntry entry : closing) {
            closeTransport(entry);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Normalize an endpoint URL to {@code scheme://host[:port]}, dropping default ports, paths and case.
     */
    public static String normalizeEndpoint(String endpoint) {
        if (endpoint == null || endpoint.trim().isEmpty()) {
            throw new IllegalArgumentException("Endpoint must not be empty");
        }
        String value = endpoint.trim();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        try {
            URI uri = new URI(value);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            boolean defaultPort = port < 0
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
            return scheme + "://" + host + (defaultPort ? "" : ":" + port);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid endpoint: " + endpoint, e);
        }
    }

    private void ensureSweeper() {
        if (sweeper != null || sweepIntervalMs <= 0) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connection-pool-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleWithFixedDelay(this::sweepSafely, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started idle sweep every {}ms", sweepIntervalMs);
    }

    private void sweepSafely() {
        try {
            sweepIdle();
        } catch (RuntimeException e) {
            logger.warn("Idle sweep failed: {}", e.getMessage(), e);
        }
    }

    private void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdown();
            sweeper = null;
            logger.debug("Stopped idle sweep, pool is empty");
        }
    }

    private void closeTransport(PoolEntry entry) {
        try {
            entry.transport.close();
        } catch (IOException e) {
            logger.warn("Error closing transport for {}: {}", entry.endpointKey, e.getMessage());
        }
    }

    private static final class PoolEntry {
        final String endpointKey;
        final Transport transport;
        int referenceCount = 1;
        long lastUsedAt;
        long created = 1;
        long reused;

        PoolEntry(String endpointKey, Transport transport, long now) {
            this.endpointKey = endpointKey;
            this.transport = transport;
            this.lastUsedAt = now;
        }

        boolean isIdleExpired(long now, long ttl) {
            return now - lastUsedAt > ttl;
        }
    }

    /**
     * Per-endpoint counters.
     */
    public static class EntryStats {
        private final String endpointKey;
        private final int referenceCount;
        private final long connectionsCreated;
        private final long connectionsReused;
        private final long lastUsedAt;
        private final int socketsOpened;

        public EntryStats(String endpointKey, int referenceCount, long connectionsCreated, long connectionsReused,
                          long lastUsedAt, int socketsOpened) {
            this.endpointKey = endpointKey;
            this.referenceCount = referenceCount;
            this.connectionsCreated = connectionsCreated;
            this.connectionsReused = connectionsReused;
            this.lastUsedAt = lastUsedAt;
            this.socketsOpened = socketsOpened;
        }

        public String getEndpointKey() { return endpointKey; }
        public int getReferenceCount() { return referenceCount; }
        public long getConnectionsCreated() { return connectionsCreated; }
        public long getConnectionsReused() { return connectionsReused; }
        public long getLastUsedAt() { return lastUsedAt; }
        public int getSocketsOpened() { return socketsOpened; }

        @Override
        public String toString() {
            return String.format("EntryStats{endpoint=%s, refs=%d, created=%d, reused=%d, sockets=%d}",
                endpointKey, referenceCount, connectionsCreated, connectionsReused, socketsOpened);
        }
    }

    /**
     * Pool statistics class
     */
    public static class PoolStats {
        private final int totalPools;
        private final long totalRequests;
        private final long connectionsCreated;
        private final long connectionsReused;

        public PoolStats(int totalPools, long totalRequests, long connectionsCreated, long connectionsReused) {
            this.totalPools = totalPools;
            this.totalRequests = totalRequests;
            this.connectionsCreated = connectionsCreated;
            this.connectionsReused = connectionsReused;
        }

        public int getTotalPools() { return totalPools; }
        public long getTotalRequests() { return totalRequests; }
        public long getConnectionsCreated() { return connectionsCreated; }
        public long getConnectionsReused() { return connectionsReused; }

        public double getPoolHitRate() {
            return totalRequests > 0 ? (double) connectionsReused / totalRequests : 0.0;
        }

        @Override
        public String toString() {
            return String.format("PoolStats{pools=%d, requests=%d, created=%d, reused=%d, hitRate=%.2f}",
                totalPools, totalRequests, connectionsCreated, connectionsReused, getPoolHitRate());
        }
    }
}

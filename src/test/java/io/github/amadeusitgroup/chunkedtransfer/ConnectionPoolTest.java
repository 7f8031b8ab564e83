package io.github.amadeusitgroup.chunkedtransfer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConnectionPool.
 */
public class ConnectionPoolTest {

    private static final long TTL = 300000;

    private FakeClock clock;
    private List<Transport> created;
    private ConnectionPool pool;

    @BeforeEach
    public void setUp() {
        clock = new FakeClock();
        created = new ArrayList<>();
        pool = new ConnectionPool(key -> {
            Transport transport = mock(Transport.class);
            when(transport.isOpen()).thenReturn(true);
            created.add(transport);
            return transport;
        }, clock, TTL, 0);
    }

    @AfterEach
    public void tearDown() {
        pool.close();
    }

    @Test
    public void testAcquireSharesTransport() throws IOException {
        Transport first = pool.acquire("https://files.example.com");
        Transport second = pool.acquire("https://files.example.com/other/path");

        assertSame(first, second, "Same endpoint should share one transport");
        assertEquals(1, created.size(), "Transport should be created once");
        ConnectionPool.EntryStats stats = pool.getEntryStats("https://files.example.com");
        assertEquals(2, stats.getReferenceCount(), "Two references expected");
        assertEquals(1, stats.getConnectionsReused(), "Second acquire is a reuse");
    }

    @Test
    public void testDifferentEndpointsGetDifferentTransports() throws IOException {
        Transport first = pool.acquire("https://a.example.com");
        Transport second = pool.acquire("https://b.example.com");

        assertNotSame(first, second, "Endpoints should not share transports");
        assertEquals(2, pool.getPoolStats().getTotalPools(), "Two entries expected");
    }

    @Test
    public void testSweepEligibleOnlyAtZeroReferences() throws IOException {
        pool.acquire("https://files.example.com");
        pool.acquire("https://files.example.com");

        pool.release("https://files.example.com");
        assertFalse(pool.isSweepEligible("https://files.example.com"), "One reference still held");

        pool.release("https://files.example.com");
        assertTrue(pool.isSweepEligible("https://files.example.com"), "No references left");
    }

    @Test
    public void testUnbalancedReleaseIsIgnored() throws IOException {
        pool.acquire("https://files.example.com");
        pool.release("https://files.example.com");
        pool.release("https://files.example.com");

        assertEquals(0, pool.getEntryStats("https://files.example.com").getReferenceCount(),
            "Reference count must not go negative");
    }

    @Test
    public void testSweepEvictsOnlyExpiredUnreferencedEntries() throws IOException {
        pool.acquire("https://idle.example.com");
        pool.release("https://idle.example.com");
        pool.acquire("https://busy.example.com");

        clock.advance(TTL / 2);
        assertEquals(0, pool.sweepIdle(), "Nothing is past the TTL yet");

        clock.advance(TTL);
        assertEquals(1, pool.sweepIdle(), "Only the idle entry should be evicted");
        assertNull(pool.getEntryStats("https://idle.example.com"), "Idle entry should be gone");
        assertNotNull(pool.getEntryStats("https://busy.example.com"), "Referenced entry must survive");
        verify(created.get(0)).close();
        verify(created.get(1), never()).close();
    }

    @Test
    public void testWarmEntryIsReusedWithinTtl() throws IOException {
        Transport first = pool.acquire("https://files.example.com");
        pool.release("https://files.example.com");
        clock.advance(TTL - 1);

        assertSame(first, pool.acquire("https://files.example.com"), "Warm entry should be reused");
        assertEquals(1, created.size(), "No new transport expected");
    }

    @Test
    public void testExpiredEntryIsReplacedOnAcquire() throws IOException {
        Transport first = pool.acquire("https://files.example.com");
        pool.release("https://files.example.com");
        clock.advance(TTL + 1);

        Transport second = pool.acquire("https://files.example.com");

        assertNotSame(first, second, "Expired entry should be replaced");
        verify(first).close();
    }

    @Test
    public void testClosedTransportReplacementKeepsHolders() throws IOException {
        Transport first = pool.acquire("https://files.example.com");
        pool.acquire("https://files.example.com");
        when(first.isOpen()).thenReturn(false);

        Transport second = pool.acquire("https://files.example.com");

        assertNotSame(first, second, "Closed transport should be replaced");
        assertEquals(3, pool.getEntryStats("https://files.example.com").getReferenceCount(),
            "Earlier holders should still be counted");

        pool.release("https://files.example.com");
        pool.release("https://files.example.com");
        assertFalse(pool.isSweepEligible("https://files.example.com"), "Newest holder still uses the entry");

        clock.advance(TTL + 1);
        assertEquals(0, pool.sweepIdle(), "Referenced entry must not be swept");
        verify(second, never()).close();
    }

    @Test
    public void testShutdownClosesTransportsAndRejectsAcquire() throws IOException {
        pool.acquire("https://files.example.com");
        pool.shutdown();

        verify(created.get(0)).close();
        assertThrows(TransferException.class, () -> pool.acquire("https://files.example.com"),
            "Acquire after shutdown should fail");
    }

    @Test
    public void testPoolHitRate() throws IOException {
        pool.acquire("https://files.example.com");
        pool.acquire("https://files.example.com");
        pool.acquire("https://files.example.com");
        pool.acquire("https://files.example.com");

        ConnectionPool.PoolStats stats = pool.getPoolStats();
        assertEquals(4, stats.getTotalRequests(), "Four requests expected");
        assertEquals(0.75, stats.getPoolHitRate(), 0.0001, "Three of four acquires should be hits");
    }

    @Test
    public void testSweeperStartsOnlyWithInterval() throws IOException {
        ConnectionPool sweeping = new ConnectionPool(key -> new FakeTransport(request -> null), clock, TTL, 60000);
        try {
            assertFalse(sweeping.isSweeperRunning(), "No sweeper before the first entry");
            sweeping.acquire("https://files.example.com");
            assertTrue(sweeping.isSweeperRunning(), "Sweeper should start with the first entry");
        } finally {
            sweeping.close();
        }
        assertFalse(sweeping.isSweeperRunning(), "Close should stop the sweeper");
    }

    @ParameterizedTest
    @CsvSource({
        "https://Files.Example.com/path, https://files.example.com",
        "http://files.example.com:80, http://files.example.com",
        "https://files.example.com:443/a?b=c, https://files.example.com",
        "http://files.example.com:8080, http://files.example.com:8080",
        "files.example.com, http://files.example.com"
    })
    public void testNormalizeEndpoint(String endpoint, String expected) {
        assertEquals(expected, ConnectionPool.normalizeEndpoint(endpoint), "Normalized endpoint");
    }

    @Test
    public void testNormalizeEndpointRejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionPool.normalizeEndpoint(""), "Empty endpoint");
        assertThrows(IllegalArgumentException.class, () -> ConnectionPool.normalizeEndpoint("http://"),
            "Endpoint without host");
    }
}

package io.github.amadeusitgroup.chunkedtransfer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConcurrencyGate.
 */
public class ConcurrencyGateTest {

    @Test
    public void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyGate(0), "Zero limit should be rejected");
    }

    @Test
    public void testNeverAdmitsMoreThanLimit() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(3);
        ExecutorService executor = Executors.newFixedThreadPool(12);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(40);

        for (int i = 0; i < 40; i++) {
            executor.submit(() -> {
                try {
                    gate.acquire();
                    try {
                        int current = inside.incrementAndGet();
                        maxInside.accumulateAndGet(current, Math::max);
                        Thread.sleep(2);
                        inside.decrementAndGet();
                    } finally {
                        gate.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS), "All tasks should finish");
        executor.shutdownNow();
        assertTrue(maxInside.get() <= 3, "At most 3 holders at once, saw " + maxInside.get());
        assertTrue(gate.getPeakHolders() <= 3, "Peak holders should respect the limit");
        assertEquals(0, gate.getActiveHolders(), "No holders should remain");
        assertEquals(3, gate.getAvailablePermits(), "All permits should be back");
    }

    @Test
    public void testReleaseWakesWaitersInFifoOrder() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        gate.acquire();

        List<Integer> order = new CopyOnWriteArrayList<>();
        List<Thread> waiters = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int id = i;
            Thread t = new Thread(() -> {
                try {
                    gate.acquire();
                    order.add(id);
                    gate.release();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            waitForQueueLength(gate, i + 1);
            waiters.add(t);
        }

        gate.release();
        for (Thread t : waiters) {
            t.join(5000);
        }
        assertEquals(List.of(0, 1, 2), order, "Waiters should be admitted in arrival order");
    }

    @Test
    public void testReleaseAdmitsExactlyOneWaiter() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        gate.acquire();
        AtomicInteger admitted = new AtomicInteger();
        List<Thread> waiters = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            Thread t = new Thread(() -> {
                try {
                    gate.acquire();
                    admitted.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            waiters.add(t);
            waitForQueueLength(gate, i + 1);
        }

        gate.release();
        waitForQueueLength(gate, 1);
        waiters.get(0).join(5000);
        assertEquals(1, admitted.get(), "One release should admit exactly one waiter");
        assertEquals(1, gate.getQueueLength(), "The second waiter should still wait");

        gate.release();
        waiters.get(1).join(5000);
        assertEquals(2, admitted.get(), "Second release should admit the remaining waiter");
    }

    @Test
    public void testReleaseWithoutAcquireFails() {
        ConcurrencyGate gate = new ConcurrencyGate(2);
        assertThrows(IllegalStateException.class, gate::release, "Unbalanced release should fail");
        assertEquals(2, gate.getAvailablePermits(), "Permits should not grow past the limit");
    }

    private static void waitForQueueLength(ConcurrencyGate gate, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (gate.getQueueLength() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, gate.getQueueLength(), "Unexpected number of waiters");
    }
}

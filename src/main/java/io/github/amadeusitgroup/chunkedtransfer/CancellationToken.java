package io.github.amadeusitgroup.chunkedtransfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session scoped cooperative cancellation signal.
 * Workers check it before each attempt; transports register abort callbacks on it
 * so that in-flight I/O is interrupted when the session is cancelled.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Cancel the token. Only the first call runs the registered callbacks.
     */
    public void cancel() {
        cancel("Transfer cancelled");
    }

    public void cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Register an abort callback. Runs immediately when the token is already cancelled.
     */
    public void addCallback(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }

    public void throwIfCancelled() throws TransferCancelledException {
        if (cancelled.get()) {
            throw new TransferCancelledException(reason != null ? reason : "Transfer cancelled");
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}

package de.entwicklertraining.chat.fetcher.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cooperative cancellation signal shared by one top-level chat request and all of its retries.
 *
 * <p>Tokens are obtained from a {@link CancellationTokenSource}. Code that performs blocking work
 * either polls {@link #isCancelled()} or registers a listener with {@link #onCancelled(Runnable)}
 * so that an in-flight stream can be torn down as soon as the caller gives up.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    CancellationToken() {
    }

    /**
     * Returns a shared token that can never be cancelled. {@link #cancel()} is a no-op on it.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if this token has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Cancels this token and runs every registered listener exactly once.
     */
    public void cancel() {
        if (this == NONE) {
            return;
        }
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        List<Runnable> toRun = new ArrayList<>(listeners);
        listeners.clear();
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener that runs when the token is cancelled. If the token is already cancelled
     * the listener runs immediately on the calling thread.
     *
     * @return a registration that removes the listener when closed
     */
    public Registration onCancelled(Runnable listener) {
        if (this == NONE) {
            return () -> { };
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for a listener registered with {@link #onCancelled(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

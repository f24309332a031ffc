package com.questrail.rendezvous.cancel;

import com.questrail.rendezvous.internal.time.Cancellable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The triggerable side of a {@link CancellationToken}.
 *
 * <p>{@link #cancel()} runs every subscribed callback once, on the cancelling
 * thread, outside the internal lock. A callback that throws is logged and does
 * not prevent the others from running.</p>
 */
public final class CancellationManager implements CancellationToken
{
    private static final Logger log = LoggerFactory.getLogger(CancellationManager.class);

    private final Object lock = new Object();
    private final Map<Long, Runnable> callbacks = new LinkedHashMap<>();
    private long nextId;
    private boolean cancelled;

    /**
     * Cancel the token.
     *
     * @return {@code true} if this call cancelled it; {@code false} if it was
     *         already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks.values());
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed", e);
            }
        }
        return true;
    }

    @Override
    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    @Override
    public Cancellable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        final long id;
        synchronized (lock) {
            if (!cancelled) {
                id = nextId++;
                callbacks.put(id, callback);
                return () -> {
                    synchronized (lock) {
                        return callbacks.remove(id) != null;
                    }
                };
            }
        }
        callback.run();
        return () -> false;
    }

    /**
     * Number of callbacks still subscribed.
     */
    public int subscriberCount() {
        synchronized (lock) {
            return callbacks.size();
        }
    }
}

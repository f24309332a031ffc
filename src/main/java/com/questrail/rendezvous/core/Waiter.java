package com.questrail.rendezvous.core;

import com.questrail.rendezvous.api.RecvHandle;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.key.RendezvousKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pending receive. The {@link #claim()} latch decides, exactly once, who
 * resolves it: a matching send, an abort, or a withdrawal.
 */
final class Waiter<R> implements RecvHandle<R>
{
    private final RendezvousKey key;
    private final TransferContext receiverContext;
    private final ChannelTable<?, R> table;
    private final CompletableFuture<R> promise = new CompletableFuture<>();
    private final AtomicBoolean claimed = new AtomicBoolean();

    Waiter(RendezvousKey key, TransferContext receiverContext, ChannelTable<?, R> table) {
        this.key = Objects.requireNonNull(key, "key");
        this.receiverContext = Objects.requireNonNull(receiverContext, "receiverContext");
        this.table = table;
    }

    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    TransferContext receiverContext() {
        return receiverContext;
    }

    CompletableFuture<R> promise() {
        return promise;
    }

    @Override
    public RendezvousKey key() {
        return key;
    }

    @Override
    public CompletableFuture<R> result() {
        return promise;
    }

    @Override
    public boolean withdraw(RendezvousException reason) {
        Objects.requireNonNull(reason, "reason");
        return table.withdraw(this, reason);
    }

    @Override
    public String toString() {
        return "Waiter[" + key + ", claimed=" + claimed.get() + ']';
    }
}

package com.questrail.rendezvous.core;

import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.FusedRendezvous;
import com.questrail.rendezvous.api.RecvHandle;
import com.questrail.rendezvous.api.RefDelivery;
import com.questrail.rendezvous.api.RefRendezvous;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.api.ValueRef;
import com.questrail.rendezvous.internal.time.SystemWallClock;
import com.questrail.rendezvous.internal.time.WallClock;
import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.observability.AbortEvent;
import com.questrail.rendezvous.observability.NullObservabilitySink;
import com.questrail.rendezvous.observability.RendezvousObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * LocalRendezvous
 * =============================================================================
 * In-process rendezvous shared by all producers and consumers of one
 * execution scope.
 *
 * <p>Envelope channels and ref channels live in two separate
 * {@link ChannelTable}s that share one abort state, so a single
 * {@link #abort(Status)} fails both.</p>
 *
 * <h2>Callback execution</h2>
 * Consumers resolved by a producer or by an abort are completed on
 * {@code callbackExecutor}. Dependent stages registered on
 * {@link RecvHandle#result()} therefore run there, not on the producer.
 *
 * <h2>Thread Safety</h2>
 * All methods may be called concurrently from any thread.
 */
public final class LocalRendezvous implements RefRendezvous, FusedRendezvous
{
    private static final Logger log = LoggerFactory.getLogger(LocalRendezvous.class);

    private final AbortState abortState = new AbortState();
    private final ChannelTable<Deposit, Delivery> envelopes;
    private final ChannelTable<RefDeposit, RefDelivery<?>> refs;
    private final RendezvousObservabilitySink sink;
    private final WallClock wallClock;

    public LocalRendezvous(Executor callbackExecutor) {
        this(callbackExecutor, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public LocalRendezvous(Executor callbackExecutor, RendezvousObservabilitySink sink, WallClock wallClock) {
        Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.envelopes = new ChannelTable<>(abortState, callbackExecutor,
                (deposit, receiverContext) -> new Delivery(deposit.envelope(), deposit.senderContext(), receiverContext));
        this.refs = new ChannelTable<>(abortState, callbackExecutor,
                (deposit, receiverContext) -> deposit.deliver(receiverContext));
    }

    @Override
    public void send(RendezvousKey key, TransferContext context, Envelope envelope) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(envelope, "envelope");
        envelopes.send(key, new Deposit(envelope, context));
    }

    @Override
    public RecvHandle<Delivery> recvAsync(RendezvousKey key, TransferContext context) {
        return envelopes.recvAsync(key, context);
    }

    @Override
    public <T> void sendRef(RendezvousKey key, TransferContext context, ValueRef<T> ref, boolean live) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(ref, "ref");
        refs.send(key, new RefDeposit(ref, live, context));
    }

    @Override
    public RecvHandle<RefDelivery<?>> recvRefAsync(RendezvousKey key, TransferContext context) {
        return refs.recvAsync(key, context);
    }

    @Override
    public CompletableFuture<List<Delivery>> fuseRecvAsync(List<RendezvousKey> keys, TransferContext context) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(context, "context");

        List<RecvHandle<Delivery>> handles = new ArrayList<>(keys.size());
        for (RendezvousKey key : keys) {
            handles.add(recvAsync(key, context));
        }

        CompletableFuture<List<Delivery>> fused = new CompletableFuture<>();
        for (RecvHandle<Delivery> handle : handles) {
            handle.result().whenComplete((delivery, failure) -> {
                if (failure == null) {
                    return;
                }
                RendezvousException reason = RendezvousException.from(failure);
                if (fused.completeExceptionally(reason)) {
                    for (RecvHandle<Delivery> other : handles) {
                        other.withdraw(reason);
                    }
                }
            });
        }

        CompletableFuture<?>[] all = handles.stream().map(RecvHandle::result).toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(all).thenRun(() -> {
            List<Delivery> deliveries = new ArrayList<>(handles.size());
            for (RecvHandle<Delivery> handle : handles) {
                deliveries.add(handle.result().join());
            }
            fused.complete(deliveries);
        });
        return fused;
    }

    @Override
    public void abort(Status status) {
        if (!abortState.trySet(status)) {
            log.debug("Ignoring abort({}); already aborted with {}", status, abortState.status().orElse(null));
            return;
        }
        int failed = envelopes.abortAll(status) + refs.abortAll(status);
        sink.onAbort(new AbortEvent(wallClock.now(), status, failed));
    }

    @Override
    public Optional<Status> abortStatus() {
        return abortState.status();
    }

    /**
     * Number of channels currently holding a deposit or a waiter.
     */
    public int pendingChannels() {
        return envelopes.pendingChannels() + refs.pendingChannels();
    }

    private record Deposit(Envelope envelope, TransferContext senderContext) {}

    private record RefDeposit(ValueRef<?> ref, boolean live, TransferContext senderContext)
    {
        RefDelivery<?> deliver(TransferContext receiverContext) {
            return new RefDelivery<>(ref, live, senderContext, receiverContext);
        }
    }
}

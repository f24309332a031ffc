package com.questrail.rendezvous.runtime;

import com.questrail.rendezvous.api.Rendezvous;
import com.questrail.rendezvous.cancel.BlockingRecv;
import com.questrail.rendezvous.codec.impl.DefaultEnvelopeFrameDecoder;
import com.questrail.rendezvous.codec.impl.DefaultEnvelopeFrameEncoder;
import com.questrail.rendezvous.config.RendezvousRuntimeConfig;
import com.questrail.rendezvous.core.LocalRendezvous;
import com.questrail.rendezvous.internal.time.MonotonicClock;
import com.questrail.rendezvous.internal.time.MonotonicScheduler;
import com.questrail.rendezvous.internal.time.ScheduledExecutorScheduler;
import com.questrail.rendezvous.internal.time.SystemMonotonicClock;
import com.questrail.rendezvous.internal.time.SystemWallClock;
import com.questrail.rendezvous.internal.time.WallClock;
import com.questrail.rendezvous.observability.NullObservabilitySink;
import com.questrail.rendezvous.observability.RendezvousObservabilitySink;
import com.questrail.rendezvous.protocol.slice.SliceReceiver;
import com.questrail.rendezvous.protocol.slice.SliceSender;
import com.questrail.rendezvous.protocol.slice.SliceTransferConfig;
import com.questrail.rendezvous.transport.DatagramEndpoint;
import com.questrail.rendezvous.transport.udp.DatagramRendezvous;
import com.questrail.rendezvous.transport.udp.netty.NettyUdpDatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RendezvousRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one process's rendezvous stack.
 *
 * <p>Owns the callback executor, the deadline scheduler, the local table and,
 * when a bind address is configured, the UDP endpoint and the datagram bridge.
 * No rendezvous semantics live here.</p>
 */
public final class RendezvousRuntime {
    private static final Logger log = LoggerFactory.getLogger(RendezvousRuntime.class);

    private final RendezvousRuntimeConfig config;
    private final ExecutorService callbackExecutor;
    private final ScheduledExecutorService schedulerExecutor;
    private final LocalRendezvous local;
    private final DatagramRendezvous datagram;
    private final BlockingRecv blockingRecv;
    private final RendezvousObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private RendezvousRuntime(RendezvousRuntimeConfig config,
                              ExecutorService callbackExecutor,
                              ScheduledExecutorService schedulerExecutor,
                              LocalRendezvous local,
                              DatagramRendezvous datagram,
                              BlockingRecv blockingRecv,
                              RendezvousObservabilitySink observabilitySink,
                              WallClock wallClock) {
        this.config = config;
        this.callbackExecutor = callbackExecutor;
        this.schedulerExecutor = schedulerExecutor;
        this.local = local;
        this.datagram = datagram;
        this.blockingRecv = blockingRecv;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
    }

    public void start() {
        if (datagram != null) {
            datagram.start();
        }
        log.info("Rendezvous runtime started for {}", config.localTask());
    }

    public void stop() {
        if (datagram != null) {
            datagram.stop();
        }
        shutdown(schedulerExecutor);
        shutdown(callbackExecutor);
        log.info("Rendezvous runtime stopped for {}", config.localTask());
    }

    /**
     * The rendezvous to use for this process: the datagram bridge when UDP is
     * configured, the local table otherwise.
     */
    public Rendezvous rendezvous() {
        return datagram != null ? datagram : local;
    }

    public LocalRendezvous localRendezvous() {
        return local;
    }

    public Optional<DatagramRendezvous> datagramRendezvous() {
        return Optional.ofNullable(datagram);
    }

    public BlockingRecv blockingRecv() {
        return blockingRecv;
    }

    public RendezvousRuntimeConfig config() {
        return config;
    }

    /**
     * A slice config builder preset with the runtime's default timeout.
     */
    public SliceTransferConfig.Builder sliceConfig() {
        return SliceTransferConfig.builder().withRecvTimeout(config.defaultRecvTimeout());
    }

    public SliceSender sliceSender(SliceTransferConfig sliceConfig) {
        return new SliceSender(sliceConfig, observabilitySink, wallClock);
    }

    public SliceReceiver sliceReceiver(SliceTransferConfig sliceConfig) {
        return new SliceReceiver(sliceConfig, blockingRecv, observabilitySink, wallClock);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RendezvousRuntimeConfig config;
        private RendezvousObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private DatagramEndpoint endpoint;

        public Builder withConfig(RendezvousRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RendezvousObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty endpoint the runtime would otherwise create for
         * the configured bind address.
         */
        public Builder withEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public RendezvousRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Time and executors
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newSingleThreadScheduledExecutor(named("rendezvous-deadline"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            ExecutorService callbackExec =
                    Executors.newFixedThreadPool(config.callbackThreads(), named("rendezvous-callback"));

            // 2. Local table and blocking adapter
            LocalRendezvous local = new LocalRendezvous(callbackExec, observabilitySink, wallClock);
            BlockingRecv blockingRecv = new BlockingRecv(clock, scheduler);

            // 3. Optional datagram bridge
            DatagramRendezvous datagram = null;
            DatagramEndpoint effectiveEndpoint = endpoint;
            if (effectiveEndpoint == null && config.datagramEnabled()) {
                effectiveEndpoint = new NettyUdpDatagramEndpoint(config.bindAddress());
            }
            if (effectiveEndpoint != null) {
                datagram = new DatagramRendezvous(
                        local,
                        effectiveEndpoint,
                        config.peers(),
                        config.localTask(),
                        new DefaultEnvelopeFrameEncoder(),
                        new DefaultEnvelopeFrameDecoder(),
                        observabilitySink,
                        wallClock);
            }

            return new RendezvousRuntime(config, callbackExec, schedulerExec, local, datagram,
                    blockingRecv, observabilitySink, wallClock);
        }
    }
}

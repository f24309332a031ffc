package com.questrail.rendezvous.config;

import com.questrail.rendezvous.key.EndpointName;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the rendezvous runtime.
 *
 * @param bindAddress UDP bind address; {@code null} runs in-process only
 * @param localTask task address of this process, used to tell local keys
 *        from remote ones
 * @param defaultRecvTimeout timeout for slice receivers built by the
 *        runtime; {@link Duration#ZERO} waits indefinitely
 */
public record RendezvousRuntimeConfig(
    InetSocketAddress bindAddress,
    String localTask,
    PeerDirectory peers,
    int callbackThreads,
    Duration defaultRecvTimeout
) {
    public RendezvousRuntimeConfig {
        Objects.requireNonNull(localTask, "localTask");
        Objects.requireNonNull(peers, "peers");
        Objects.requireNonNull(defaultRecvTimeout, "defaultRecvTimeout");
        localTask = EndpointName.of(localTask).taskAddress();
        if (callbackThreads < 1) {
            throw new IllegalArgumentException("callbackThreads must be >= 1");
        }
        if (defaultRecvTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultRecvTimeout must not be negative");
        }
    }

    public boolean datagramEnabled() {
        return bindAddress != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress;
        private String localTask = "/job:localhost/replica:0/task:0";
        private PeerDirectory peers = PeerDirectory.empty();
        private int callbackThreads = 2;
        private Duration defaultRecvTimeout = Duration.ZERO;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withLocalTask(String localTask) {
            this.localTask = localTask;
            return this;
        }

        public Builder withPeers(PeerDirectory peers) {
            this.peers = peers;
            return this;
        }

        public Builder withCallbackThreads(int callbackThreads) {
            this.callbackThreads = callbackThreads;
            return this;
        }

        public Builder withDefaultRecvTimeout(Duration defaultRecvTimeout) {
            this.defaultRecvTimeout = defaultRecvTimeout;
            return this;
        }

        public RendezvousRuntimeConfig build() {
            return new RendezvousRuntimeConfig(bindAddress, localTask, peers, callbackThreads, defaultRecvTimeout);
        }
    }
}

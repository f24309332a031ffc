package com.questrail.rendezvous.config;

import com.questrail.rendezvous.key.EndpointName;

import java.net.SocketAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps task addresses ({@code /job:x/replica:r/task:t}) to the datagram
 * address of the process that hosts them.
 */
public final class PeerDirectory {
    private static final PeerDirectory EMPTY = new PeerDirectory(Map.of());

    private final Map<String, SocketAddress> peers;

    private PeerDirectory(Map<String, SocketAddress> peers) {
        this.peers = Collections.unmodifiableMap(new HashMap<>(peers));
    }

    public static PeerDirectory empty() {
        return EMPTY;
    }

    public Optional<SocketAddress> lookup(String taskAddress) {
        return Optional.ofNullable(peers.get(taskAddress));
    }

    /**
     * Resolves the process hosting {@code endpoint}.
     * @throws IllegalArgumentException if the task is unknown
     */
    public SocketAddress resolve(EndpointName endpoint) {
        String task = endpoint.taskAddress();
        return lookup(task).orElseThrow(() -> new IllegalArgumentException("Unknown peer task: " + task));
    }

    /**
     * Returns the set of all configured task addresses.
     */
    public Set<String> allTasks() {
        return peers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, SocketAddress> peers = new HashMap<>();

        /**
         * @param task any endpoint name; only its task address is kept
         */
        public Builder addPeer(String task, SocketAddress address) {
            String taskAddress = EndpointName.of(task).taskAddress();
            if (taskAddress.isEmpty()) {
                throw new IllegalArgumentException("Peer name has no job, replica or task: " + task);
            }
            peers.put(taskAddress, Objects.requireNonNull(address, "address"));
            return this;
        }

        public PeerDirectory build() {
            return new PeerDirectory(peers);
        }
    }
}

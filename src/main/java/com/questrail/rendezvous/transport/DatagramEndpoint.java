package com.questrail.rendezvous.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.
 * They move bytes only; encoding, peer resolution and rendezvous semantics
 * live above this port.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Delivery is best
     * effort.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address, once the endpoint is up.
     */
    Optional<SocketAddress> localAddress();
}

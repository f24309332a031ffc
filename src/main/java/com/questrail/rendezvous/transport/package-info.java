/**
 * Rendezvous Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP, a simulator, or a test double) and
 * {@link com.questrail.rendezvous.transport.udp.DatagramRendezvous}.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations perform I/O only: they do not decode frames, touch the
 * rendezvous table, or retry.</p>
 */
package com.questrail.rendezvous.transport;

package com.questrail.rendezvous.api;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * The unit exchanged through one rendezvous channel: an opaque payload plus a
 * liveness flag.
 *
 * <h2>Liveness</h2>
 * A <em>dead</em> envelope says the producer's value does not exist for this
 * execution instance (for example an untaken branch). Dead envelopes carry no
 * payload.
 *
 * <p>The payload is copied on the way in and out. Readers
 * that do not need their own copy should use {@link #payloadBuffer()}.</p>
 */
public final class Envelope
{
    private static final Envelope DEAD = new Envelope(null);

    private final byte[] payload;

    private Envelope(byte[] payload) {
        this.payload = payload;
    }

    /**
     * A live envelope carrying a copy of {@code payload}.
     */
    public static Envelope live(byte[] payload) {
        if (payload == null) {
            throw new NullPointerException("payload");
        }
        return new Envelope(payload.clone());
    }

    public static Envelope dead() {
        return DEAD;
    }

    public boolean isLive() {
        return payload != null;
    }

    public boolean isDead() {
        return payload == null;
    }

    /**
     * Payload size in bytes; zero for a dead envelope.
     */
    public int size() {
        return payload == null ? 0 : payload.length;
    }

    /**
     * Returns a copy of the payload, or empty for a dead envelope.
     */
    public Optional<byte[]> payload() {
        return payload == null ? Optional.empty() : Optional.of(payload.clone());
    }

    /**
     * Read-only view of the payload.
     *
     * @throws IllegalStateException if the envelope is dead
     */
    public ByteBuffer payloadBuffer() {
        if (payload == null) {
            throw new IllegalStateException("dead envelope has no payload");
        }
        return ByteBuffer.wrap(payload).asReadOnlyBuffer();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope other)) {
            return false;
        }
        return Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return payload == null ? "Envelope[dead]" : "Envelope[live, size=" + payload.length + ']';
    }
}

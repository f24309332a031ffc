package com.questrail.rendezvous.key;

import java.util.Objects;

/**
 * KeyPrefix
 * -----------------------------------------------------------------------------
 * The reusable part of a rendezvous key for one logical transfer edge:
 * {@code <source>;<incarnation>;<destination>;<channel>}.
 *
 * <p>It is serialized once; each concrete exchange then appends a phase
 * suffix and the frame/iteration discriminator via
 * {@link #key(String, FrameAndIter)}. A sender and a receiver that build the
 * same prefix and request the same suffixes for the same execution instance
 * address the same channels.</p>
 */
public final class KeyPrefix
{
    private final String prefix;

    private KeyPrefix(String prefix) {
        this.prefix = prefix;
    }

    /**
     * @throws MalformedKeyException if an endpoint is malformed or the channel
     *         name is empty or contains {@code ';'}
     */
    public static KeyPrefix of(String source, long sourceIncarnation, String destination, String channelName) {
        return new KeyPrefix(RendezvousKey.prefix(source, sourceIncarnation, destination, channelName));
    }

    /**
     * Full key for {@code phaseSuffix} in {@code frameAndIter}.
     *
     * @throws MalformedKeyException if the suffix contains {@code ';'}
     */
    public RendezvousKey key(String phaseSuffix, FrameAndIter frameAndIter) {
        Objects.requireNonNull(phaseSuffix, "phaseSuffix");
        Objects.requireNonNull(frameAndIter, "frameAndIter");
        if (phaseSuffix.indexOf(';') >= 0) {
            throw new MalformedKeyException("Phase suffix must not contain ';': " + phaseSuffix);
        }
        return RendezvousKey.parse(prefix + phaseSuffix + ';' + frameAndIter.wireForm());
    }

    public String serialized() {
        return prefix;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof KeyPrefix other && prefix.equals(other.prefix));
    }

    @Override
    public int hashCode() {
        return prefix.hashCode();
    }

    @Override
    public String toString() {
        return prefix;
    }
}

package com.questrail.rendezvous.key;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * RendezvousKey
 * =============================================================================
 * Parsed, immutable rendezvous key.
 *
 * <h2>Wire form</h2>
 * <pre>
 *   &lt;source&gt;;&lt;incarnation&gt;;&lt;destination&gt;;&lt;channel&gt;;&lt;frame&gt;:&lt;iter&gt;
 * </pre>
 * The incarnation, frame and iteration are unsigned decimals. Senders and
 * receivers in different processes must produce this string identically.
 *
 * <h2>Identity</h2>
 * Two keys are equal iff their {@link #fullKey()} strings are equal. The
 * structured fields are derived from that string and never compared.
 *
 * <p>{@link #parse(String)} is the only way to obtain a key; the rendezvous
 * never accepts raw strings.</p>
 */
public final class RendezvousKey
{
    private static final Pattern UNSIGNED = Pattern.compile("[0-9]{1,20}");

    private final String fullKey;
    private final EndpointName source;
    private final long sourceIncarnation;
    private final EndpointName destination;
    private final String channelName;
    private final FrameAndIter frameAndIter;

    private RendezvousKey(String fullKey,
                          EndpointName source,
                          long sourceIncarnation,
                          EndpointName destination,
                          String channelName,
                          FrameAndIter frameAndIter) {
        this.fullKey = fullKey;
        this.source = source;
        this.sourceIncarnation = sourceIncarnation;
        this.destination = destination;
        this.channelName = channelName;
        this.frameAndIter = frameAndIter;
    }

    /**
     * Formats and parses the key for {@code channelName} sent from
     * {@code source} to {@code destination} in the given frame and iteration.
     *
     * @throws MalformedKeyException if an endpoint is malformed or the
     *         channel name is empty or contains {@code ';'}
     */
    public static RendezvousKey create(String source,
                                       long sourceIncarnation,
                                       String destination,
                                       String channelName,
                                       FrameAndIter frameAndIter) {
        return parse(format(source, sourceIncarnation, destination, channelName, frameAndIter));
    }

    static String format(String source,
                         long sourceIncarnation,
                         String destination,
                         String channelName,
                         FrameAndIter frameAndIter) {
        Objects.requireNonNull(frameAndIter, "frameAndIter");
        return prefix(source, sourceIncarnation, destination, channelName) + ';' + frameAndIter.wireForm();
    }

    static String prefix(String source, long sourceIncarnation, String destination, String channelName) {
        EndpointName.requireWellFormed(source, "source");
        EndpointName.requireWellFormed(destination, "destination");
        checkChannelName(channelName);
        return source + ';' + Long.toUnsignedString(sourceIncarnation) + ';' + destination + ';' + channelName;
    }

    static void checkChannelName(String channelName) {
        Objects.requireNonNull(channelName, "channelName");
        if (channelName.isEmpty()) {
            throw new MalformedKeyException("Channel name must not be empty");
        }
        if (channelName.indexOf(';') >= 0) {
            throw new MalformedKeyException("Channel name must not contain ';': " + channelName);
        }
    }

    /**
     * Parses a full key string.
     *
     * @throws MalformedKeyException if {@code fullKey} is not a well-formed key
     */
    public static RendezvousKey parse(String fullKey) {
        if (fullKey == null) {
            throw new MalformedKeyException("Key must not be null");
        }

        String[] parts = fullKey.split(";", -1);
        if (parts.length != 5) {
            throw new MalformedKeyException("Expected 5 ';'-separated fields in key: " + fullKey);
        }

        EndpointName source = EndpointName.parse(parts[0])
                .orElseThrow(() -> new MalformedKeyException("Malformed source endpoint in key: " + fullKey));

        long incarnation = parseUnsigned(parts[1], "incarnation", fullKey);

        EndpointName destination = EndpointName.parse(parts[2])
                .orElseThrow(() -> new MalformedKeyException("Malformed destination endpoint in key: " + fullKey));

        String channel = parts[3];
        if (channel.isEmpty()) {
            throw new MalformedKeyException("Empty channel name in key: " + fullKey);
        }

        String[] frameIter = parts[4].split(":", -1);
        if (frameIter.length != 2) {
            throw new MalformedKeyException("Expected <frame>:<iter> in key: " + fullKey);
        }
        FrameAndIter frameAndIter = new FrameAndIter(
                parseUnsigned(frameIter[0], "frame id", fullKey),
                parseUnsigned(frameIter[1], "iteration id", fullKey));

        return new RendezvousKey(fullKey, source, incarnation, destination, channel, frameAndIter);
    }

    private static long parseUnsigned(String text, String what, String fullKey) {
        if (!UNSIGNED.matcher(text).matches()) {
            throw new MalformedKeyException("Malformed " + what + " '" + text + "' in key: " + fullKey);
        }
        try {
            return Long.parseUnsignedLong(text);
        } catch (NumberFormatException e) {
            throw new MalformedKeyException(what + " out of range in key: " + fullKey);
        }
    }

    /**
     * The canonical serialized key. This is the only thing the rendezvous
     * compares or hashes.
     */
    public String fullKey() {
        return fullKey;
    }

    public EndpointName source() {
        return source;
    }

    public long sourceIncarnation() {
        return sourceIncarnation;
    }

    public EndpointName destination() {
        return destination;
    }

    /**
     * Channel (edge) name, including any transfer-phase suffix.
     */
    public String channelName() {
        return channelName;
    }

    public FrameAndIter frameAndIter() {
        return frameAndIter;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RendezvousKey other && fullKey.equals(other.fullKey));
    }

    @Override
    public int hashCode() {
        return fullKey.hashCode();
    }

    @Override
    public String toString() {
        return fullKey;
    }
}

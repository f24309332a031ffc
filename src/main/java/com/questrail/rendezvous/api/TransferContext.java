package com.questrail.rendezvous.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TransferContext
 * -----------------------------------------------------------------------------
 * Opaque device / allocation context attached to one side of an exchange.
 *
 * <p>The rendezvous never interprets these attributes. The producer's context
 * is forwarded unchanged to the consumer (see {@link Delivery#senderContext()})
 * so that the consumer can set up cross-device copies if it needs to.</p>
 */
public record TransferContext(Map<String, String> attributes)
{
    public static final TransferContext EMPTY = new TransferContext(Map.of());

    public TransferContext {
        Objects.requireNonNull(attributes, "attributes");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static TransferContext of(String name, String value) {
        return EMPTY.with(name, value);
    }

    public TransferContext with(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(name, value);
        return new TransferContext(copy);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }
}

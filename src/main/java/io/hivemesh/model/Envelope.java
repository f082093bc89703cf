package io.hivemesh.model;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable wire wrapper. Redelivery bookkeeping never lives here; see
 * {@code io.hivemesh.delivery.RedeliveryMetadata}.
 */
public record Envelope(
        String id,
        MessageType type,
        String from,
        long timestamp,
        Payload payload
) {
    public Envelope {
        Objects.requireNonNull(type, "type");
        if (payload != null && payload.type() != type) {
            throw new IllegalArgumentException("Payload " + payload.type() + " does not match envelope type " + type);
        }
    }

    public static Envelope create(String from, Payload payload, Clock clock) {
        Objects.requireNonNull(payload, "payload");
        return new Envelope(UUID.randomUUID().toString(), payload.type(), from, clock.millis(), payload);
    }

    public <T extends Payload> T payloadAs(Class<T> expected) {
        if (!expected.isInstance(payload)) {
            throw new IllegalStateException("Envelope " + id + " carries " + type + ", not " + expected.getSimpleName());
        }
        return expected.cast(payload);
    }
}

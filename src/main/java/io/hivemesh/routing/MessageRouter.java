package io.hivemesh.routing;

import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps envelope type to the handler that processes it. One handler per type.
 */
public final class MessageRouter {
    private final Map<MessageType, EnvelopeHandler> handlers = new EnumMap<>(MessageType.class);

    public synchronized MessageRouter register(MessageType type, EnvelopeHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        handlers.put(type, handler);
        return this;
    }

    public synchronized Set<MessageType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public synchronized EnvelopeHandler resolve(Envelope envelope) {
        EnvelopeHandler handler = handlers.get(envelope.type());
        if (handler == null) {
            throw new UnroutableEnvelopeException(envelope.type(), envelope.id());
        }
        return handler;
    }

    public void dispatch(Envelope envelope) throws Exception {
        resolve(envelope).handle(envelope);
    }
}

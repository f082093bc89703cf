package io.hivemesh.routing;

import io.hivemesh.model.Envelope;

@FunctionalInterface
public interface EnvelopeHandler {
    void handle(Envelope envelope) throws Exception;
}

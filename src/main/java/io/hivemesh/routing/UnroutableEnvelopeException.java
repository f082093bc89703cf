package io.hivemesh.routing;

import io.hivemesh.model.MessageType;

public final class UnroutableEnvelopeException extends EnvelopeValidationException {
    private final MessageType messageType;

    public UnroutableEnvelopeException(MessageType messageType, String envelopeId) {
        super("No handler registered for type " + messageType.wireName() + " (envelope " + envelopeId + ")");
        this.messageType = messageType;
    }

    public MessageType messageType() {
        return messageType;
    }
}

package io.hivemesh.routing;

import java.util.List;

public final class EnvelopeParseException extends EnvelopeValidationException {
    public EnvelopeParseException(String message, Throwable cause) {
        super(message, List.of(message), cause);
    }

    public EnvelopeParseException(String message) {
        super(message);
    }
}

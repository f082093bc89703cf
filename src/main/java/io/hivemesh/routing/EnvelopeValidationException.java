package io.hivemesh.routing;

import java.util.List;

/**
 * Structural problem with an inbound message. Terminal: the same bytes will never
 * become valid, so callers reject instead of retrying.
 */
public class EnvelopeValidationException extends RuntimeException {
    private final List<String> problems;

    public EnvelopeValidationException(String message) {
        this(message, List.of(message), null);
    }

    public EnvelopeValidationException(String message, List<String> problems) {
        this(message, problems, null);
    }

    public EnvelopeValidationException(String message, List<String> problems, Throwable cause) {
        super(message, cause);
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}

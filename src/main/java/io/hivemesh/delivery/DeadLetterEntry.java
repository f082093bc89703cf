package io.hivemesh.delivery;

import java.util.List;

public record DeadLetterEntry(
        String messageId,
        String messageType,
        Reason reason,
        String error,
        long deadLetteredAtMs,
        String body,
        List<FailureRecord> history
) {
    public DeadLetterEntry {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public enum Reason {
        RETRY_EXHAUSTED,
        INVALID
    }
}

package io.hivemesh.delivery;

import java.util.ArrayList;
import java.util.List;

/**
 * Retry bookkeeping for one message id. Each failed attempt produces a new instance.
 */
public record RedeliveryMetadata(String messageId, int retryCount, List<FailureRecord> history) {
    public RedeliveryMetadata {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static RedeliveryMetadata first(String messageId) {
        return new RedeliveryMetadata(messageId, 0, List.of());
    }

    public int attempt() {
        return history.size() + 1;
    }

    public RedeliveryMetadata failed(String error, long failedAtMs) {
        List<FailureRecord> next = new ArrayList<>(history);
        next.add(new FailureRecord(attempt(), error, failedAtMs));
        return new RedeliveryMetadata(messageId, retryCount, next);
    }

    public RedeliveryMetadata requeued() {
        return new RedeliveryMetadata(messageId, retryCount + 1, history);
    }
}

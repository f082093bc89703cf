package io.hivemesh.model;

public enum TaskStatus {
    QUEUED,
    DELIVERED,
    COMPLETED,
    RETRY_REQUEUED,
    DEAD_LETTERED;

    public boolean terminal() {
        return this == COMPLETED || this == DEAD_LETTERED;
    }
}

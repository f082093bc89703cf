package io.hivemesh.delivery;

public enum DeliveryOutcome {
    ACKED,
    REQUEUED,
    DEAD_LETTERED,
    REJECTED
}

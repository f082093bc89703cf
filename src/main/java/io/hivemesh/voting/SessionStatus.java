package io.hivemesh.voting;

public enum SessionStatus {
    OPEN,
    CLOSED
}

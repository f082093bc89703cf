package io.hivemesh.delivery;

public record FailureRecord(int attempt, String error, long failedAtMs) {
}

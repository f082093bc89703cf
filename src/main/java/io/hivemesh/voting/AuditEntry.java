package io.hivemesh.voting;

/**
 * One link of a session's audit chain: {@code hash = sha256(previousHash + vote)}.
 */
public record AuditEntry(
        int sequence,
        String sessionId,
        String agentId,
        String vote,
        long recordedAt,
        String previousHash,
        String hash
) {
}

package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.List;

/**
 * Read-only snapshot of a session.
 */
public record SessionView(
        String sessionId,
        String topic,
        String question,
        List<String> options,
        AlgorithmType algorithm,
        String initiatedBy,
        long initiatedAt,
        long deadline,
        int tokensPerAgent,
        SessionStatus status,
        int votesCount
) {
}

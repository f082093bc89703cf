package io.hivemesh.model;

import java.util.List;

/**
 * Broadcast body. A non-null {@code voting} marks the broadcast as a voting session
 * announcement rather than an open brainstorm question. Answers go to {@code replyTo}
 * when set, otherwise to the shared results queue.
 */
public record BrainstormPayload(
        String sessionId,
        String topic,
        String question,
        String initiatedBy,
        List<String> requiredAgents,
        VotingAnnouncement voting,
        String replyTo
) implements Payload {
    @Override
    public MessageType type() {
        return MessageType.BRAINSTORM;
    }

    public boolean announcesVote() {
        return voting != null;
    }
}

package io.hivemesh.model;

import java.util.Map;

public record TaskPayload(
        String title,
        String description,
        Priority priority,
        String assignedBy,
        Long assignedAt,
        Boolean requiresCollaboration,
        Integer retryCount,
        String collaborationQuestion,
        Map<String, Object> context
) implements Payload {
    @Override
    public MessageType type() {
        return MessageType.TASK;
    }

    public boolean collaborative() {
        return Boolean.TRUE.equals(requiresCollaboration);
    }
}

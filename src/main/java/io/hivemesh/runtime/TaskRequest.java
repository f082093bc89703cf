package io.hivemesh.runtime;

import io.hivemesh.model.Priority;

import java.util.Map;

/**
 * What a caller supplies to {@link TaskOrchestrator#assignTask(TaskRequest)}.
 *
 * @param retryCount own retry budget; null uses the delivery default
 */
public record TaskRequest(
        String title,
        String description,
        Priority priority,
        boolean requiresCollaboration,
        String collaborationQuestion,
        Integer retryCount,
        Map<String, Object> context
) {
    public static TaskRequest simple(String title, String description) {
        return new TaskRequest(title, description, Priority.NORMAL, false, null, null, Map.of());
    }
}

package io.hivemesh.agent;

import io.hivemesh.model.Priority;

import java.util.List;
import java.util.Map;

/**
 * @param suggestions brainstorm responses gathered before execution, empty unless the
 *                    task asked for collaboration
 */
public record AgentContext(
        String taskId,
        String title,
        String description,
        Priority priority,
        String assignedBy,
        Map<String, Object> context,
        List<String> suggestions
) {
    public AgentContext {
        context = context == null ? Map.of() : context;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}

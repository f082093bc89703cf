package io.hivemesh.model;

import java.util.Locale;
import java.util.Map;

public record StatusPayload(
        String agentId,
        String agentType,
        String event,
        Map<String, Object> detail
) implements Payload {
    public static final String ROUTING_PREFIX = "agent.status.";

    @Override
    public MessageType type() {
        return MessageType.STATUS;
    }

    /**
     * {@code task_started} routes as {@code agent.status.task.started}.
     */
    public String routingKey() {
        String suffix = event == null || event.isBlank()
                ? "info"
                : event.trim().toLowerCase(Locale.ROOT).replace('_', '.');
        return ROUTING_PREFIX + suffix;
    }
}

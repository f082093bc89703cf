package io.hivemesh.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brainstorm opened by this agent, collecting responses until the waiting task moves on.
 */
final class BrainstormSession {
    private final String sessionId;
    private final String taskId;
    private final String topic;
    private final Set<String> requiredAgents;
    private final long startedAt;
    private final Map<String, String> responses = new LinkedHashMap<>();

    BrainstormSession(String sessionId, String taskId, String topic, List<String> requiredAgents, long startedAt) {
        this.sessionId = sessionId;
        this.taskId = taskId;
        this.topic = topic;
        this.requiredAgents = requiredAgents == null ? Set.of() : Set.copyOf(requiredAgents);
        this.startedAt = startedAt;
    }

    String sessionId() {
        return sessionId;
    }

    String taskId() {
        return taskId;
    }

    String topic() {
        return topic;
    }

    long startedAt() {
        return startedAt;
    }

    synchronized void addResponse(String agentId, String suggestion) {
        responses.put(agentId, suggestion);
        notifyAll();
    }

    synchronized List<String> responses() {
        return new ArrayList<>(responses.values());
    }

    /**
     * Blocks until every required agent answered or {@code timeoutMs} elapsed. Without
     * required agents the full window is used.
     */
    synchronized List<String> awaitResponses(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + timeoutMs * 1_000_000L;
        while (!complete()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                break;
            }
            wait(remainingMs);
        }
        return responses();
    }

    private boolean complete() {
        return !requiredAgents.isEmpty() && responses.keySet().containsAll(requiredAgents);
    }
}

package io.hivemesh.runtime;

public record OrchestratorStats(
        long tasksReceived,
        long tasksCompleted,
        long tasksFailed,
        long brainstormsParticipated,
        long resultsPublished,
        int activeTasks,
        int activeBrainstorms,
        int totalResults
) {
}

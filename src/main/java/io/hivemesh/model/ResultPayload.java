package io.hivemesh.model;

public record ResultPayload(
        ResultKind kind,
        String taskId,
        String sessionId,
        String status,
        String output,
        String processedBy,
        Long completedAt,
        Long durationMs,
        Ballot ballot
) implements Payload {
    @Override
    public MessageType type() {
        return MessageType.RESULT;
    }

    public ResultKind effectiveKind() {
        return kind == null ? ResultKind.TASK_RESULT : kind;
    }

    public String subjectId() {
        return taskId != null ? taskId : sessionId;
    }

    public static ResultPayload taskResult(String taskId, String status, String output, String processedBy,
                                           long completedAt, long durationMs) {
        return new ResultPayload(ResultKind.TASK_RESULT, taskId, null, status, output, processedBy,
                completedAt, durationMs, null);
    }

    public static ResultPayload brainstormResponse(String sessionId, String suggestion, String processedBy, long at) {
        return new ResultPayload(ResultKind.BRAINSTORM_RESPONSE, null, sessionId, "responded", suggestion,
                processedBy, at, null, null);
    }

    public static ResultPayload vote(String sessionId, Ballot ballot, String voterId, long at) {
        return new ResultPayload(ResultKind.VOTE, null, sessionId, "cast", null, voterId, at, null, ballot);
    }

    public static ResultPayload votingResults(String sessionId, String status, String resultJson,
                                              String processedBy, long at) {
        return new ResultPayload(ResultKind.VOTING_RESULTS, null, sessionId, status, resultJson,
                processedBy, at, null, null);
    }
}

package io.hivemesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultKind {
    TASK_RESULT("task_result"),
    BRAINSTORM_RESPONSE("brainstorm_response"),
    VOTE("vote"),
    VOTING_RESULTS("voting_results");

    private final String wireName;

    ResultKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ResultKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TASK_RESULT;
        }
        for (ResultKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown result kind: " + raw);
    }
}

package io.hivemesh.model;

import java.util.Locale;

/**
 * Decides which inboxes an agent process consumes.
 */
public enum AgentRole {
    WORKER(true, true, false, false),
    LEADER(false, false, true, true),
    COLLABORATOR(true, true, false, false),
    COORDINATOR(true, false, true, true),
    MONITOR(false, false, true, true);

    private final boolean consumesTasks;
    private final boolean joinsBrainstorms;
    private final boolean consumesResults;
    private final boolean watchesStatus;

    AgentRole(boolean consumesTasks, boolean joinsBrainstorms, boolean consumesResults, boolean watchesStatus) {
        this.consumesTasks = consumesTasks;
        this.joinsBrainstorms = joinsBrainstorms;
        this.consumesResults = consumesResults;
        this.watchesStatus = watchesStatus;
    }

    public boolean consumesTasks() {
        return consumesTasks;
    }

    public boolean joinsBrainstorms() {
        return joinsBrainstorms;
    }

    public boolean consumesResults() {
        return consumesResults;
    }

    public boolean watchesStatus() {
        return watchesStatus;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return WORKER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("team-leader".equals(normalized) || "team_leader".equals(normalized)) {
            return LEADER;
        }
        for (AgentRole role : values()) {
            if (role.wireName().equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + raw);
    }
}

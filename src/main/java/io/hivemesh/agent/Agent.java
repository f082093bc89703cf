package io.hivemesh.agent;

import io.hivemesh.model.Ballot;
import io.hivemesh.model.BrainstormPayload;

import java.util.Optional;

/**
 * Task logic plugged into an agent process.
 */
public interface Agent {
    String id();

    AgentResult execute(AgentContext context) throws Exception;

    /**
     * Answer to an open brainstorm question; null means no answer.
     */
    default String suggest(BrainstormPayload request) {
        return null;
    }

    /**
     * Ballot for an announced voting session; empty means abstain.
     */
    default Optional<Ballot> deliberate(BrainstormPayload announcement) {
        return Optional.empty();
    }
}

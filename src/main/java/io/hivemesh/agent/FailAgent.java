package io.hivemesh.agent;

/**
 * Always fails. Drives tasks through retries into the dead-letter store.
 */
public final class FailAgent implements Agent {
    @Override
    public String id() {
        return "fail";
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.fail("intentional failure for task " + context.taskId());
    }
}

package io.hivemesh.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class AgentRoleTest {

    @Test
    void parsesAliasesAndDefaults() {
        Assertions.assertEquals(AgentRole.WORKER, AgentRole.fromString(null));
        Assertions.assertEquals(AgentRole.LEADER, AgentRole.fromString("team_leader"));
        Assertions.assertEquals(AgentRole.MONITOR, AgentRole.fromString("Monitor"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentRole.fromString("boss"));
    }

    @Test
    void workersConsumeTasksLeadersConsumeResults() {
        Assertions.assertTrue(AgentRole.WORKER.consumesTasks());
        Assertions.assertFalse(AgentRole.WORKER.consumesResults());
        Assertions.assertTrue(AgentRole.LEADER.consumesResults());
        Assertions.assertFalse(AgentRole.LEADER.joinsBrainstorms());
        Assertions.assertTrue(AgentRole.COORDINATOR.consumesTasks());
        Assertions.assertTrue(AgentRole.COORDINATOR.watchesStatus());
    }

    @Test
    void statusEventsMapToTopicKeys() {
        Assertions.assertEquals("agent.status.task.completed",
                new StatusPayload("a", "worker", "task_completed", null).routingKey());
        Assertions.assertEquals("agent.status.info", new StatusPayload("a", "worker", " ", null).routingKey());
    }
}

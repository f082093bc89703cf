package io.hivemesh.config;

import io.hivemesh.broker.BrokerSettings;
import io.hivemesh.model.AgentRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class HiveMeshConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWithoutAnySource() {
        HiveMeshConfig config = HiveMeshConfig.fromEnvironment(Map.of());

        Assertions.assertEquals("amqp://localhost:5672", config.brokerUrl());
        Assertions.assertEquals(AgentRole.WORKER, config.role());
        Assertions.assertTrue(config.agentId().startsWith("agent-"));
        Assertions.assertEquals("Agent-worker", config.agentName());
        Assertions.assertEquals(30, config.heartbeatSeconds());
        Assertions.assertTrue(config.autoReconnect());
        Assertions.assertEquals(1, config.prefetchCount());
        Assertions.assertEquals(3, config.maxRetries());
        Assertions.assertEquals(10, config.maxReconnectAttempts());
    }

    @Test
    void environmentOverridesFileOverridesDefaults() throws Exception {
        Path settings = tempDir.resolve("hivemesh-settings.json");
        Files.writeString(settings, "{\"brokerUrl\":\"amqp://file-host:5672\",\"agentType\":\"coordinator\","
                + "\"prefetchCount\":8,\"maxRetries\":5,\"maxReconnectAttempts\":4,\"futureSetting\":true}",
                StandardCharsets.UTF_8);

        HiveMeshConfig config = HiveMeshConfig.load(settings, Map.of(
                "RABBITMQ_URL", "amqp://env-host:5672",
                "PREFETCH_COUNT", "not-a-number",
                "AGENT_ID", "agent-42",
                "AUTO_RECONNECT", "FALSE"
        ));

        Assertions.assertEquals("amqp://env-host:5672", config.brokerUrl());
        Assertions.assertEquals(AgentRole.COORDINATOR, config.role());
        Assertions.assertEquals(8, config.prefetchCount());
        Assertions.assertEquals(5, config.maxRetries());
        Assertions.assertEquals(4, config.maxReconnectAttempts());
        Assertions.assertEquals("agent-42", config.agentId());
        Assertions.assertFalse(config.autoReconnect());
    }

    @Test
    void missingFileIsSkipped() {
        HiveMeshConfig config = HiveMeshConfig.load(tempDir.resolve("absent.json"), Map.of("AGENT_TYPE", "team-leader"));

        Assertions.assertEquals(AgentRole.LEADER, config.role());
    }

    @Test
    void brokenFileIsReported() throws Exception {
        Path settings = tempDir.resolve("broken.json");
        Files.writeString(settings, "{ not json", StandardCharsets.UTF_8);

        Assertions.assertThrows(IllegalArgumentException.class, () -> HiveMeshConfig.load(settings, Map.of()));
    }

    @Test
    void unknownRoleIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> HiveMeshConfig.fromEnvironment(Map.of("AGENT_TYPE", "overlord")));
    }

    @Test
    void commandLineOverridesIgnoreBlanks() {
        HiveMeshConfig base = HiveMeshConfig.fromEnvironment(Map.of("AGENT_ID", "a-1", "AGENT_NAME", "Indexer"));

        HiveMeshConfig config = base.withBrokerUrl(" ").withAgentId(null).withRole(AgentRole.MONITOR).withPrefetchCount(5);
        BrokerSettings settings = config.brokerSettings();

        Assertions.assertEquals("a-1", config.agentId());
        Assertions.assertEquals(AgentRole.MONITOR, config.role());
        Assertions.assertEquals(5, settings.prefetchCount());
        Assertions.assertEquals("Indexer (a-1)", settings.connectionName());
    }
}

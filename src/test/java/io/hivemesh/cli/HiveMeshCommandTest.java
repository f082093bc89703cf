package io.hivemesh.cli;

import io.hivemesh.config.HiveMeshConfig;
import io.hivemesh.model.AgentRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

final class HiveMeshCommandTest {

    @Test
    void rootOptionsOverrideEnvironment() {
        HiveMeshCommand root = new HiveMeshCommand();
        root.environment = Map.of("RABBITMQ_URL", "amqp://env:5672", "AGENT_ID", "env-agent", "AGENT_TYPE", "worker");
        new CommandLine(root).parseArgs("--settings", "does-not-exist.json", "--url", "amqp://cli:5672",
                "--role", "monitor", "--prefetch", "3", "health");

        HiveMeshConfig config = root.config();

        Assertions.assertEquals("amqp://cli:5672", config.brokerUrl());
        Assertions.assertEquals("env-agent", config.agentId());
        Assertions.assertEquals(AgentRole.MONITOR, config.role());
        Assertions.assertEquals(3, config.prefetchCount());
    }

    @Test
    void sendTaskParsesContextAndRetries() {
        CommandLine commandLine = new CommandLine(new HiveMeshCommand());
        CommandLine.ParseResult parsed = commandLine.parseArgs("send-task", "--title", "Index",
                "--priority", "urgent", "--retries", "1", "--context", "repo=core", "--context", "branch=main");

        HiveMeshCommand.SendTaskCommand command =
                (HiveMeshCommand.SendTaskCommand) parsed.subcommand().commandSpec().userObject();
        Assertions.assertEquals("Index", command.title);
        Assertions.assertEquals("urgent", command.priority);
        Assertions.assertEquals(1, command.retries);
        Assertions.assertEquals(Map.of("repo", "core", "branch", "main"), command.context);
        Assertions.assertFalse(command.collaborate);
    }

    @Test
    void voteCollectsRepeatedOptions() {
        CommandLine commandLine = new CommandLine(new HiveMeshCommand());
        CommandLine.ParseResult parsed = commandLine.parseArgs("vote", "--topic", "db", "--question", "Which?",
                "--option", "postgres", "--option", "sqlite", "--algorithm", "ranked-choice", "--total-agents", "4");

        HiveMeshCommand.VoteCommand command = (HiveMeshCommand.VoteCommand) parsed.subcommand().commandSpec().userObject();
        Assertions.assertEquals(List.of("postgres", "sqlite"), command.options);
        Assertions.assertEquals("ranked-choice", command.algorithm);
        Assertions.assertEquals(4, command.totalAgents);
        Assertions.assertEquals(30_000L, command.durationMs);
        Assertions.assertEquals(0.75, command.consensusThreshold, 1e-9);
    }

    @Test
    void missingRequiredOptionFailsWithUsageCode() {
        int code = new CommandLine(new HiveMeshCommand()).execute("send-task");

        Assertions.assertEquals(2, code);
    }
}

package io.hivemesh.cli;

import io.hivemesh.agent.Agent;
import io.hivemesh.agent.AgentRegistry;
import io.hivemesh.agent.EchoAgent;
import io.hivemesh.broker.BrokerConnectionException;
import io.hivemesh.config.HiveMeshConfig;
import io.hivemesh.model.AgentRole;
import io.hivemesh.model.AlgorithmType;
import io.hivemesh.model.Priority;
import io.hivemesh.runtime.HiveMeshRuntime;
import io.hivemesh.runtime.TaskRequest;
import io.hivemesh.util.Jsons;
import io.hivemesh.voting.QuorumRequirements;
import io.hivemesh.voting.VotingConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "hivemesh",
        mixinStandardHelpOptions = true,
        description = "Agent fleet messaging and voting over RabbitMQ",
        subcommands = {
                HiveMeshCommand.AgentCommand.class,
                HiveMeshCommand.SendTaskCommand.class,
                HiveMeshCommand.VoteCommand.class,
                HiveMeshCommand.TopologyCommand.class,
                HiveMeshCommand.HealthCommand.class
        }
)
public final class HiveMeshCommand implements Runnable {
    @Option(names = {"--settings"}, defaultValue = HiveMeshConfig.DEFAULT_SETTINGS_FILE,
            description = "JSON settings file; skipped when missing")
    String settings;

    @Option(names = {"--url"}, description = "Broker URI, overrides RABBITMQ_URL")
    String url;

    @Option(names = {"--agent-id"}, description = "Agent id, overrides AGENT_ID")
    String agentId;

    @Option(names = {"--role"}, description = "worker | leader | collaborator | coordinator | monitor")
    String role;

    @Option(names = {"--prefetch"}, description = "Unacknowledged deliveries per channel")
    Integer prefetch;

    Map<String, String> environment = System.getenv();

    @Override
    public void run() {
        System.out.println("Use subcommands: agent | send-task | vote | topology | health");
    }

    HiveMeshConfig config() {
        Path settingsPath = settings == null || settings.isBlank() ? null : Paths.get(settings);
        return HiveMeshConfig.load(settingsPath, environment)
                .withBrokerUrl(url)
                .withAgentId(agentId)
                .withRole(role == null ? null : AgentRole.fromString(role))
                .withPrefetchCount(prefetch);
    }

    HiveMeshRuntime runtime(HiveMeshConfig config, Agent agent) {
        return new HiveMeshRuntime(config, agent);
    }

    @Command(name = "agent", description = "Run an agent process in the configured role until stopped")
    static final class AgentCommand implements Callable<Integer> {
        @ParentCommand
        HiveMeshCommand parent;

        @Option(names = {"--logic"}, defaultValue = "echo", description = "Task logic: echo | fail")
        String logic;

        @Option(names = {"--level"}, defaultValue = "1", description = "Agent level reported on ballots")
        int level;

        @Override
        public Integer call() throws Exception {
            HiveMeshConfig config = parent.config();
            Agent agent = AgentRegistry.builtIn(config.agentId(), level).require(logic);
            HiveMeshRuntime runtime = parent.runtime(config, agent);
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "hivemesh-shutdown"));
            runtime.start();
            boolean clean = runtime.awaitShutdown();
            runtime.close();
            return clean ? 0 : 2;
        }
    }

    @Command(name = "send-task", description = "Publish one task to the task queue")
    static final class SendTaskCommand implements Callable<Integer> {
        @ParentCommand
        HiveMeshCommand parent;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, defaultValue = "", description = "Task description")
        String description;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "low | normal | high | urgent | critical")
        String priority;

        @Option(names = {"--collaborate"}, defaultValue = "false", description = "Ask other agents before executing")
        boolean collaborate;

        @Option(names = {"--question"}, description = "Brainstorm question when collaborating")
        String question;

        @Option(names = {"--retries"}, description = "Retry budget for this task")
        Integer retries;

        @Option(names = {"--context"}, description = "Context entries as key=value")
        Map<String, String> context;

        @Override
        public Integer call() {
            HiveMeshConfig config = parent.config();
            try (HiveMeshRuntime runtime = parent.runtime(config, new EchoAgent(config.agentId(), 0))) {
                runtime.init();
                TaskRequest request = new TaskRequest(
                        title,
                        description,
                        Priority.fromString(priority),
                        collaborate,
                        question,
                        retries,
                        contextMap()
                );
                String taskId = runtime.assignTask(request);
                System.out.println(Jsons.toJson(new SendTaskOutcome(taskId, title, request.priority().wireName())));
                return 0;
            }
        }

        private Map<String, Object> contextMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            if (context != null) {
                out.putAll(context);
            }
            return out;
        }
    }

    @Command(name = "vote", description = "Open a voting session, collect ballots until the deadline, print the result")
    static final class VoteCommand implements Callable<Integer> {
        @ParentCommand
        HiveMeshCommand parent;

        @Option(names = {"--topic"}, required = true, description = "Session topic")
        String topic;

        @Option(names = {"--question"}, required = true, description = "Question put to the agents")
        String question;

        @Option(names = {"--option"}, required = true, description = "Option to vote on; repeat for each option")
        List<String> options;

        @Option(names = {"--algorithm"}, defaultValue = "simple_majority",
                description = "simple_majority | confidence_weighted | quadratic | consensus | ranked_choice")
        String algorithm;

        @Option(names = {"--total-agents"}, defaultValue = "0", description = "Expected voters, for the participation quorum")
        int totalAgents;

        @Option(names = {"--duration-ms"}, defaultValue = "30000", description = "Time until the session closes")
        long durationMs;

        @Option(names = {"--min-participation"}, defaultValue = "0.5", description = "Fraction of agents that must vote")
        double minParticipation;

        @Option(names = {"--min-confidence"}, defaultValue = "0.0", description = "Floor for mean ballot confidence")
        double minConfidence;

        @Option(names = {"--min-experts"}, defaultValue = "0", description = "Required number of expert voters")
        int minExperts;

        @Option(names = {"--consensus-threshold"}, defaultValue = "0.75", description = "Share needed for consensus")
        double consensusThreshold;

        @Option(names = {"--tokens-per-agent"}, defaultValue = "100", description = "Quadratic voting budget")
        int tokensPerAgent;

        @Override
        public Integer call() throws Exception {
            HiveMeshConfig config = parent.config();
            VotingConfig votingConfig = VotingConfig.of(topic, question, options, AlgorithmType.fromString(algorithm), totalAgents)
                    .withQuorum(new QuorumRequirements(minParticipation, minConfidence, minExperts,
                            QuorumRequirements.DEFAULT_EXPERT_LEVEL))
                    .withDeadline(System.currentTimeMillis() + durationMs)
                    .withConsensusThreshold(consensusThreshold)
                    .withTokensPerAgent(tokensPerAgent);
            try (HiveMeshRuntime runtime = parent.runtime(config, new EchoAgent(config.agentId(), 0))) {
                runtime.startRepliesOnly();
                HiveMeshRuntime.VoteOutcome outcome = runtime.runVote(votingConfig);
                System.out.println(Jsons.toJson(outcome));
                return outcome.result().succeeded() ? 0 : 1;
            }
        }
    }

    @Command(name = "topology", description = "Declare the shared exchanges and queues")
    static final class TopologyCommand implements Callable<Integer> {
        @ParentCommand
        HiveMeshCommand parent;

        @Override
        public Integer call() {
            HiveMeshConfig config = parent.config();
            try (HiveMeshRuntime runtime = parent.runtime(config, new EchoAgent(config.agentId(), 0))) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.declareTopology()));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Connect once and report connection health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        HiveMeshCommand parent;

        @Override
        public Integer call() {
            HiveMeshConfig config = parent.config();
            try (HiveMeshRuntime runtime = parent.runtime(config, new EchoAgent(config.agentId(), 0))) {
                try {
                    runtime.init();
                } catch (BrokerConnectionException e) {
                    System.err.println("Broker unreachable: " + e.getMessage());
                }
                HiveMeshRuntime.HealthOutcome out = runtime.health();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    record SendTaskOutcome(String taskId, String title, String priority) {
    }
}

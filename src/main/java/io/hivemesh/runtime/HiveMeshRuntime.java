package io.hivemesh.runtime;

import io.hivemesh.agent.Agent;
import io.hivemesh.broker.BrokerConnector;
import io.hivemesh.broker.BrokerSettings;
import io.hivemesh.broker.ConnectionListener;
import io.hivemesh.broker.ConnectionManager;
import io.hivemesh.broker.ReconnectScheduler;
import io.hivemesh.broker.Topology;
import io.hivemesh.broker.TopologyBuilder;
import io.hivemesh.bus.AmqpBus;
import io.hivemesh.config.HiveMeshConfig;
import io.hivemesh.delivery.DeadLetterEntry;
import io.hivemesh.delivery.DeadLetterStore;
import io.hivemesh.delivery.DeliveryController;
import io.hivemesh.model.AgentRole;
import io.hivemesh.routing.MessageRouter;
import io.hivemesh.voting.VotingConfig;
import io.hivemesh.voting.VotingEngine;
import io.hivemesh.voting.VotingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires one agent process: connection, topology, bus, delivery, orchestrator and
 * voting engine.
 *
 * <p>{@link #init()} only connects, for processes that publish and leave.
 * {@link #start()} also consumes the inboxes of the configured role plus the reply
 * inbox, and {@link #startRepliesOnly()} just the reply inbox. Consumers are started
 * again after every reconnect because they die with their channel.
 */
public final class HiveMeshRuntime implements ConnectionListener, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HiveMeshRuntime.class);

    private final HiveMeshConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ConnectionManager connections;
    private final AmqpBus bus;
    private final TopologyBuilder topologyBuilder = new TopologyBuilder();
    private final MessageRouter router = new MessageRouter();
    private final DeadLetterStore deadLetters;
    private final DeliveryController delivery;
    private final VotingEngine voting;
    private final TaskOrchestrator orchestrator;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Inboxes inboxes = Inboxes.NONE;
    private volatile boolean gaveUp;

    public HiveMeshRuntime(HiveMeshConfig config, Agent agent) {
        this(config, agent, Clock.systemUTC(), newScheduler(), null);
    }

    HiveMeshRuntime(HiveMeshConfig config, Agent agent, Clock clock, ScheduledExecutorService scheduler,
                    BrokerConnector connector) {
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        BrokerSettings settings = config.brokerSettings();
        this.connections = new ConnectionManager(
                settings,
                connector == null ? BrokerConnector.amqp(settings) : connector,
                ReconnectScheduler.using(scheduler)
        );
        this.bus = new AmqpBus(connections);
        this.deadLetters = new DeadLetterStore(config.deadLetterCapacity());
        this.delivery = new DeliveryController(router, deadLetters, config.maxRetries(), clock);
        this.voting = new VotingEngine(
                clock,
                scheduler,
                new Random(),
                config.auditSigningSecret(),
                new BusVotingBroadcaster(config.agentId(), bus, clock)
        );
        this.orchestrator = new TaskOrchestrator(
                config.agentId(),
                config.role(),
                bus,
                delivery,
                voting,
                agent,
                clock,
                config.collaborationWaitMs()
        );
        orchestrator.registerHandlers(router);
        connections.addListener(this);
    }

    /**
     * Connects without consuming anything.
     */
    public void init() {
        connections.connect();
    }

    /**
     * Connects and consumes the role's inboxes.
     */
    public void start() {
        inboxes = Inboxes.ROLE;
        connections.connect();
        LOG.info("Agent {} ({}) running as {}", config.agentId(), config.agentName(), config.role().wireName());
    }

    /**
     * Connects and consumes only this agent's reply inbox, for a process that opens a
     * voting session and waits for the ballots without taking on a role's work.
     */
    public void startRepliesOnly() {
        inboxes = Inboxes.REPLIES;
        connections.connect();
        LOG.info("Agent {} ({}) collecting replies only", config.agentId(), config.agentName());
    }

    /**
     * Blocks until {@link #close()} or until reconnection gives up. Returns false in the
     * latter case.
     */
    public boolean awaitShutdown() throws InterruptedException {
        stopped.await();
        return !gaveUp;
    }

    @Override
    public void onConnected() {
        topologyBuilder.declare(connections.channel(), topology());
        if (inboxes != Inboxes.NONE) {
            startConsumers();
        }
        orchestrator.publishStatus("connected", Map.of("agentName", config.agentName()));
    }

    @Override
    public void onDisconnected(Throwable cause) {
        LOG.warn("Agent {} disconnected: {}", config.agentId(), cause.getMessage());
    }

    @Override
    public void onError(Throwable error) {
        LOG.warn("Broker error: {}", error.getMessage());
    }

    @Override
    public void onMaxReconnectReached(int attempts) {
        gaveUp = true;
        LOG.error("Agent {} lost the broker for good after {} attempts; restart required", config.agentId(), attempts);
        stopped.countDown();
    }

    public String assignTask(TaskRequest request) {
        return orchestrator.assignTask(request);
    }

    /**
     * Opens a session, lets it run to its deadline and returns the result.
     */
    public VoteOutcome runVote(VotingConfig votingConfig) throws InterruptedException {
        String sessionId = voting.initiateVote(votingConfig.withInitiatedBy(config.agentId()));
        long deadline = voting.getSessionResults(sessionId).session().deadline();
        long waitMs = deadline - clock.millis();
        if (waitMs > 0) {
            TimeUnit.MILLISECONDS.sleep(waitMs);
        }
        VotingResult result = voting.closeVoting(sessionId);
        return new VoteOutcome(sessionId, result, voting.verifyIntegrity(sessionId));
    }

    public TopologyOutcome declareTopology() {
        Topology topology = topology();
        topologyBuilder.declare(connections.channel(), topology);
        List<String> exchanges = new ArrayList<>();
        topology.exchanges().forEach(exchange -> exchanges.add(exchange.name() + " (" + exchange.type().getType() + ")"));
        List<String> queues = new ArrayList<>();
        topology.queues().forEach(queue -> queues.add(queue.name()));
        return new TopologyOutcome(exchanges, queues, topology.bindings().size());
    }

    public HealthOutcome health() {
        boolean connected = connections.isHealthy();
        return new HealthOutcome(
                connected && !gaveUp,
                config.agentId(),
                config.agentName(),
                config.role().wireName(),
                config.brokerSettings().redactedUri(),
                connected,
                connections.reconnectAttempts(),
                gaveUp,
                orchestrator.getStats(),
                deadLetters.size(),
                voting.getActiveSessions().size()
        );
    }

    public List<DeadLetterEntry> deadLetters(int limit) {
        return deadLetters.newestFirst(limit);
    }

    public TaskOrchestrator orchestrator() {
        return orchestrator;
    }

    public VotingEngine voting() {
        return voting;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        orchestrator.shutdown();
        connections.close();
        scheduler.shutdownNow();
        stopped.countDown();
    }

    private Topology topology() {
        AgentRole role = config.role();
        if (inboxes == Inboxes.NONE) {
            return Topology.shared();
        }
        if (inboxes == Inboxes.REPLIES) {
            return Topology.forAgent(config.agentId(), false, false, List.of());
        }
        return Topology.forAgent(config.agentId(), role.joinsBrainstorms(), role.watchesStatus(),
                List.of(Topology.DEFAULT_STATUS_PATTERN));
    }

    private void startConsumers() {
        bus.consume(Topology.replyQueue(config.agentId()), delivery);
        if (inboxes == Inboxes.REPLIES) {
            return;
        }
        AgentRole role = config.role();
        if (role.consumesTasks()) {
            bus.consume(Topology.TASKS_QUEUE, delivery);
        }
        if (role.joinsBrainstorms()) {
            bus.consume(Topology.brainstormQueue(config.agentId()), delivery);
        }
        if (role.consumesResults()) {
            bus.consume(Topology.RESULTS_QUEUE, delivery);
        }
        if (role.watchesStatus()) {
            bus.consume(Topology.statusQueue(config.agentId()), delivery);
        }
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable, "hivemesh-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    private enum Inboxes {
        NONE,
        REPLIES,
        ROLE
    }

    public record VoteOutcome(String sessionId, VotingResult result, boolean integrityVerified) {
    }

    public record TopologyOutcome(List<String> exchanges, List<String> queues, int bindings) {
    }

    public record HealthOutcome(
            boolean ok,
            String agentId,
            String agentName,
            String role,
            String broker,
            boolean connected,
            int reconnectAttempts,
            boolean reconnectExhausted,
            OrchestratorStats stats,
            int deadLetters,
            int activeVotingSessions
    ) {
    }
}

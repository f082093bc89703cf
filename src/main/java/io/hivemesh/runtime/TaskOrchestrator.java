package io.hivemesh.runtime;

import io.hivemesh.agent.Agent;
import io.hivemesh.agent.AgentContext;
import io.hivemesh.agent.AgentResult;
import io.hivemesh.agent.TaskExecutionException;
import io.hivemesh.broker.Topology;
import io.hivemesh.bus.MessageBus;
import io.hivemesh.delivery.DeliveryControls;
import io.hivemesh.delivery.DeliveryController;
import io.hivemesh.delivery.DeliveryOutcome;
import io.hivemesh.model.AgentRole;
import io.hivemesh.model.Ballot;
import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.Priority;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.StatusPayload;
import io.hivemesh.model.TaskPayload;
import io.hivemesh.model.TaskStatus;
import io.hivemesh.routing.MessageRouter;
import io.hivemesh.security.SensitiveDataMasker;
import io.hivemesh.voting.SessionClosedException;
import io.hivemesh.voting.SessionNotFoundException;
import io.hivemesh.voting.VotingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Agent-side behavior on top of the bus: assigning and executing tasks, answering
 * brainstorms and votes, collecting results and peer status.
 *
 * <p>Task execution never settles a delivery itself. {@link #processTask(Envelope)}
 * either returns or throws, and the {@link DeliveryController} turns that into ack,
 * requeue or dead letter.
 *
 * <p>Answers to this agent's own brainstorms and votes arrive on its reply inbox, so
 * several result consumers can run side by side without stealing each other's ballots.
 * Task states and held results are bounded; the oldest entries are forgotten first.
 */
public final class TaskOrchestrator {
    static final String DEFAULT_COLLABORATION_QUESTION = "How should we approach this?";
    public static final int DEFAULT_TRACKING_LIMIT = 10_000;
    private static final Logger LOG = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final String agentId;
    private final AgentRole role;
    private final MessageBus bus;
    private final DeliveryController delivery;
    private final VotingEngine voting;
    private final Agent agent;
    private final Clock clock;
    private final long collaborationWaitMs;

    private final Map<String, TaskStatus> taskStates;
    private final ConcurrentMap<String, Long> activeTasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BrainstormSession> brainstorms = new ConcurrentHashMap<>();
    private final Map<String, ResultPayload> results;
    private final ConcurrentMap<String, StatusPayload> peerStatus = new ConcurrentHashMap<>();
    private final AtomicLong tasksReceived = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong brainstormsParticipated = new AtomicLong();
    private final AtomicLong resultsPublished = new AtomicLong();

    public TaskOrchestrator(
            String agentId,
            AgentRole role,
            MessageBus bus,
            DeliveryController delivery,
            VotingEngine voting,
            Agent agent,
            Clock clock,
            long collaborationWaitMs
    ) {
        this(agentId, role, bus, delivery, voting, agent, clock, collaborationWaitMs, DEFAULT_TRACKING_LIMIT);
    }

    TaskOrchestrator(
            String agentId,
            AgentRole role,
            MessageBus bus,
            DeliveryController delivery,
            VotingEngine voting,
            Agent agent,
            Clock clock,
            long collaborationWaitMs,
            int trackingLimit
    ) {
        if (trackingLimit <= 0) {
            throw new IllegalArgumentException("trackingLimit must be > 0");
        }
        this.taskStates = bounded(trackingLimit);
        this.results = bounded(trackingLimit);
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.role = Objects.requireNonNull(role, "role");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.voting = Objects.requireNonNull(voting, "voting");
        this.agent = Objects.requireNonNull(agent, "agent");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.collaborationWaitMs = Math.max(0L, collaborationWaitMs);
        delivery.addListener(this::onDeliveryOutcome);
    }

    /**
     * Routes every message type to this orchestrator.
     */
    public void registerHandlers(MessageRouter router) {
        router.register(MessageType.TASK, this::processTask)
                .register(MessageType.BRAINSTORM, this::handleBrainstorm)
                .register(MessageType.RESULT, this::handleResult)
                .register(MessageType.STATUS, this::handleStatus);
    }

    public String assignTask(TaskRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("task title is required");
        }
        TaskPayload task = new TaskPayload(
                request.title(),
                request.description(),
                request.priority() == null ? Priority.NORMAL : request.priority(),
                agentId,
                clock.millis(),
                request.requiresCollaboration() ? Boolean.TRUE : null,
                request.retryCount(),
                request.collaborationQuestion(),
                request.context() == null ? Map.of() : request.context()
        );
        Envelope envelope = Envelope.create(agentId, task, clock);
        String taskId = bus.publishTask(envelope);
        taskStates.put(taskId, TaskStatus.QUEUED);
        LOG.info("Assigned task {} '{}'", taskId, task.title());
        publishStatus("task_assigned", detail("taskId", taskId, "task", task.title()));
        return taskId;
    }

    /**
     * Runs a consumed task through the retry policy and settles it.
     */
    public DeliveryOutcome handleTask(Envelope envelope, DeliveryControls controls) {
        return delivery.settle(envelope, controls, this::processTask);
    }

    void processTask(Envelope envelope) throws Exception {
        TaskPayload task = envelope.payloadAs(TaskPayload.class);
        String taskId = envelope.id();
        long startedAt = clock.millis();
        tasksReceived.incrementAndGet();
        taskStates.put(taskId, TaskStatus.DELIVERED);
        activeTasks.put(taskId, startedAt);
        LOG.info("Received task {} '{}' (priority {}), context {}", taskId, task.title(),
                task.priority() == null ? Priority.NORMAL.wireName() : task.priority().wireName(),
                SensitiveDataMasker.mask(task.context()));
        publishStatus("task_started", detail("taskId", taskId, "task", task.title()));
        try {
            List<String> suggestions = task.collaborative() ? collaborate(taskId, task) : List.of();
            AgentResult outcome = agent.execute(new AgentContext(
                    taskId,
                    task.title(),
                    task.description(),
                    task.priority(),
                    task.assignedBy(),
                    task.context(),
                    suggestions
            ));
            if (outcome == null || !outcome.success()) {
                String error = outcome == null ? "agent returned no result" : outcome.error();
                throw new TaskExecutionException(taskId, error == null ? "task failed" : error);
            }
            long completedAt = clock.millis();
            long duration = completedAt - startedAt;
            publishResult(ResultPayload.taskResult(taskId, "completed", outcome.output(), agentId, completedAt, duration));
            publishStatus("task_completed", detail("taskId", taskId, "task", task.title(), "duration", duration));
            tasksCompleted.incrementAndGet();
            LOG.info("Completed task {} in {} ms", taskId, duration);
        } catch (Exception e) {
            tasksFailed.incrementAndGet();
            LOG.warn("Task {} failed: {}", taskId, e.getMessage());
            publishStatus("task_failed", detail("taskId", taskId, "task", task.title(), "error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            activeTasks.remove(taskId);
        }
    }

    /**
     * Broadcasts an open question to every agent and returns the brainstorm session id.
     */
    public String initiateBrainstorm(String taskId, String topic, String question, List<String> requiredAgents) {
        String sessionId = UUID.randomUUID().toString();
        brainstorms.put(sessionId, new BrainstormSession(sessionId, taskId, topic, requiredAgents, clock.millis()));
        BrainstormPayload message = new BrainstormPayload(
                sessionId,
                topic,
                question,
                agentId,
                requiredAgents == null ? List.of() : List.copyOf(requiredAgents),
                null,
                Topology.replyQueue(agentId)
        );
        bus.broadcastBrainstorm(Envelope.create(agentId, message, clock));
        LOG.info("Brainstorm {} broadcast: {}", sessionId, question);
        return sessionId;
    }

    void handleBrainstorm(Envelope envelope) {
        BrainstormPayload message = envelope.payloadAs(BrainstormPayload.class);
        if (agentId.equals(envelope.from()) || agentId.equals(message.initiatedBy())) {
            return;
        }
        brainstormsParticipated.incrementAndGet();
        if (message.announcesVote()) {
            Optional<Ballot> ballot = agent.deliberate(message);
            if (ballot.isEmpty() || voting.shouldAbstain(ballot.get().effectiveConfidence())) {
                LOG.info("Abstaining from voting session {} on '{}'", message.sessionId(), message.topic());
                return;
            }
            publishResult(message.replyTo(), ResultPayload.vote(message.sessionId(), ballot.get(), agentId, clock.millis()));
            LOG.info("Voted in session {}", message.sessionId());
            return;
        }
        String suggestion = agent.suggest(message);
        if (suggestion == null || suggestion.isBlank()) {
            suggestion = "Agent " + agentId + " suggests: Consider approach based on " + message.topic();
        }
        publishResult(message.replyTo(), ResultPayload.brainstormResponse(message.sessionId(), suggestion, agentId, clock.millis()));
        LOG.info("Answered brainstorm {} from {}", message.sessionId(), message.initiatedBy());
    }

    void handleResult(Envelope envelope) {
        ResultPayload result = envelope.payloadAs(ResultPayload.class);
        String voter = result.processedBy() == null ? envelope.from() : result.processedBy();
        switch (result.effectiveKind()) {
            case VOTE -> {
                try {
                    voting.castVote(result.sessionId(), voter, result.ballot());
                } catch (SessionNotFoundException e) {
                    // only reachable through the shared queue, from a sender that ignored replyTo
                    LOG.warn("Dropping vote from {} for session {} not opened by {}", voter, result.sessionId(), agentId);
                } catch (SessionClosedException e) {
                    LOG.warn("Dropping vote from {}: {}", voter, e.getMessage());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Dropping invalid ballot from {} for session {}: {}", voter, result.sessionId(), e.getMessage());
                }
                return;
            }
            case BRAINSTORM_RESPONSE -> {
                BrainstormSession session = brainstorms.get(result.sessionId());
                if (session != null) {
                    session.addResponse(voter, result.output());
                }
                LOG.info("Brainstorm response from {} for {}: {}", voter, result.sessionId(), result.output());
            }
            case VOTING_RESULTS -> LOG.info("Voting session {} closed with status {}", result.sessionId(), result.status());
            case TASK_RESULT -> {
                if ("completed".equalsIgnoreCase(result.status())) {
                    taskStates.replace(result.taskId(), TaskStatus.COMPLETED);
                }
                LOG.info("Result for task {}: {} by {} in {} ms",
                        result.taskId(), result.status(), voter, result.durationMs());
            }
        }
        results.put(result.subjectId(), result);
    }

    void handleStatus(Envelope envelope) {
        StatusPayload status = envelope.payloadAs(StatusPayload.class);
        if (agentId.equals(status.agentId()) || agentId.equals(envelope.from())) {
            return;
        }
        peerStatus.put(status.agentId() == null ? envelope.from() : status.agentId(), status);
        LOG.info("Status from {}: {}", status.agentId(), status.event());
    }

    /**
     * Publishes a status event. Failures are logged; status is advisory and must not
     * fail the work that emits it.
     */
    public void publishStatus(String event, Map<String, Object> detail) {
        if (!bus.isHealthy()) {
            LOG.warn("Cannot publish status {}: not connected", event);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>(detail == null ? Map.of() : detail);
        body.put("stats", getStats());
        StatusPayload status = new StatusPayload(agentId, role.wireName(), event, body);
        try {
            bus.publishStatus(Envelope.create(agentId, status, clock));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish status {}: {}", event, e.getMessage());
        }
    }

    public OrchestratorStats getStats() {
        return new OrchestratorStats(
                tasksReceived.get(),
                tasksCompleted.get(),
                tasksFailed.get(),
                brainstormsParticipated.get(),
                resultsPublished.get(),
                activeTasks.size(),
                brainstorms.size(),
                results.size()
        );
    }

    public Optional<TaskStatus> taskStatus(String taskId) {
        return Optional.ofNullable(taskStates.get(taskId));
    }

    public Optional<ResultPayload> result(String subjectId) {
        return Optional.ofNullable(results.get(subjectId));
    }

    public Map<String, StatusPayload> peerStatus() {
        return Map.copyOf(peerStatus);
    }

    public void shutdown() {
        publishStatus("shutdown", detail("finalStats", getStats()));
        LOG.info("Orchestrator {} stopped: {}", agentId, getStats());
    }

    private void publishResult(ResultPayload result) {
        publishResult(null, result);
    }

    private void publishResult(String replyTo, ResultPayload result) {
        Envelope envelope = Envelope.create(agentId, result, clock);
        if (replyTo == null || replyTo.isBlank()) {
            bus.publishResult(envelope);
        } else {
            bus.sendReply(replyTo, envelope);
        }
        results.put(result.subjectId(), result);
        resultsPublished.incrementAndGet();
        publishStatus("result_published", detail("resultId", result.subjectId()));
    }

    private List<String> collaborate(String taskId, TaskPayload task) throws InterruptedException {
        String question = task.collaborationQuestion() == null || task.collaborationQuestion().isBlank()
                ? DEFAULT_COLLABORATION_QUESTION
                : task.collaborationQuestion();
        String sessionId = initiateBrainstorm(taskId, task.title(), question, List.of());
        BrainstormSession session = brainstorms.get(sessionId);
        try {
            List<String> responses = session.awaitResponses(collaborationWaitMs);
            LOG.info("Brainstorm {} gathered {} responses for task {}", sessionId, responses.size(), taskId);
            return responses;
        } finally {
            brainstorms.remove(sessionId);
        }
    }

    private void onDeliveryOutcome(Envelope envelope, DeliveryOutcome outcome, Throwable error) {
        if (envelope.type() != MessageType.TASK) {
            return;
        }
        switch (outcome) {
            case ACKED -> taskStates.put(envelope.id(), TaskStatus.COMPLETED);
            case REQUEUED -> taskStates.put(envelope.id(), TaskStatus.RETRY_REQUEUED);
            case DEAD_LETTERED -> taskStates.put(envelope.id(), TaskStatus.DEAD_LETTERED);
            case REJECTED -> taskStates.remove(envelope.id());
        }
    }

    private static <V> Map<String, V> bounded(int limit) {
        return Collections.synchronizedMap(new LinkedHashMap<String, V>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > limit;
            }
        });
    }

    private static Map<String, Object> detail(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }
}

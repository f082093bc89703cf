package io.hivemesh.broker;

import com.rabbitmq.client.BuiltinExchangeType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of the exchanges, queues and bindings an agent needs.
 */
public record Topology(List<ExchangeSpec> exchanges, List<QueueSpec> queues, List<BindingSpec> bindings) {
    public static final String TASKS_QUEUE = "agent.tasks";
    public static final String BRAINSTORM_EXCHANGE = "agent.brainstorm";
    public static final String RESULTS_QUEUE = "agent.results";
    public static final String STATUS_EXCHANGE = "agent.status";
    public static final String DEAD_LETTER_EXCHANGE = "agent.dlx";
    public static final String DEAD_LETTER_QUEUE = "agent.dead-letter";
    public static final String DEFAULT_STATUS_PATTERN = "agent.status.#";

    public static final long TASK_TTL_MS = 3_600_000L;
    public static final int TASK_MAX_LENGTH = 10_000;

    public Topology {
        exchanges = List.copyOf(exchanges);
        queues = List.copyOf(queues);
        bindings = List.copyOf(bindings);
    }

    public static String brainstormQueue(String agentId) {
        return "brainstorm." + agentId;
    }

    public static String statusQueue(String agentId) {
        return "status." + agentId;
    }

    /**
     * Private inbox for answers addressed to this agent: ballots for the sessions it
     * opened and responses to its brainstorms. Reached through the default exchange.
     */
    public static String replyQueue(String agentId) {
        return "replies." + agentId;
    }

    /**
     * Resources every agent shares: task queue, results queue, broadcast and status
     * exchanges, dead-letter plumbing.
     */
    public static Topology shared() {
        List<ExchangeSpec> exchanges = List.of(
                new ExchangeSpec(DEAD_LETTER_EXCHANGE, BuiltinExchangeType.FANOUT, true),
                new ExchangeSpec(BRAINSTORM_EXCHANGE, BuiltinExchangeType.FANOUT, true),
                new ExchangeSpec(STATUS_EXCHANGE, BuiltinExchangeType.TOPIC, true)
        );
        Map<String, Object> taskArgs = new LinkedHashMap<>();
        taskArgs.put("x-message-ttl", TASK_TTL_MS);
        taskArgs.put("x-max-length", TASK_MAX_LENGTH);
        taskArgs.put("x-dead-letter-exchange", DEAD_LETTER_EXCHANGE);
        List<QueueSpec> queues = List.of(
                QueueSpec.durable(DEAD_LETTER_QUEUE),
                new QueueSpec(TASKS_QUEUE, true, false, false, taskArgs),
                QueueSpec.durable(RESULTS_QUEUE)
        );
        List<BindingSpec> bindings = List.of(new BindingSpec(DEAD_LETTER_QUEUE, DEAD_LETTER_EXCHANGE, ""));
        return new Topology(exchanges, queues, bindings);
    }

    /**
     * Shared resources plus the agent's private broadcast and status inboxes.
     */
    public static Topology forAgent(String agentId, List<String> statusPatterns) {
        return forAgent(agentId, true, true, statusPatterns);
    }

    /**
     * Shared resources plus the reply inbox and only those broadcast inboxes the agent
     * will consume. An inbox nobody reads would keep collecting broadcasts until the
     * connection closes.
     */
    public static Topology forAgent(String agentId, boolean brainstormInbox, boolean statusInbox,
                                    List<String> statusPatterns) {
        Objects.requireNonNull(agentId, "agentId");
        Topology shared = shared();
        List<QueueSpec> queues = new ArrayList<>(shared.queues());
        List<BindingSpec> bindings = new ArrayList<>(shared.bindings());

        queues.add(QueueSpec.exclusive(replyQueue(agentId)));
        if (brainstormInbox) {
            String brainstormQueue = brainstormQueue(agentId);
            queues.add(QueueSpec.exclusive(brainstormQueue));
            bindings.add(new BindingSpec(brainstormQueue, BRAINSTORM_EXCHANGE, ""));
        }
        if (statusInbox) {
            String statusQueue = statusQueue(agentId);
            queues.add(QueueSpec.exclusive(statusQueue));
            List<String> patterns = statusPatterns == null || statusPatterns.isEmpty()
                    ? List.of(DEFAULT_STATUS_PATTERN)
                    : statusPatterns;
            for (String pattern : patterns) {
                bindings.add(new BindingSpec(statusQueue, STATUS_EXCHANGE, pattern));
            }
        }
        return new Topology(shared.exchanges(), queues, bindings);
    }

    public record ExchangeSpec(String name, BuiltinExchangeType type, boolean durable) {
    }

    public record QueueSpec(
            String name,
            boolean durable,
            boolean exclusive,
            boolean autoDelete,
            Map<String, Object> arguments
    ) {
        public QueueSpec {
            arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        }

        static QueueSpec durable(String name) {
            return new QueueSpec(name, true, false, false, Map.of());
        }

        static QueueSpec exclusive(String name) {
            return new QueueSpec(name, false, true, true, Map.of());
        }
    }

    public record BindingSpec(String queue, String exchange, String routingPattern) {
    }
}

package io.hivemesh.delivery;

import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.TaskPayload;
import io.hivemesh.routing.EnvelopeCodec;
import io.hivemesh.routing.EnvelopeHandler;
import io.hivemesh.routing.EnvelopeValidationException;
import io.hivemesh.routing.EnvelopeValidator;
import io.hivemesh.routing.MessageRouter;
import io.hivemesh.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns one consumed message into exactly one settlement: ack on success, requeue
 * while the retry budget lasts, reject and dead-letter once it is spent. Structural
 * problems (parse, validation, no handler) are rejected on first sight.
 */
public final class DeliveryController {
    public static final int DEFAULT_MAX_RETRIES = 3;
    private static final int MAX_TRACKED_MESSAGES = 10_000;
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryController.class);

    private final EnvelopeCodec codec;
    private final EnvelopeValidator validator;
    private final MessageRouter router;
    private final DeadLetterStore deadLetters;
    private final int maxRetries;
    private final Clock clock;
    private final Map<String, RedeliveryMetadata> attempts;
    private final List<DeliveryOutcomeListener> listeners = new CopyOnWriteArrayList<>();

    public DeliveryController(MessageRouter router, DeadLetterStore deadLetters, int maxRetries, Clock clock) {
        this(new EnvelopeCodec(), new EnvelopeValidator(), router, deadLetters, maxRetries, clock);
    }

    public DeliveryController(
            EnvelopeCodec codec,
            EnvelopeValidator validator,
            MessageRouter router,
            DeadLetterStore deadLetters,
            int maxRetries,
            Clock clock
    ) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.router = Objects.requireNonNull(router, "router");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
        this.maxRetries = Math.max(0, maxRetries);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.attempts = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RedeliveryMetadata> eldest) {
                return size() > MAX_TRACKED_MESSAGES;
            }
        };
    }

    public void addListener(DeliveryOutcomeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public int maxRetries() {
        return maxRetries;
    }

    public DeadLetterStore deadLetters() {
        return deadLetters;
    }

    public DeliveryOutcome onDelivery(String messageId, byte[] body, DeliveryControls controls) {
        Envelope envelope;
        EnvelopeHandler handler;
        try {
            envelope = codec.decode(body);
            validator.validate(envelope);
            handler = router.resolve(envelope);
        } catch (EnvelopeValidationException e) {
            String key = messageKey(messageId, body);
            LOG.warn("Rejecting message {}: {}", key, e.getMessage());
            controls.reject();
            deadLetters.record(new DeadLetterEntry(
                    key,
                    null,
                    DeadLetterEntry.Reason.INVALID,
                    e.getMessage(),
                    clock.millis(),
                    body == null ? "" : new String(body, StandardCharsets.UTF_8),
                    List.of(new FailureRecord(1, e.getMessage(), clock.millis()))
            ));
            return DeliveryOutcome.REJECTED;
        }
        return settle(envelope, controls, handler, body);
    }

    public DeliveryOutcome settle(Envelope envelope, DeliveryControls controls, EnvelopeHandler work) {
        return settle(envelope, controls, work, null);
    }

    private DeliveryOutcome settle(Envelope envelope, DeliveryControls controls, EnvelopeHandler work, byte[] rawBody) {
        String key = envelope.id();
        try {
            work.handle(envelope);
        } catch (Exception e) {
            return onFailure(envelope, controls, e, rawBody);
        }
        forget(key);
        controls.ack();
        notifyListeners(envelope, DeliveryOutcome.ACKED, null);
        return DeliveryOutcome.ACKED;
    }

    public RedeliveryMetadata redelivery(String messageId) {
        synchronized (attempts) {
            RedeliveryMetadata metadata = attempts.get(messageId);
            return metadata == null ? RedeliveryMetadata.first(messageId) : metadata;
        }
    }

    private DeliveryOutcome onFailure(Envelope envelope, DeliveryControls controls, Exception error, byte[] rawBody) {
        String key = envelope.id();
        String message = describe(error);
        int budget = retryBudget(envelope);
        RedeliveryMetadata failed;
        RedeliveryMetadata requeued = null;
        synchronized (attempts) {
            RedeliveryMetadata current = attempts.getOrDefault(key, RedeliveryMetadata.first(key));
            failed = current.failed(message, clock.millis());
            if (failed.retryCount() < budget) {
                requeued = failed.requeued();
                attempts.put(key, requeued);
            } else {
                attempts.remove(key);
            }
        }
        if (requeued != null) {
            LOG.warn("Handler failed for {} {} (retry {}/{}): {}",
                    envelope.type().wireName(), key, requeued.retryCount(), budget, message);
            controls.nack(true);
            notifyListeners(envelope, DeliveryOutcome.REQUEUED, error);
            return DeliveryOutcome.REQUEUED;
        }
        LOG.error("Dead-lettering {} {} after {} retries: {}",
                envelope.type().wireName(), key, failed.retryCount(), message, error);
        controls.reject();
        deadLetters.record(new DeadLetterEntry(
                key,
                envelope.type().wireName(),
                DeadLetterEntry.Reason.RETRY_EXHAUSTED,
                message,
                clock.millis(),
                rawBody == null ? new String(codec.encode(envelope), StandardCharsets.UTF_8)
                        : new String(rawBody, StandardCharsets.UTF_8),
                failed.history()
        ));
        notifyListeners(envelope, DeliveryOutcome.DEAD_LETTERED, error);
        return DeliveryOutcome.DEAD_LETTERED;
    }

    private int retryBudget(Envelope envelope) {
        if (envelope.type() == MessageType.TASK) {
            TaskPayload task = envelope.payloadAs(TaskPayload.class);
            if (task.retryCount() != null && task.retryCount() >= 0) {
                return task.retryCount();
            }
        }
        return maxRetries;
    }

    private void forget(String key) {
        synchronized (attempts) {
            attempts.remove(key);
        }
    }

    private void notifyListeners(Envelope envelope, DeliveryOutcome outcome, Throwable error) {
        for (DeliveryOutcomeListener listener : listeners) {
            try {
                listener.onOutcome(envelope, outcome, error);
            } catch (RuntimeException e) {
                LOG.warn("Delivery listener failed for {}: {}", envelope.id(), e.getMessage(), e);
            }
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static String messageKey(String messageId, byte[] body) {
        if (messageId != null && !messageId.isBlank()) {
            return messageId;
        }
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        return "body-" + Hashing.sha256Hex(text).substring(0, 16);
    }
}

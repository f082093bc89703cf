package io.hivemesh.bus;

import io.hivemesh.model.Envelope;

/**
 * Outbound side of the broker. Every method publishes an already-built envelope and
 * returns its id.
 */
public interface MessageBus {
    /**
     * Persistent, competing-consumer delivery to the task queue.
     */
    String publishTask(Envelope envelope);

    /**
     * Non-persistent fanout to every agent's broadcast inbox.
     */
    String broadcastBrainstorm(Envelope envelope);

    /**
     * Persistent delivery to the results queue.
     */
    String publishResult(Envelope envelope);

    /**
     * Delivery to the reply inbox of the agent that asked. Unlike the results queue
     * nobody else can consume it.
     */
    String sendReply(String replyTo, Envelope envelope);

    /**
     * Topic publish routed by the status event.
     */
    String publishStatus(Envelope envelope);

    boolean isHealthy();
}

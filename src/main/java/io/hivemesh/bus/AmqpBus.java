package io.hivemesh.bus;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import io.hivemesh.broker.BrokerConnectionException;
import io.hivemesh.broker.ConnectionManager;
import io.hivemesh.broker.Topology;
import io.hivemesh.delivery.DeliveryController;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.StatusPayload;
import io.hivemesh.routing.EnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.Objects;

/**
 * {@link MessageBus} over the channel owned by a {@link ConnectionManager}. The channel
 * is looked up on every call so a reconnect swaps it in transparently.
 */
public final class AmqpBus implements MessageBus {
    static final int PERSISTENT = 2;
    static final int TRANSIENT = 1;
    private static final Logger LOG = LoggerFactory.getLogger(AmqpBus.class);

    private final ConnectionManager connections;
    private final EnvelopeCodec codec;

    public AmqpBus(ConnectionManager connections) {
        this(connections, new EnvelopeCodec());
    }

    public AmqpBus(ConnectionManager connections, EnvelopeCodec codec) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public String publishTask(Envelope envelope) {
        requireType(envelope, MessageType.TASK);
        publish("", Topology.TASKS_QUEUE, envelope, PERSISTENT);
        return envelope.id();
    }

    @Override
    public String broadcastBrainstorm(Envelope envelope) {
        requireType(envelope, MessageType.BRAINSTORM);
        publish(Topology.BRAINSTORM_EXCHANGE, "", envelope, TRANSIENT);
        return envelope.id();
    }

    @Override
    public String publishResult(Envelope envelope) {
        requireType(envelope, MessageType.RESULT);
        publish("", Topology.RESULTS_QUEUE, envelope, PERSISTENT);
        return envelope.id();
    }

    @Override
    public String sendReply(String replyTo, Envelope envelope) {
        requireType(envelope, MessageType.RESULT);
        if (replyTo == null || replyTo.isBlank()) {
            throw new IllegalArgumentException("replyTo is required");
        }
        publish("", replyTo, envelope, TRANSIENT);
        return envelope.id();
    }

    @Override
    public String publishStatus(Envelope envelope) {
        requireType(envelope, MessageType.STATUS);
        StatusPayload status = envelope.payloadAs(StatusPayload.class);
        publish(Topology.STATUS_EXCHANGE, status.routingKey(), envelope, TRANSIENT);
        return envelope.id();
    }

    @Override
    public boolean isHealthy() {
        return connections.isHealthy();
    }

    /**
     * Starts a manual-ack consumer on {@code queue}; every delivery goes through
     * {@code controller}. Returns the consumer tag.
     */
    public String consume(String queue, DeliveryController controller) {
        Channel channel = connections.channel();
        DefaultConsumer consumer = new DefaultConsumer(channel) {
            @Override
            public void handleDelivery(String consumerTag, com.rabbitmq.client.Envelope delivery, AMQP.BasicProperties properties, byte[] body) {
                String messageId = properties == null ? null : properties.getMessageId();
                controller.onDelivery(messageId, body, new AmqpDeliveryControls(getChannel(), delivery.getDeliveryTag()));
            }
        };
        try {
            String tag = channel.basicConsume(queue, false, consumer);
            LOG.info("Consuming {} (tag {})", queue, tag);
            return tag;
        } catch (IOException e) {
            throw new BrokerConnectionException("Failed to consume " + queue, e);
        }
    }

    private void publish(String exchange, String routingKey, Envelope envelope, int deliveryMode) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(EnvelopeCodec.CONTENT_TYPE)
                .deliveryMode(deliveryMode)
                .messageId(envelope.id())
                .timestamp(new Date(envelope.timestamp()))
                .type(envelope.type().wireName())
                .appId(envelope.from())
                .build();
        byte[] body = codec.encode(envelope);
        try {
            connections.channel().basicPublish(exchange, routingKey, properties, body);
        } catch (IOException e) {
            throw new BrokerConnectionException(
                    "Failed to publish " + envelope.type().wireName() + " " + envelope.id(), e);
        }
        LOG.debug("Published {} {} to {}/{}", envelope.type().wireName(), envelope.id(), exchange, routingKey);
    }

    private static void requireType(Envelope envelope, MessageType expected) {
        Objects.requireNonNull(envelope, "envelope");
        if (envelope.type() != expected) {
            throw new IllegalArgumentException("Expected " + expected.wireName() + " envelope, got " + envelope.type().wireName());
        }
    }
}

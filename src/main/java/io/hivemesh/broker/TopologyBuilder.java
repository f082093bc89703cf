package io.hivemesh.broker;

import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;

/**
 * Declares a {@link Topology} on a channel: exchanges, then queues, then bindings.
 * Redeclaring with identical properties is a broker-side no-op; a mismatch closes the
 * channel with PRECONDITION_FAILED, surfaced here as {@link BrokerConnectionException}.
 */
public final class TopologyBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(TopologyBuilder.class);

    public synchronized void declare(Channel channel, Topology topology) {
        String current = null;
        try {
            for (Topology.ExchangeSpec exchange : topology.exchanges()) {
                current = "exchange " + exchange.name();
                channel.exchangeDeclare(exchange.name(), exchange.type(), exchange.durable());
            }
            for (Topology.QueueSpec queue : topology.queues()) {
                current = "queue " + queue.name();
                channel.queueDeclare(
                        queue.name(),
                        queue.durable(),
                        queue.exclusive(),
                        queue.autoDelete(),
                        queue.arguments().isEmpty() ? null : new HashMap<>(queue.arguments())
                );
            }
            for (Topology.BindingSpec binding : topology.bindings()) {
                current = "binding " + binding.exchange() + " -> " + binding.queue();
                channel.queueBind(binding.queue(), binding.exchange(), binding.routingPattern());
            }
        } catch (IOException e) {
            throw new BrokerConnectionException("Failed to declare " + current, e);
        }
        LOG.debug("Declared {} exchanges, {} queues, {} bindings",
                topology.exchanges().size(), topology.queues().size(), topology.bindings().size());
    }
}

package io.hivemesh.bus;

import com.rabbitmq.client.Channel;
import io.hivemesh.broker.BrokerConnectionException;
import io.hivemesh.delivery.DeliveryControls;

import java.io.IOException;

/**
 * Settles one delivery on the channel it arrived on. Delivery tags are channel scoped,
 * so after a reconnect these calls fail and the broker redelivers on its own.
 */
final class AmqpDeliveryControls implements DeliveryControls {
    private final Channel channel;
    private final long deliveryTag;

    AmqpDeliveryControls(Channel channel, long deliveryTag) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    @Override
    public void ack() {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException e) {
            throw new BrokerConnectionException("ack failed for delivery " + deliveryTag, e);
        }
    }

    @Override
    public void nack(boolean requeue) {
        try {
            channel.basicNack(deliveryTag, false, requeue);
        } catch (IOException e) {
            throw new BrokerConnectionException("nack failed for delivery " + deliveryTag, e);
        }
    }

    @Override
    public void reject() {
        try {
            channel.basicReject(deliveryTag, false);
        } catch (IOException e) {
            throw new BrokerConnectionException("reject failed for delivery " + deliveryTag, e);
        }
    }
}

package io.hivemesh.delivery;

/**
 * Settlement actions for one consumed message. Exactly one of them is expected per
 * delivery.
 */
public interface DeliveryControls {
    void ack();

    void nack(boolean requeue);

    void reject();
}

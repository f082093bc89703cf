package io.hivemesh.delivery;

import io.hivemesh.model.Envelope;

@FunctionalInterface
public interface DeliveryOutcomeListener {
    void onOutcome(Envelope envelope, DeliveryOutcome outcome, Throwable error);
}

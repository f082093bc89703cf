package io.hivemesh.runtime;

import io.hivemesh.bus.MessageBus;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.StatusPayload;

import java.util.ArrayList;
import java.util.List;

final class RecordingBus implements MessageBus {
    final List<Envelope> tasks = new ArrayList<>();
    final List<Envelope> brainstorms = new ArrayList<>();
    final List<Envelope> results = new ArrayList<>();
    final List<Envelope> replies = new ArrayList<>();
    final List<String> replyTargets = new ArrayList<>();
    final List<Envelope> statuses = new ArrayList<>();
    boolean healthy = true;

    @Override
    public String publishTask(Envelope envelope) {
        tasks.add(envelope);
        return envelope.id();
    }

    @Override
    public String broadcastBrainstorm(Envelope envelope) {
        brainstorms.add(envelope);
        return envelope.id();
    }

    @Override
    public String publishResult(Envelope envelope) {
        results.add(envelope);
        return envelope.id();
    }

    @Override
    public String sendReply(String replyTo, Envelope envelope) {
        replyTargets.add(replyTo);
        replies.add(envelope);
        return envelope.id();
    }

    @Override
    public String publishStatus(Envelope envelope) {
        statuses.add(envelope);
        return envelope.id();
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    List<String> statusEvents() {
        List<String> events = new ArrayList<>();
        for (Envelope envelope : statuses) {
            events.add(envelope.payloadAs(StatusPayload.class).event());
        }
        return events;
    }
}

package io.hivemesh.runtime;

import io.hivemesh.broker.Topology;
import io.hivemesh.bus.MessageBus;
import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.VotingAnnouncement;
import io.hivemesh.util.Jsons;
import io.hivemesh.voting.SessionView;
import io.hivemesh.voting.VotingBroadcaster;
import io.hivemesh.voting.VotingResult;

import java.time.Clock;
import java.util.List;

/**
 * Announces sessions on the brainstorm exchange with this agent's reply inbox as the
 * ballot address, and publishes closed results to the results queue.
 */
final class BusVotingBroadcaster implements VotingBroadcaster {
    private final String agentId;
    private final MessageBus bus;
    private final Clock clock;

    BusVotingBroadcaster(String agentId, MessageBus bus, Clock clock) {
        this.agentId = agentId;
        this.bus = bus;
        this.clock = clock;
    }

    @Override
    public boolean isAvailable() {
        return bus.isHealthy();
    }

    @Override
    public void announce(SessionView session) {
        BrainstormPayload announcement = new BrainstormPayload(
                session.sessionId(),
                session.topic(),
                session.question(),
                session.initiatedBy() == null ? agentId : session.initiatedBy(),
                List.of(),
                new VotingAnnouncement(session.options(), session.algorithm(), session.deadline(), session.tokensPerAgent()),
                Topology.replyQueue(agentId)
        );
        bus.broadcastBrainstorm(Envelope.create(agentId, announcement, clock));
    }

    @Override
    public void publishResult(VotingResult result) {
        ResultPayload payload = ResultPayload.votingResults(
                result.sessionId(),
                result.status().name(),
                Jsons.toCompactJson(result),
                agentId,
                clock.millis()
        );
        bus.publishResult(Envelope.create(agentId, payload, clock));
    }
}

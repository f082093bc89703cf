package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of one session. Callers synchronize on the instance.
 */
final class VotingSession {
    private final String id;
    private final VotingConfig config;
    private final long initiatedAt;
    private final long deadline;
    private final Map<String, VoteRecord> votes = new LinkedHashMap<>();
    private SessionStatus status = SessionStatus.OPEN;
    private VotingResult result;
    private ScheduledFuture<?> autoClose;

    VotingSession(String id, VotingConfig config, long initiatedAt, long deadline) {
        this.id = id;
        this.config = config;
        this.initiatedAt = initiatedAt;
        this.deadline = deadline;
    }

    String id() {
        return id;
    }

    VotingConfig config() {
        return config;
    }

    AlgorithmType algorithm() {
        return config.effectiveAlgorithm();
    }

    long deadline() {
        return deadline;
    }

    synchronized boolean isOpen() {
        return status == SessionStatus.OPEN;
    }

    synchronized void upsert(VoteRecord vote) {
        // last write wins and moves to the end of the cast order
        votes.remove(vote.agentId());
        votes.put(vote.agentId(), vote);
    }

    synchronized List<VoteRecord> votesInCastOrder() {
        return new ArrayList<>(votes.values());
    }

    synchronized VotingResult result() {
        return result;
    }

    synchronized void close(VotingResult closedWith) {
        status = SessionStatus.CLOSED;
        result = closedWith;
        if (autoClose != null) {
            autoClose.cancel(false);
            autoClose = null;
        }
    }

    synchronized void autoClose(ScheduledFuture<?> future) {
        this.autoClose = future;
    }

    synchronized SessionView view() {
        return new SessionView(
                id,
                config.topic(),
                config.question(),
                config.options(),
                config.effectiveAlgorithm(),
                config.initiatedBy(),
                initiatedAt,
                deadline,
                config.effectiveTokensPerAgent(),
                status,
                votes.size()
        );
    }

    // live map, for tests that simulate tampering
    Map<String, VoteRecord> liveVotes() {
        return votes;
    }
}

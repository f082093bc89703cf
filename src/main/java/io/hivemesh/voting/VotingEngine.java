package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;
import io.hivemesh.model.Ballot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Voting session lifecycle: open, collect one live ballot per agent, close once.
 *
 * <p>Closing checks quorum first and only then runs the session's algorithm, so an
 * under-attended session reports {@link VotingStatus#QUORUM_NOT_MET} even with a clear
 * plurality. Every cast is signed and appended to the session's audit chain.
 */
public final class VotingEngine {
    public static final double DEFAULT_ABSTENTION_THRESHOLD = 0.3;
    private static final Logger LOG = LoggerFactory.getLogger(VotingEngine.class);

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Random random;
    private final String signingSecret;
    private final VotingBroadcaster broadcaster;
    private final VoteAuditTrail auditTrail = new VoteAuditTrail();
    private final ConcurrentMap<String, VotingSession> sessions = new ConcurrentHashMap<>();

    public VotingEngine(Clock clock, ScheduledExecutorService scheduler, Random random,
                        String signingSecret, VotingBroadcaster broadcaster) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
        this.random = random == null ? new Random() : random;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.broadcaster = broadcaster;
    }

    public String initiateVote(VotingConfig config) {
        validate(config);
        long now = clock.millis();
        long deadline = config.deadline() == null ? now + VotingConfig.DEFAULT_DURATION_MS : config.deadline();
        String sessionId = UUID.randomUUID().toString();
        VotingSession session = new VotingSession(sessionId, config, now, deadline);
        sessions.put(sessionId, session);
        auditTrail.register(sessionId);
        LOG.info("Opened voting session {} on '{}' ({}, {} options, deadline {})",
                sessionId, config.topic(), config.effectiveAlgorithm().wireName(), config.options().size(), deadline);

        if (broadcaster != null && broadcaster.isAvailable()) {
            try {
                broadcaster.announce(session.view());
            } catch (RuntimeException e) {
                // votes can still arrive through the results queue
                LOG.warn("Failed to announce voting session {}: {}", sessionId, e.getMessage(), e);
            }
        }

        long delay = deadline - now;
        if (scheduler != null && delay > 0) {
            ScheduledFuture<?> future = scheduler.schedule(() -> autoClose(sessionId), delay, TimeUnit.MILLISECONDS);
            session.autoClose(future);
        }
        return sessionId;
    }

    /**
     * Records or replaces the ballot of {@code agentId}. Returns the stored record.
     */
    public VoteRecord castVote(String sessionId, String agentId, Ballot ballot) {
        VotingSession session = require(sessionId);
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        validateBallot(session, ballot);
        long now = clock.millis();
        if (now > session.deadline()) {
            closeVoting(sessionId);
            throw new SessionClosedException(sessionId, "deadline passed");
        }
        synchronized (session) {
            if (!session.isOpen()) {
                throw new SessionClosedException(sessionId, "already closed");
            }
            VoteRecord record = VoteRecord.signed(sessionId, agentId, ballot, now, signingSecret);
            session.upsert(record);
            auditTrail.append(record);
            LOG.debug("Vote from {} recorded in session {}", agentId, sessionId);
            return record;
        }
    }

    /**
     * Closes the session and computes its result. Later calls return the stored result.
     */
    public VotingResult closeVoting(String sessionId) {
        VotingSession session = require(sessionId);
        VotingResult result;
        synchronized (session) {
            if (!session.isOpen()) {
                return session.result();
            }
            List<VoteRecord> votes = session.votesInCastOrder();
            VotingConfig config = session.config();
            long now = clock.millis();
            QuorumValidation quorum = QuorumValidation.evaluate(config.effectiveQuorum(), votes, config.totalAgents());
            String auditHash = auditTrail.headHash(sessionId);
            AlgorithmType algorithm = config.effectiveAlgorithm();
            if (!quorum.met()) {
                result = VotingResult.quorumNotMet(sessionId, algorithm, votes.size(), quorum, auditHash, now);
            } else {
                TallyContext context = new TallyContext(
                        config.options(),
                        config.effectiveConsensusThreshold(),
                        config.effectiveTokensPerAgent(),
                        random
                );
                TallyResult tally = VotingAlgorithm.forType(algorithm).tally(votes, context);
                result = VotingResult.success(sessionId, algorithm, tally, votes.size(), quorum, auditHash, now);
            }
            session.close(result);
        }
        if (result.succeeded()) {
            LOG.info("Closed voting session {}: winner {} ({} votes)", sessionId, result.winner(), result.totalVotes());
        } else {
            LOG.info("Closed voting session {} without quorum: {}", sessionId, result.quorum().failures());
        }
        if (broadcaster != null && broadcaster.isAvailable()) {
            try {
                broadcaster.publishResult(result);
            } catch (RuntimeException e) {
                LOG.warn("Failed to publish results of session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Recomputes the audit chain and every live vote's signature, and checks that each
     * live vote is the latest one the chain recorded for its agent.
     */
    public boolean verifyIntegrity(String sessionId) {
        VotingSession session = sessions.get(sessionId);
        if (session == null || !auditTrail.verify(sessionId)) {
            return false;
        }
        Map<String, String> chained = auditTrail.latestVotes(sessionId);
        List<VoteRecord> live = session.votesInCastOrder();
        if (chained.size() != live.size()) {
            return false;
        }
        for (VoteRecord vote : live) {
            if (!vote.signatureValid(signingSecret) || !vote.canonicalJson().equals(chained.get(vote.agentId()))) {
                return false;
            }
        }
        return true;
    }

    public SessionResults getSessionResults(String sessionId) {
        VotingSession session = require(sessionId);
        return new SessionResults(
                session.view(),
                session.result(),
                session.votesInCastOrder(),
                auditTrail.entries(sessionId),
                auditTrail.headHash(sessionId),
                verifyIntegrity(sessionId)
        );
    }

    public List<SessionView> getActiveSessions() {
        List<SessionView> open = new ArrayList<>();
        for (VotingSession session : sessions.values()) {
            if (session.isOpen()) {
                open.add(session.view());
            }
        }
        open.sort((left, right) -> Long.compare(left.initiatedAt(), right.initiatedAt()));
        return open;
    }

    public boolean shouldAbstain(double confidence) {
        return shouldAbstain(confidence, DEFAULT_ABSTENTION_THRESHOLD);
    }

    public boolean shouldAbstain(double confidence, double threshold) {
        return confidence < threshold;
    }

    VotingSession session(String sessionId) {
        return sessions.get(sessionId);
    }

    VoteAuditTrail auditTrail() {
        return auditTrail;
    }

    private void autoClose(String sessionId) {
        try {
            closeVoting(sessionId);
        } catch (RuntimeException e) {
            LOG.error("Automatic close of session {} failed", sessionId, e);
        }
    }

    private VotingSession require(String sessionId) {
        VotingSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private static void validate(VotingConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.topic() == null || config.topic().isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        if (config.question() == null || config.question().isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        List<String> options = config.options();
        if (options.size() < 2) {
            throw new IllegalArgumentException("at least two options are required");
        }
        Set<String> unique = new HashSet<>();
        for (String option : options) {
            if (option == null || option.isBlank()) {
                throw new IllegalArgumentException("options must not be blank");
            }
            if (!unique.add(option)) {
                throw new IllegalArgumentException("duplicate option: " + option);
            }
        }
        if (config.totalAgents() < 0) {
            throw new IllegalArgumentException("totalAgents must be >= 0");
        }
        double threshold = config.effectiveConsensusThreshold();
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("consensusThreshold must be within (0,1]");
        }
        if (config.effectiveTokensPerAgent() <= 0) {
            throw new IllegalArgumentException("tokensPerAgent must be > 0");
        }
    }

    private static void validateBallot(VotingSession session, Ballot ballot) {
        if (ballot == null) {
            throw new IllegalArgumentException("ballot is required");
        }
        if (ballot.confidence() != null
                && (ballot.confidence().isNaN() || ballot.confidence() < 0.0 || ballot.confidence() > 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0,1]");
        }
        if (ballot.agentLevel() != null && ballot.agentLevel() < 0) {
            throw new IllegalArgumentException("agentLevel must be >= 0");
        }
        List<String> options = session.config().options();
        if (session.algorithm() == AlgorithmType.QUADRATIC) {
            validateAllocation(ballot.allocation(), options, session.config().effectiveTokensPerAgent());
            return;
        }
        boolean hasChoice = ballot.choice() != null;
        boolean hasRanking = ballot.rankings() != null && !ballot.rankings().isEmpty();
        if (!hasChoice && !hasRanking) {
            throw new IllegalArgumentException("ballot needs a choice or a ranking");
        }
        if (hasChoice && !options.contains(ballot.choice())) {
            throw new IllegalArgumentException("unknown option: " + ballot.choice());
        }
        if (hasRanking) {
            Set<String> seen = new HashSet<>();
            for (String option : ballot.rankings()) {
                if (option == null || !options.contains(option)) {
                    throw new IllegalArgumentException("unknown option in ranking: " + option);
                }
                if (!seen.add(option)) {
                    throw new IllegalArgumentException("option ranked twice: " + option);
                }
            }
            if (hasChoice && !ballot.choice().equals(ballot.rankings().get(0))) {
                throw new IllegalArgumentException("choice must match the first ranking");
            }
        }
    }

    private static void validateAllocation(Map<String, Double> allocation, List<String> options, int budget) {
        if (allocation == null || allocation.isEmpty()) {
            throw new IllegalArgumentException("quadratic ballots need a token allocation");
        }
        double spent = 0.0;
        for (Map.Entry<String, Double> entry : allocation.entrySet()) {
            if (entry.getKey() == null || !options.contains(entry.getKey())) {
                throw new IllegalArgumentException("unknown option in allocation: " + entry.getKey());
            }
            Double tokens = entry.getValue();
            if (tokens == null || tokens.isNaN() || tokens.isInfinite() || tokens < 0.0) {
                throw new IllegalArgumentException("tokens for " + entry.getKey() + " must be >= 0");
            }
            spent += tokens;
        }
        if (spent > budget) {
            throw new IllegalArgumentException("allocation spends " + spent + " tokens, budget is " + budget);
        }
    }
}

package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.List;
import java.util.Map;

/**
 * Final outcome of a session. With {@link VotingStatus#QUORUM_NOT_MET} there is no
 * winner and the tally is empty, whatever the votes said.
 */
public record VotingResult(
        String sessionId,
        VotingStatus status,
        AlgorithmType algorithm,
        String winner,
        Map<String, Double> tally,
        double winnerShare,
        int totalVotes,
        QuorumValidation quorum,
        ConsensusDetail consensus,
        List<RankedChoiceRound> rounds,
        String tieBreakMethod,
        String auditHash,
        long calculatedAt
) {
    static VotingResult quorumNotMet(String sessionId, AlgorithmType algorithm, int totalVotes,
                                     QuorumValidation quorum, String auditHash, long calculatedAt) {
        return new VotingResult(sessionId, VotingStatus.QUORUM_NOT_MET, algorithm, null, Map.of(), 0.0,
                totalVotes, quorum, null, null, null, auditHash, calculatedAt);
    }

    static VotingResult success(String sessionId, AlgorithmType algorithm, TallyResult tally, int totalVotes,
                                QuorumValidation quorum, String auditHash, long calculatedAt) {
        return new VotingResult(sessionId, VotingStatus.SUCCESS, algorithm, tally.winner(), tally.tally(),
                tally.winnerShare(), totalVotes, quorum, tally.consensus(), tally.rounds(), tally.tieBreakMethod(),
                auditHash, calculatedAt);
    }

    public boolean succeeded() {
        return status == VotingStatus.SUCCESS;
    }
}

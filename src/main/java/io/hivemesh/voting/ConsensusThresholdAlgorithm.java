package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.List;
import java.util.Map;

/**
 * Simple-majority tally plus a supermajority check. The plurality winner is reported
 * even when consensus is not reached.
 */
public final class ConsensusThresholdAlgorithm implements VotingAlgorithm {
    @Override
    public AlgorithmType type() {
        return AlgorithmType.CONSENSUS;
    }

    @Override
    public TallyResult tally(List<VoteRecord> votes, TallyContext context) {
        Map<String, Double> tally = VotingAlgorithm.countPrimaryChoices(votes);
        String winner = VotingAlgorithm.leader(tally);
        double share = winner == null ? 0.0 : tally.get(winner) / votes.size();
        ConsensusDetail consensus = ConsensusDetail.evaluate(share, context.consensusThreshold());
        return new TallyResult(winner, winner == null ? Map.of() : tally, share, consensus, null, null);
    }
}

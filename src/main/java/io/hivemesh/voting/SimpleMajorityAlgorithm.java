package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.List;
import java.util.Map;

public final class SimpleMajorityAlgorithm implements VotingAlgorithm {
    @Override
    public AlgorithmType type() {
        return AlgorithmType.SIMPLE_MAJORITY;
    }

    @Override
    public TallyResult tally(List<VoteRecord> votes, TallyContext context) {
        Map<String, Double> tally = VotingAlgorithm.countPrimaryChoices(votes);
        String winner = VotingAlgorithm.leader(tally);
        if (winner == null) {
            return TallyResult.empty();
        }
        return TallyResult.plain(winner, tally, tally.get(winner) / votes.size());
    }
}

package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Each ballot weighs its confidence; a ballot without confidence weighs 1.0.
 */
public final class ConfidenceWeightedAlgorithm implements VotingAlgorithm {
    @Override
    public AlgorithmType type() {
        return AlgorithmType.CONFIDENCE_WEIGHTED;
    }

    @Override
    public TallyResult tally(List<VoteRecord> votes, TallyContext context) {
        Map<String, Double> tally = new LinkedHashMap<>();
        for (VoteRecord vote : votes) {
            String choice = vote.ballot().primaryChoice();
            if (choice != null) {
                tally.merge(choice, vote.ballot().effectiveConfidence(), Double::sum);
            }
        }
        String winner = VotingAlgorithm.leader(tally);
        if (winner == null) {
            return TallyResult.empty();
        }
        double total = VotingAlgorithm.sum(tally);
        return TallyResult.plain(winner, tally, total == 0.0 ? 0.0 : tally.get(winner) / total);
    }
}

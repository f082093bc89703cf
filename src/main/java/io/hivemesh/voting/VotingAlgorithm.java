package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the live votes of a closed session into a winner. Votes arrive in cast order
 * (an overwritten vote moves to the end); among equal maxima the option seen first
 * wins.
 */
public interface VotingAlgorithm {
    AlgorithmType type();

    TallyResult tally(List<VoteRecord> votes, TallyContext context);

    static VotingAlgorithm forType(AlgorithmType type) {
        return switch (type) {
            case SIMPLE_MAJORITY -> new SimpleMajorityAlgorithm();
            case CONFIDENCE_WEIGHTED -> new ConfidenceWeightedAlgorithm();
            case QUADRATIC -> new QuadraticAlgorithm();
            case CONSENSUS -> new ConsensusThresholdAlgorithm();
            case RANKED_CHOICE -> new RankedChoiceAlgorithm();
        };
    }

    /**
     * First key holding the maximum value, null for an empty map.
     */
    static String leader(Map<String, Double> tally) {
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : tally.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    static double sum(Map<String, Double> tally) {
        double total = 0.0;
        for (double value : tally.values()) {
            total += value;
        }
        return total;
    }

    static Map<String, Double> countPrimaryChoices(List<VoteRecord> votes) {
        Map<String, Double> tally = new LinkedHashMap<>();
        for (VoteRecord vote : votes) {
            String choice = vote.ballot().primaryChoice();
            if (choice != null) {
                tally.merge(choice, 1.0, Double::sum);
            }
        }
        return tally;
    }
}

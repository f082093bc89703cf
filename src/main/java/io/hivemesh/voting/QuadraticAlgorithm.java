package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weight of an option is the sum over voters of the square root of the tokens they put
 * on it. Spreading tokens buys more total weight than concentrating them.
 */
public final class QuadraticAlgorithm implements VotingAlgorithm {
    @Override
    public AlgorithmType type() {
        return AlgorithmType.QUADRATIC;
    }

    @Override
    public TallyResult tally(List<VoteRecord> votes, TallyContext context) {
        Map<String, Double> tally = new LinkedHashMap<>();
        for (VoteRecord vote : votes) {
            Map<String, Double> allocation = vote.ballot().allocation();
            if (allocation == null) {
                continue;
            }
            // allocation maps carry no order of their own
            for (Map.Entry<String, Double> entry : orderedAllocation(allocation, context.options()).entrySet()) {
                double tokens = entry.getValue() == null ? 0.0 : entry.getValue();
                if (tokens > 0.0) {
                    tally.merge(entry.getKey(), Math.sqrt(tokens), Double::sum);
                }
            }
        }
        String winner = VotingAlgorithm.leader(tally);
        if (winner == null) {
            return TallyResult.empty();
        }
        double total = VotingAlgorithm.sum(tally);
        return TallyResult.plain(winner, tally, tally.get(winner) / total);
    }

    private static Map<String, Double> orderedAllocation(Map<String, Double> allocation, List<String> options) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (String option : options) {
            if (allocation.containsKey(option)) {
                ordered.put(option, allocation.get(option));
            }
        }
        for (Map.Entry<String, Double> entry : new TreeMap<>(allocation).entrySet()) {
            ordered.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return ordered;
    }
}

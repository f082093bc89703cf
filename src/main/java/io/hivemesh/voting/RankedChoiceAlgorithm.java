package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Instant runoff. Each round counts every ballot for its highest-ranked option still
 * standing; a strict majority of the counted ballots wins, otherwise the weakest option
 * is eliminated. Ballots with nothing left standing drop out.
 *
 * <p>Ties for elimination go, in order, to the option whose supporters have the lowest
 * confidence sum, then the lowest agent-level sum, then the latest earliest ballot,
 * and finally to a random pick.
 */
public final class RankedChoiceAlgorithm implements VotingAlgorithm {
    static final String TIE_BREAK_CONFIDENCE = "confidence";
    static final String TIE_BREAK_AGENT_LEVEL = "agent_level";
    static final String TIE_BREAK_SUBMISSION_TIME = "submission_time";
    static final String TIE_BREAK_RANDOM = "random";
    private static final double EPSILON = 1e-9;

    @Override
    public AlgorithmType type() {
        return AlgorithmType.RANKED_CHOICE;
    }

    @Override
    public TallyResult tally(List<VoteRecord> votes, TallyContext context) {
        Set<String> eliminated = new LinkedHashSet<>();
        List<RankedChoiceRound> rounds = new ArrayList<>();
        String tieBreakUsed = null;
        int round = 1;
        while (true) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            Map<String, List<VoteRecord>> supporters = new LinkedHashMap<>();
            for (VoteRecord vote : votes) {
                String top = topPreference(vote, eliminated);
                if (top != null) {
                    counts.merge(top, 1, Integer::sum);
                    supporters.computeIfAbsent(top, ignored -> new ArrayList<>()).add(vote);
                }
            }
            List<String> alreadyOut = List.copyOf(eliminated);
            if (counts.isEmpty()) {
                rounds.add(new RankedChoiceRound(round, Map.of(), alreadyOut, null, null));
                return new TallyResult(null, Map.of(), 0.0, null, rounds, tieBreakUsed);
            }
            int total = 0;
            String leader = null;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                total += entry.getValue();
                if (leader == null || entry.getValue() > counts.get(leader)) {
                    leader = entry.getKey();
                }
            }
            if (counts.get(leader) * 2 > total) {
                rounds.add(new RankedChoiceRound(round, counts, alreadyOut, null, null));
                Map<String, Double> tally = new LinkedHashMap<>();
                counts.forEach((option, count) -> tally.put(option, count.doubleValue()));
                return new TallyResult(leader, tally, (double) counts.get(leader) / total, null, rounds, tieBreakUsed);
            }
            Elimination elimination = pickElimination(counts, supporters, context);
            rounds.add(new RankedChoiceRound(round, counts, alreadyOut, elimination.option(), elimination.tieBreak()));
            eliminated.add(elimination.option());
            if (elimination.tieBreak() != null) {
                tieBreakUsed = elimination.tieBreak();
            }
            round++;
        }
    }

    private static String topPreference(VoteRecord vote, Set<String> eliminated) {
        for (String option : vote.ballot().preferenceOrder()) {
            if (!eliminated.contains(option)) {
                return option;
            }
        }
        return null;
    }

    private Elimination pickElimination(Map<String, Integer> counts, Map<String, List<VoteRecord>> supporters,
                                        TallyContext context) {
        int fewest = Integer.MAX_VALUE;
        for (int count : counts.values()) {
            fewest = Math.min(fewest, count);
        }
        List<String> tied = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == fewest) {
                tied.add(entry.getKey());
            }
        }
        if (tied.size() == 1) {
            return new Elimination(tied.get(0), null);
        }

        tied = lowest(tied, option -> sum(supporters.get(option), vote -> vote.ballot().effectiveConfidence()));
        if (tied.size() == 1) {
            return new Elimination(tied.get(0), TIE_BREAK_CONFIDENCE);
        }
        tied = lowest(tied, option -> sum(supporters.get(option), vote -> vote.ballot().effectiveLevel()));
        if (tied.size() == 1) {
            return new Elimination(tied.get(0), TIE_BREAK_AGENT_LEVEL);
        }
        // latest earliest ballot goes first, so negate to reuse lowest()
        tied = lowest(tied, option -> -earliest(supporters.get(option)));
        if (tied.size() == 1) {
            return new Elimination(tied.get(0), TIE_BREAK_SUBMISSION_TIME);
        }
        return new Elimination(tied.get(context.random().nextInt(tied.size())), TIE_BREAK_RANDOM);
    }

    private static List<String> lowest(List<String> candidates, ToDoubleFunction<String> score) {
        double min = Double.POSITIVE_INFINITY;
        for (String candidate : candidates) {
            min = Math.min(min, score.applyAsDouble(candidate));
        }
        List<String> out = new ArrayList<>();
        for (String candidate : candidates) {
            if (Math.abs(score.applyAsDouble(candidate) - min) < EPSILON) {
                out.add(candidate);
            }
        }
        return out;
    }

    private static double sum(List<VoteRecord> votes, ToDoubleFunction<VoteRecord> value) {
        double total = 0.0;
        for (VoteRecord vote : votes) {
            total += value.applyAsDouble(vote);
        }
        return total;
    }

    private static double earliest(List<VoteRecord> votes) {
        long earliest = Long.MAX_VALUE;
        for (VoteRecord vote : votes) {
            earliest = Math.min(earliest, vote.timestamp());
        }
        return earliest;
    }

    private record Elimination(String option, String tieBreak) {
    }
}

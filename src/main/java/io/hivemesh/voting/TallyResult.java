package io.hivemesh.voting;

import java.util.List;
import java.util.Map;

public record TallyResult(
        String winner,
        Map<String, Double> tally,
        double winnerShare,
        ConsensusDetail consensus,
        List<RankedChoiceRound> rounds,
        String tieBreakMethod
) {
    public static TallyResult empty() {
        return new TallyResult(null, Map.of(), 0.0, null, null, null);
    }

    public static TallyResult plain(String winner, Map<String, Double> tally, double winnerShare) {
        return new TallyResult(winner, tally, winnerShare, null, null, null);
    }
}

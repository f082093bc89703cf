package io.hivemesh.voting;

import java.util.List;
import java.util.Map;

/**
 * @param tally      first preferences among options still standing
 * @param eliminated option removed after this round, null for the deciding round
 * @param tieBreak   how the elimination tie was settled, null when there was none
 */
public record RankedChoiceRound(int round, Map<String, Integer> tally, List<String> previouslyEliminated,
                                String eliminated, String tieBreak) {
}

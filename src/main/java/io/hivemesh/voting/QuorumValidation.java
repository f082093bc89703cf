package io.hivemesh.voting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public record QuorumValidation(
        boolean met,
        boolean participationMet,
        boolean confidenceMet,
        boolean expertsMet,
        int votes,
        int totalAgents,
        double participationRate,
        double meanConfidence,
        int expertVotes,
        List<String> failures
) {
    public QuorumValidation {
        failures = List.copyOf(failures);
    }

    /**
     * All three checks must pass. A session without any vote never meets quorum, even
     * when {@code totalAgents} is zero.
     */
    public static QuorumValidation evaluate(QuorumRequirements requirements, Collection<VoteRecord> votes, int totalAgents) {
        int count = votes.size();
        double rate = totalAgents > 0 ? (double) count / totalAgents : 0.0;
        // the rate, not minParticipation * totalAgents, which overshoots exact boundaries
        boolean participationMet = count > 0 && (totalAgents <= 0 || rate >= requirements.minParticipation());

        double confidenceSum = 0.0;
        int experts = 0;
        for (VoteRecord vote : votes) {
            confidenceSum += vote.ballot().effectiveConfidence();
            if (vote.ballot().effectiveLevel() >= requirements.expertLevel()) {
                experts++;
            }
        }
        double meanConfidence = count == 0 ? 0.0 : confidenceSum / count;
        boolean confidenceMet = meanConfidence >= requirements.minConfidence();
        boolean expertsMet = experts >= requirements.minExperts();

        List<String> failures = new ArrayList<>();
        if (!participationMet) {
            failures.add("participation " + count + "/" + totalAgents
                    + " below required " + requirements.minParticipation());
        }
        if (!confidenceMet) {
            failures.add("mean confidence " + meanConfidence + " below " + requirements.minConfidence());
        }
        if (!expertsMet) {
            failures.add("expert votes " + experts + " below " + requirements.minExperts());
        }
        return new QuorumValidation(
                participationMet && confidenceMet && expertsMet,
                participationMet,
                confidenceMet,
                expertsMet,
                count,
                totalAgents,
                rate,
                meanConfidence,
                experts,
                failures
        );
    }
}

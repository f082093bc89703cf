package io.hivemesh.voting;

/**
 * Thresholds a session must clear before its tally counts.
 *
 * @param minParticipation fraction of {@code totalAgents} that must vote
 * @param minConfidence    floor for the mean ballot confidence
 * @param minExperts       number of voters at or above {@code expertLevel}
 * @param expertLevel      agent level that counts as expert
 */
public record QuorumRequirements(double minParticipation, double minConfidence, int minExperts, int expertLevel) {
    public static final double DEFAULT_MIN_PARTICIPATION = 0.5;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.0;
    public static final int DEFAULT_MIN_EXPERTS = 0;
    public static final int DEFAULT_EXPERT_LEVEL = 4;

    public QuorumRequirements {
        if (minParticipation < 0.0 || minParticipation > 1.0) {
            throw new IllegalArgumentException("minParticipation must be within [0,1]");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be within [0,1]");
        }
        if (minExperts < 0) {
            throw new IllegalArgumentException("minExperts must be >= 0");
        }
        if (expertLevel < 0) {
            throw new IllegalArgumentException("expertLevel must be >= 0");
        }
    }

    public static QuorumRequirements defaults() {
        return new QuorumRequirements(DEFAULT_MIN_PARTICIPATION, DEFAULT_MIN_CONFIDENCE,
                DEFAULT_MIN_EXPERTS, DEFAULT_EXPERT_LEVEL);
    }
}

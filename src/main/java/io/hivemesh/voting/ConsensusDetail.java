package io.hivemesh.voting;

public record ConsensusDetail(ConsensusOutcome outcome, boolean consensusReached, double requiredThreshold, double share) {
    public static ConsensusDetail evaluate(double share, double threshold) {
        boolean reached = share >= threshold;
        return new ConsensusDetail(
                reached ? ConsensusOutcome.CONSENSUS_ACHIEVED : ConsensusOutcome.NO_CONSENSUS,
                reached,
                threshold,
                share
        );
    }
}

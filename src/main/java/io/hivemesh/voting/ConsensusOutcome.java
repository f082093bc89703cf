package io.hivemesh.voting;

public enum ConsensusOutcome {
    CONSENSUS_ACHIEVED,
    NO_CONSENSUS
}

package io.hivemesh.voting;

public enum VotingStatus {
    SUCCESS,
    QUORUM_NOT_MET
}

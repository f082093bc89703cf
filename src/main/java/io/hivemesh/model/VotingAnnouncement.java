package io.hivemesh.model;

import java.util.List;

public record VotingAnnouncement(
        List<String> options,
        AlgorithmType algorithm,
        long deadline,
        Integer tokensPerAgent
) {
}

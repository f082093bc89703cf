package io.hivemesh.voting;

import java.util.List;
import java.util.Random;

public record TallyContext(List<String> options, double consensusThreshold, int tokensPerAgent, Random random) {
}

package io.hivemesh.voting;

import io.hivemesh.model.AlgorithmType;

import java.util.List;

/**
 * Parameters for a new session. Null optional fields take the engine defaults.
 */
public record VotingConfig(
        String topic,
        String question,
        List<String> options,
        AlgorithmType algorithm,
        int totalAgents,
        QuorumRequirements quorum,
        Long deadline,
        Double consensusThreshold,
        Integer tokensPerAgent,
        String initiatedBy
) {
    public static final long DEFAULT_DURATION_MS = 300_000L;
    public static final double DEFAULT_CONSENSUS_THRESHOLD = 0.75;
    public static final int DEFAULT_TOKENS_PER_AGENT = 100;

    public VotingConfig {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static VotingConfig of(String topic, String question, List<String> options,
                                  AlgorithmType algorithm, int totalAgents) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, null, null, null, null, null);
    }

    public VotingConfig withQuorum(QuorumRequirements value) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, value, deadline,
                consensusThreshold, tokensPerAgent, initiatedBy);
    }

    public VotingConfig withDeadline(long epochMillis) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, quorum, epochMillis,
                consensusThreshold, tokensPerAgent, initiatedBy);
    }

    public VotingConfig withConsensusThreshold(double value) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, quorum, deadline,
                value, tokensPerAgent, initiatedBy);
    }

    public VotingConfig withTokensPerAgent(int value) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, quorum, deadline,
                consensusThreshold, value, initiatedBy);
    }

    public VotingConfig withInitiatedBy(String value) {
        return new VotingConfig(topic, question, options, algorithm, totalAgents, quorum, deadline,
                consensusThreshold, tokensPerAgent, value);
    }

    public AlgorithmType effectiveAlgorithm() {
        return algorithm == null ? AlgorithmType.SIMPLE_MAJORITY : algorithm;
    }

    public QuorumRequirements effectiveQuorum() {
        return quorum == null ? QuorumRequirements.defaults() : quorum;
    }

    public double effectiveConsensusThreshold() {
        return consensusThreshold == null ? DEFAULT_CONSENSUS_THRESHOLD : consensusThreshold;
    }

    public int effectiveTokensPerAgent() {
        return tokensPerAgent == null ? DEFAULT_TOKENS_PER_AGENT : tokensPerAgent;
    }
}

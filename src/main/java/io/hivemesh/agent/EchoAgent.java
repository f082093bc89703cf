package io.hivemesh.agent;

import io.hivemesh.model.AlgorithmType;
import io.hivemesh.model.Ballot;
import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.VotingAnnouncement;
import io.hivemesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reflects the task back as its result. Votes for the first listed option.
 */
public final class EchoAgent implements Agent {
    private final String agentId;
    private final int level;

    public EchoAgent(String agentId, int level) {
        this.agentId = agentId;
        this.level = level;
    }

    @Override
    public String id() {
        return "echo";
    }

    @Override
    public AgentResult execute(AgentContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("agent", agentId);
        output.put("taskId", context.taskId());
        output.put("title", context.title());
        output.put("description", context.description());
        output.put("priority", context.priority() == null ? null : context.priority().wireName());
        output.put("suggestions", context.suggestions());
        return AgentResult.ok(Jsons.toCompactJson(output));
    }

    @Override
    public String suggest(BrainstormPayload request) {
        return agentId + " suggests looking at: " + request.question();
    }

    @Override
    public Optional<Ballot> deliberate(BrainstormPayload announcement) {
        VotingAnnouncement voting = announcement.voting();
        if (voting == null || voting.options() == null || voting.options().isEmpty()) {
            return Optional.empty();
        }
        List<String> options = voting.options();
        AlgorithmType algorithm = voting.algorithm() == null ? AlgorithmType.SIMPLE_MAJORITY : voting.algorithm();
        switch (algorithm) {
            case QUADRATIC:
                double tokens = voting.tokensPerAgent() == null ? 100.0 : voting.tokensPerAgent();
                return Optional.of(Ballot.allocation(Map.of(options.get(0), tokens), 0.5, level));
            case RANKED_CHOICE:
                return Optional.of(Ballot.ranked(options, 0.5, level));
            default:
                return Optional.of(Ballot.choice(options.get(0), 0.5, level));
        }
    }
}

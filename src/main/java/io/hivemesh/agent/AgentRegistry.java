package io.hivemesh.agent;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task logic selectable by name from the command line.
 */
public final class AgentRegistry {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public static AgentRegistry builtIn(String agentId, int level) {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new EchoAgent(agentId, level));
        registry.register(new FailAgent());
        return registry;
    }

    public void register(Agent agent) {
        agents.put(agent.id(), agent);
    }

    public Optional<Agent> findById(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public Agent require(String name) {
        return findById(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown agent logic '" + name + "', known: " + listAgentIds()));
    }

    public Collection<String> listAgentIds() {
        return List.copyOf(agents.keySet());
    }
}

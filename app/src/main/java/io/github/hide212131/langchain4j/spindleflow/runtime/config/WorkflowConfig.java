package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated workflow descriptor: the agents, the topology that orders them and run-wide settings.
 *
 * @param maxContextItems upper bound on summaries shown to an agent, {@code 0} to show all of them
 */
public record WorkflowConfig(
        List<AgentDefinition> agents,
        WorkflowTopology topology,
        int maxContextItems,
        MemorySettings memory) {

    public WorkflowConfig {
        agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
        Objects.requireNonNull(topology, "topology");
        memory = memory == null ? MemorySettings.disabled() : memory;
    }

    public WorkflowConfig(List<AgentDefinition> agents, WorkflowTopology topology) {
        this(agents, topology, 0, MemorySettings.disabled());
    }

    public Optional<AgentDefinition> agent(String id) {
        return agents.stream().filter(agent -> agent.id().equals(id)).findFirst();
    }

    public AgentDefinition requireAgent(String id) {
        return agent(id).orElseThrow(() -> new IllegalStateException(
                "Agent '" + id + "' is not declared; available agents: " + agentIds()));
    }

    public List<String> agentIds() {
        return agents.stream().map(AgentDefinition::id).toList();
    }

    public Map<String, AgentDefinition> agentsById() {
        Map<String, AgentDefinition> byId = new LinkedHashMap<>();
        agents.forEach(agent -> byId.put(agent.id(), agent));
        return byId;
    }
}

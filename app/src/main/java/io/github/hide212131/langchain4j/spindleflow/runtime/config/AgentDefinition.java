package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable agent declaration: identity, instructions, tools and optional sub-agents.
 */
public record AgentDefinition(
        String id,
        String role,
        String goal,
        List<String> tools,
        List<SubAgentDefinition> subAgents,
        DelegationStrategy delegationStrategy,
        boolean persistentMemoryEnabled) {

    public AgentDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(goal, "goal");
        tools = tools == null ? List.of() : List.copyOf(tools);
        subAgents = subAgents == null ? List.of() : List.copyOf(subAgents);
        delegationStrategy = delegationStrategy == null ? DelegationStrategy.AUTO : delegationStrategy;
    }

    public static AgentDefinition of(String id, String role, String goal) {
        return new AgentDefinition(id, role, goal, List.of(), List.of(), DelegationStrategy.AUTO, false);
    }

    public boolean delegates() {
        return !subAgents.isEmpty();
    }

    public Optional<SubAgentDefinition> subAgent(String subAgentId) {
        return subAgents.stream().filter(sub -> sub.id().equals(subAgentId)).findFirst();
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.List;
import java.util.Objects;

/**
 * A delegate of a parent agent. Specialization and trigger phrases only inform the auto planner.
 */
public record SubAgentDefinition(
        String id,
        String role,
        String goal,
        List<String> tools,
        String specialization,
        List<String> triggerConditions) {

    public SubAgentDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(goal, "goal");
        tools = tools == null ? List.of() : List.copyOf(tools);
        triggerConditions = triggerConditions == null ? List.of() : List.copyOf(triggerConditions);
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic checks over a structurally valid configuration. Returns every problem found rather than
 * stopping at the first one.
 */
public final class WorkflowConfigValidator {

    public List<String> validate(WorkflowConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.agents().isEmpty()) {
            errors.add("At least one agent must be declared");
        }
        Set<String> declared = new HashSet<>();
        for (AgentDefinition agent : config.agents()) {
            if (!declared.add(agent.id())) {
                errors.add("Duplicate agent id '" + agent.id() + "'");
            }
            Set<String> subIds = new HashSet<>();
            for (SubAgentDefinition sub : agent.subAgents()) {
                if (!subIds.add(sub.id())) {
                    errors.add("Duplicate sub-agent id '" + sub.id() + "' under agent '" + agent.id() + "'");
                }
            }
        }
        String available = String.join(", ", config.agentIds());

        WorkflowTopology topology = config.topology();
        if (topology instanceof WorkflowTopology.Sequential sequential) {
            if (sequential.steps().isEmpty()) {
                errors.add("A sequential workflow needs at least one step");
            }
        } else if (topology instanceof WorkflowTopology.Parallel parallel) {
            validateParallel(parallel, declared, available, errors);
        }
        for (String reference : topology.referencedAgents()) {
            if (!declared.contains(reference)) {
                errors.add("Workflow references unknown agent '" + reference + "' (available: " + available + ")");
            }
        }
        if (config.maxContextItems() < 0) {
            errors.add("context.max_items must not be negative");
        }
        return List.copyOf(errors);
    }

    /** Validates and throws when any problem is found. */
    public void requireValid(WorkflowConfig config) {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new WorkflowConfigurationException(
                    "Invalid workflow configuration:\n  - " + String.join("\n  - ", errors), List.of());
        }
    }

    private static void validateParallel(
            WorkflowTopology.Parallel parallel, Set<String> declared, String available, List<String> errors) {
        if (parallel.branches().isEmpty()) {
            errors.add("A parallel workflow needs at least one branch");
        }
        if (parallel.branches().contains(parallel.aggregator())) {
            errors.add("Aggregator '" + parallel.aggregator() + "' must not also be a branch");
        }
        Set<String> seen = new HashSet<>();
        for (String branch : parallel.branches()) {
            if (!seen.add(branch)) {
                errors.add("Branch '" + branch + "' is listed more than once");
            }
        }
        FeedbackLoopSettings loop = parallel.feedbackLoop();
        if (loop == null || !loop.enabled()) {
            return;
        }
        if (loop.maxIterations() < FeedbackLoopSettings.MIN_ITERATIONS
                || loop.maxIterations() > FeedbackLoopSettings.MAX_ITERATIONS) {
            errors.add("feedback_loop.max_iterations must be between " + FeedbackLoopSettings.MIN_ITERATIONS
                    + " and " + FeedbackLoopSettings.MAX_ITERATIONS + " (was " + loop.maxIterations() + ")");
        }
        if (loop.approvalKeyword().isBlank()) {
            errors.add("feedback_loop.approval_keyword must not be blank");
        }
        if (loop.feedbackTargets().isEmpty()) {
            errors.add("feedback_loop.feedback_targets needs at least one agent");
        }
        Set<String> seenTargets = new HashSet<>();
        for (String target : loop.feedbackTargets()) {
            if (!seenTargets.add(target)) {
                errors.add("Feedback target '" + target + "' is listed more than once");
            }
            if (!declared.contains(target)) {
                errors.add("Feedback target '" + target + "' is not a declared agent (available: " + available + ")");
            }
        }
    }
}

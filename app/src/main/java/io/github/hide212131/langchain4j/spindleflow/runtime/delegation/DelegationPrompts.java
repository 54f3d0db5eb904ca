package io.github.hide212131.langchain4j.spindleflow.runtime.delegation;

import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.SubAgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.Prompt;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

final class DelegationPrompts {

    private DelegationPrompts() {
    }

    static Prompt planning(AgentDefinition parent, String userInput, List<ContextSummary> summaries) {
        String subAgents = parent.subAgents().stream()
                .map(sub -> "- " + sub.id() + " (" + sub.role() + ")\n"
                        + "  Goal: " + sub.goal() + "\n"
                        + "  Specialization: " + orDefault(sub.specialization(), "General") + "\n"
                        + "  Triggers: " + (sub.triggerConditions().isEmpty()
                                ? "Any"
                                : String.join(", ", sub.triggerConditions())))
                .collect(Collectors.joining("\n"));
        String system = """
                You are %s, a team lead with specialized sub-agents.

                Your goal: %s

                Available sub-agents:
                %s

                Your task: Analyze the user's request and determine:
                1. Which sub-agents should be involved
                2. In what order (sequential or parallel)
                3. Why each sub-agent is needed

                Respond with a JSON plan:
                {
                  "sub_agents": ["id1", "id2", ...],
                  "sequence": "sequential" or "parallel",
                  "reason": "explanation"
                }""".formatted(parent.role(), parent.goal(), subAgents);
        String user = """
                User Request: %s

                Previous Context:
                %s

                Create an execution plan for your sub-agents.""".formatted(userInput, previousContext(summaries));
        return new Prompt(system, user);
    }

    static Prompt subAgent(
            SubAgentDefinition sub,
            AgentDefinition parent,
            String userInput,
            List<ContextSummary> summaries,
            Map<String, String> previousSubOutputs,
            String toolOutputs,
            List<RelevantMemory> memories) {
        String system = """
                You are %s, working as part of %s's team.

                Your specialization: %s

                Your specific goal: %s

                IMPORTANT:
                - Focus only on your specialization
                - Provide detailed, high-quality output
                - Build on previous sub-agents' work if available""".formatted(
                sub.role(), parent.role(), orDefault(sub.specialization(), "General tasks"), sub.goal());

        StringBuilder user = new StringBuilder()
                .append("Original Request: ").append(userInput).append("\n\n")
                .append("Parent Agent Goal: ").append(parent.goal()).append('\n');
        if (!summaries.isEmpty()) {
            user.append("\nPrevious Context:\n").append(previousContext(summaries)).append('\n');
        }
        if (toolOutputs != null && !toolOutputs.isBlank()) {
            user.append("\n\nTool Outputs:\n").append(toolOutputs);
        }
        if (!previousSubOutputs.isEmpty()) {
            user.append("\n\nPrevious Sub-Agent Work:\n");
            previousSubOutputs.forEach((id, output) ->
                    user.append("\n--- ").append(id).append(" ---\n").append(output).append('\n'));
        }
        if (!memories.isEmpty()) {
            user.append("\n\nRelevant Past Context from Other Workflows:\n");
            for (RelevantMemory memory : memories) {
                user.append("\n[").append(memory.role()).append("] (relevance: ")
                        .append(String.format(Locale.ROOT, "%.1f", memory.score() * 100)).append("%)");
                if (!memory.keyInsights().isEmpty()) {
                    user.append("\nKey Insights: ").append(String.join("; ", memory.keyInsights()));
                }
                if (!memory.decisions().isEmpty()) {
                    user.append("\nDecisions: ").append(String.join("; ", memory.decisions()));
                }
                user.append('\n');
            }
        }
        user.append("\n\nProvide your ").append(sub.role()).append(" contribution.");
        return new Prompt(system, user.toString());
    }

    static Prompt synthesis(AgentDefinition parent, String userInput, Map<String, String> subOutputs) {
        String system = """
                You are %s.

                Your goal: %s

                Your sub-agents have completed their specialized work.
                Now synthesize their outputs into a cohesive final deliverable.

                IMPORTANT:
                - Integrate all sub-agent contributions
                - Ensure consistency and quality
                - Provide a complete, unified solution""".formatted(parent.role(), parent.goal());
        StringBuilder user = new StringBuilder("Original Request: ").append(userInput)
                .append("\n\nSub-Agent Contributions:\n");
        subOutputs.forEach((id, output) -> {
            String role = parent.subAgent(id).map(SubAgentDefinition::role).orElse(id);
            user.append("\n--- ").append(role).append(" ---\n").append(output).append('\n');
        });
        user.append("\n\nProvide the final integrated solution.");
        return new Prompt(system, user.toString());
    }

    private static String previousContext(List<ContextSummary> summaries) {
        if (summaries.isEmpty()) {
            return "No previous context";
        }
        return summaries.stream()
                .map(summary -> summary.role() + ": "
                        + (summary.keyInsights().isEmpty() ? "No insights" : String.join(", ", summary.keyInsights())))
                .collect(Collectors.joining("\n"));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.prompt;

import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import java.util.List;

/**
 * Builds the prompt for an ordinary agent turn: the agent's role and goal as system message, then the
 * user input, past-run memories, tool output and summaries of earlier agents.
 */
public final class PromptBuilder {

    static final int MEMORY_EXCERPT_LENGTH = 500;

    private PromptBuilder() {
    }

    public static Prompt agentTurn(
            AgentDefinition agent,
            String userInput,
            List<ContextSummary> summaries,
            String toolOutputs,
            List<RelevantMemory> memories) {
        String system = """
                You are acting as: %s

                Your goal:
                %s

                Follow the goal strictly. Be concise, clear, and relevant.""".formatted(agent.role(), agent.goal());

        StringBuilder user = new StringBuilder("User input:\n").append(userInput).append('\n');
        if (memories != null && !memories.isEmpty()) {
            user.append('\n').append(memories(memories));
        }
        if (toolOutputs != null && !toolOutputs.isBlank()) {
            user.append("\nTool Outputs:\n").append(toolOutputs).append('\n');
        }
        if (summaries != null && !summaries.isEmpty()) {
            user.append("\nPrevious agent work:\n");
            for (ContextSummary summary : summaries) {
                user.append(summaryBlock(summary));
            }
        }
        return new Prompt(system, user.toString().trim());
    }

    /** One summary as {@code [role]} followed by its populated lists and a {@code ---} separator. */
    public static String summaryBlock(ContextSummary summary) {
        StringBuilder block = new StringBuilder("\n[").append(summary.role()).append("]\n");
        appendList(block, "Key Insights", summary.keyInsights());
        appendList(block, "Decisions", summary.decisions());
        appendList(block, "Artifacts", summary.artifacts());
        appendList(block, "Next Steps", summary.nextSteps());
        return block.append("---\n").toString();
    }

    /** Renders memories from earlier runs with their relevance as a percentage. */
    public static String memories(List<RelevantMemory> memories) {
        StringBuilder text = new StringBuilder("--- RELEVANT CONTEXT FROM PAST WORKFLOWS ---\n");
        text.append("You have access to relevant insights from previous work:\n\n");
        for (int i = 0; i < memories.size(); i++) {
            RelevantMemory memory = memories.get(i);
            text.append("[Memory ").append(i + 1).append(" - ")
                    .append(Math.round(memory.score() * 100)).append("% relevant]\n");
            text.append("From: ").append(memory.role()).append(" (").append(memory.agentId()).append(")\n");
            text.append("Date: ").append(memory.timestamp() != null ? memory.timestamp().toString() : "Unknown").append('\n');
            appendList(text, "Key Insights", memory.keyInsights());
            appendList(text, "Decisions", memory.decisions());
            String content = memory.content();
            if (content.length() > MEMORY_EXCERPT_LENGTH) {
                text.append("Content (excerpt): ").append(content, 0, MEMORY_EXCERPT_LENGTH).append("...\n");
            } else if (!content.isEmpty()) {
                text.append("Content: ").append(content).append('\n');
            }
            text.append("---\n");
        }
        text.append("\nUse these insights to inform your current work.\n");
        text.append("--- END OF PAST WORKFLOW CONTEXT ---\n");
        return text.toString();
    }

    private static void appendList(StringBuilder target, String label, List<String> items) {
        if (!items.isEmpty()) {
            target.append(label).append(": ").append(String.join("; ", items)).append('\n');
        }
    }
}

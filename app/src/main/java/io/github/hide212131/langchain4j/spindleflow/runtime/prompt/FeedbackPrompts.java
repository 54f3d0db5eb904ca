package io.github.hide212131.langchain4j.spindleflow.runtime.prompt;

import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import java.util.List;

/** Prompts for the review and revision turns of a feedback loop. */
public final class FeedbackPrompts {

    private FeedbackPrompts() {
    }

    /** Output of one branch agent as shown to the reviewer. */
    public record ReviewedOutput(String agentId, String role, String output) {}

    public static Prompt review(
            AgentDefinition reviewer,
            String userInput,
            List<ReviewedOutput> outputs,
            int iteration,
            String approvalKeyword,
            String toolOutputs,
            List<RelevantMemory> memories) {
        String system = """
                You are acting as: %s

                Your goal:
                %s

                IMPORTANT REVIEW INSTRUCTIONS:
                1. Review the outputs from all agents carefully
                2. If everything is satisfactory and meets all requirements, respond with "%s" at the very start of your response
                3. If changes are needed, provide specific, actionable feedback for each agent
                4. Format your feedback clearly with agent names/roles followed by specific suggestions
                5. Be constructive and specific - point out what needs to change and why

                Iteration: %d
                %s""".formatted(
                reviewer.role(),
                reviewer.goal(),
                approvalKeyword,
                iteration,
                iteration > 1
                        ? "This is a revision. Check if previous feedback has been addressed."
                        : "This is the initial review.");

        StringBuilder user = new StringBuilder("User Request:\n").append(userInput).append("\n\n");
        if (memories != null && !memories.isEmpty()) {
            user.append("--- RELEVANT CONTEXT FROM PAST WORKFLOWS ---\n");
            for (int i = 0; i < memories.size(); i++) {
                RelevantMemory memory = memories.get(i);
                user.append("[Memory ").append(i + 1).append(" - ")
                        .append(Math.round(memory.score() * 100)).append("% relevant] ")
                        .append(memory.role()).append(":\n");
                if (!memory.keyInsights().isEmpty()) {
                    user.append("Insights: ").append(String.join("; ", memory.keyInsights())).append('\n');
                }
                if (!memory.decisions().isEmpty()) {
                    user.append("Decisions: ").append(String.join("; ", memory.decisions())).append('\n');
                }
            }
            user.append("--- END OF PAST CONTEXT ---\n\n");
        }
        if (toolOutputs != null && !toolOutputs.isBlank()) {
            user.append("Tool Outputs:\n").append(toolOutputs).append("\n\n");
        }
        user.append("Agent Outputs to Review:\n\n");
        for (ReviewedOutput output : outputs) {
            user.append("--- ").append(output.role()).append(" (").append(output.agentId()).append(") ---\n");
            user.append(output.output()).append("\n\n");
        }
        if (iteration > 1) {
            user.append("\nThis is revision iteration ").append(iteration)
                    .append(". Please check if your previous feedback has been adequately addressed.\n");
        }
        return new Prompt(system, user.toString());
    }

    public static Prompt revision(
            AgentDefinition agent, String userInput, String previousOutput, String feedback, int iteration) {
        String system = """
                You are acting as: %s

                Your goal:
                %s

                IMPORTANT REVISION INSTRUCTIONS:
                - You are revising your previous work based on reviewer feedback
                - Carefully incorporate ALL the feedback provided
                - Maintain the good aspects of your previous output
                - Address ALL concerns raised by the reviewer
                - Improve quality and completeness

                Revision Iteration: %d""".formatted(agent.role(), agent.goal(), iteration);
        String user = """
                Original Request:
                %s

                Your Previous Output:
                %s

                Reviewer Feedback for You:
                %s

                Please revise your output to fully address the reviewer's feedback while maintaining quality."""
                .formatted(userInput, previousOutput, feedback);
        return new Prompt(system, user);
    }
}

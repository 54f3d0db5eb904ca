package io.github.hide212131.langchain4j.spindleflow.runtime.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptBuilderTest {

    private static final AgentDefinition WRITER = AgentDefinition.of("writer", "Writer", "Write the article");

    @Test
    void agentTurn_shouldPlaceSectionsInOrder() {
        ContextSummary research = new ContextSummary("researcher", "Researcher",
                List.of("tea came from China"), List.of("focus on history"), List.of(), List.of("cite sources"), null);
        RelevantMemory memory = new RelevantMemory("writer", "Writer", "earlier draft", List.of("keep it short"),
                List.of(), Instant.parse("2026-01-05T00:00:00Z"), 0.874);

        Prompt prompt = PromptBuilder.agentTurn(
                WRITER, "history of tea", List.of(research), "[echo_input] succeeded in 1ms\nhistory of tea",
                List.of(memory));

        assertThat(prompt.system()).startsWith("You are acting as: Writer\n\nYour goal:\nWrite the article");
        assertThat(prompt.user())
                .startsWith("User input:\nhistory of tea")
                .containsSubsequence(
                        "--- RELEVANT CONTEXT FROM PAST WORKFLOWS ---",
                        "[Memory 1 - 87% relevant]",
                        "Tool Outputs:",
                        "Previous agent work:",
                        "[Researcher]",
                        "Key Insights: tea came from China",
                        "Decisions: focus on history",
                        "Next Steps: cite sources",
                        "---")
                .doesNotContain("Artifacts:");
    }

    @Test
    void agentTurn_withoutContext_shouldOnlyCarryInput() {
        Prompt prompt = PromptBuilder.agentTurn(WRITER, "hello", List.of(), "", List.of());

        assertThat(prompt.user()).isEqualTo("User input:\nhello");
    }

    @Test
    void memories_shouldExcerptLongContent() {
        String longContent = "z".repeat(PromptBuilder.MEMORY_EXCERPT_LENGTH + 20);
        RelevantMemory memory = new RelevantMemory("a", "A", longContent, List.of(), List.of(), null, 0.5);

        String text = PromptBuilder.memories(List.of(memory));

        assertThat(text)
                .contains("Date: Unknown")
                .contains("Content (excerpt): " + "z".repeat(PromptBuilder.MEMORY_EXCERPT_LENGTH) + "...")
                .endsWith("--- END OF PAST WORKFLOW CONTEXT ---\n");
    }

    @Test
    void review_shouldCarryKeywordIterationAndEveryOutput() {
        Prompt prompt = FeedbackPrompts.review(
                AgentDefinition.of("reviewer", "Reviewer", "Approve complete work"),
                "build a todo app",
                List.of(new FeedbackPrompts.ReviewedOutput("backend", "Backend Developer", "REST API"),
                        new FeedbackPrompts.ReviewedOutput("frontend", "Frontend Developer", "React UI")),
                2,
                "LGTM",
                "[echo_input] succeeded in 1ms\nbuild a todo app",
                List.of());

        assertThat(prompt.system()).contains("respond with \"LGTM\"", "Iteration: 2", "This is a revision.");
        assertThat(prompt.user()).containsSubsequence(
                "User Request:\nbuild a todo app",
                "Tool Outputs:\n[echo_input] succeeded in 1ms",
                "--- Backend Developer (backend) ---\nREST API",
                "--- Frontend Developer (frontend) ---\nReact UI",
                "This is revision iteration 2");
    }

    @Test
    void review_withoutToolOutputs_shouldOmitToolSection() {
        Prompt prompt = FeedbackPrompts.review(
                AgentDefinition.of("reviewer", "Reviewer", "Approve complete work"),
                "build a todo app",
                List.of(new FeedbackPrompts.ReviewedOutput("backend", "Backend Developer", "REST API")),
                1,
                "APPROVED",
                "",
                List.of());

        assertThat(prompt.user()).doesNotContain("Tool Outputs:");
    }

    @Test
    void revision_shouldQuotePreviousOutputAndFeedback() {
        Prompt prompt = FeedbackPrompts.revision(
                AgentDefinition.of("backend", "Backend Developer", "Design the API"),
                "build a todo app", "REST API v1", "add pagination", 1);

        assertThat(prompt.system()).contains("IMPORTANT REVISION INSTRUCTIONS", "Revision Iteration: 1");
        assertThat(prompt.user()).contains("Your Previous Output:\nREST API v1", "Reviewer Feedback for You:\nadd pagination");
    }
}

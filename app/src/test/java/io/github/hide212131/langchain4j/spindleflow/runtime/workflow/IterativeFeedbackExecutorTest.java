package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.DelegationStrategy;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.FeedbackLoopSettings;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.FakeChatModel;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.FakeChatModel.Exchange;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackIteration;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackOutcome;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunListener;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IterativeFeedbackExecutorTest {

    private static final String REVIEW = "IMPORTANT REVIEW INSTRUCTIONS";
    private static final String REVISION = "IMPORTANT REVISION INSTRUCTIONS";

    @Test
    void run_whenReviewerNeverApproves_shouldStopAtMaxIterationsWithoutTrailingRevision() {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains(REVIEW, "backend: add pagination\nfrontend: fix the layout")
                .whenSystemContains(REVISION, exchange -> "revised-" + exchange.actingAs())
                .otherwise(exchange -> "draft-" + exchange.actingAs());

        RunState state = run(model, config(2));

        assertThat(model.exchangesWhereSystemContains(REVIEW)).hasSize(2);
        assertThat(model.exchangesWhereSystemContains(REVISION)).hasSize(2);
        assertThat(state.feedbackOutcome()).contains(new FeedbackOutcome(false, 2));
        assertThat(state.revisions("backend")).containsOnlyKeys(1).containsEntry(1, "revised-Backend Developer");
        assertThat(state.revisions("frontend")).containsOnlyKeys(1);

        Exchange backendRevision = model.exchangesWhereSystemContains(REVISION).stream()
                .filter(exchange -> exchange.actingAs().equals("Backend Developer"))
                .findFirst()
                .orElseThrow();
        assertThat(backendRevision.user())
                .contains("Your Previous Output:\ndraft-Backend Developer")
                .contains("Reviewer Feedback for You:\nadd pagination")
                .doesNotContain("fix the layout");

        List<TimelineEntry> timeline = state.timeline();
        assertThat(timeline).extracting(TimelineEntry::agentId)
                .containsExactly("backend", "frontend", "reviewer", "backend", "frontend", "reviewer");
        assertThat(timeline).extracting(TimelineEntry::iteration).containsExactly(0, 0, 1, 1, 1, 2);
        assertThat(timeline).extracting(TimelineEntry::branchId)
                .containsExactly("parallel-1", "parallel-1", null, "revision-1", "revision-1", null);
        assertThat(timeline).filteredOn(TimelineEntry::aggregator).hasSize(1);
        assertThat(timeline.get(5).aggregator()).isTrue();
    }

    @Test
    void run_whenApprovedOnSecondReview_shouldReviewRevisedOutputs() {
        AtomicInteger reviews = new AtomicInteger();
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains(REVIEW, exchange -> reviews.incrementAndGet() == 1
                        ? "backend: add integration tests"
                        : "APPROVED: both designs are complete")
                .whenSystemContains(REVISION, exchange -> "revised-" + exchange.actingAs())
                .otherwise(exchange -> "draft-" + exchange.actingAs());

        RunState state = run(model, config(5));

        assertThat(state.feedbackOutcome()).contains(new FeedbackOutcome(true, 2));
        List<Exchange> reviewTurns = model.exchangesWhereSystemContains(REVIEW);
        assertThat(reviewTurns.get(0).user()).contains("draft-Backend Developer", "draft-Frontend Developer");
        assertThat(reviewTurns.get(1).user())
                .contains("revised-Backend Developer", "revised-Frontend Developer")
                .doesNotContain("draft-Backend Developer");
        assertThat(reviewTurns.get(1).system()).contains("Iteration: 2");

        Exchange frontendRevision = model.exchangesWhereSystemContains(REVISION).stream()
                .filter(exchange -> exchange.actingAs().equals("Frontend Developer"))
                .findFirst()
                .orElseThrow();
        assertThat(frontendRevision.user()).contains(IterativeFeedbackExecutor.DEFAULT_REVISION_FEEDBACK);
        assertThat(state.finalOutput()).contains("APPROVED: both designs are complete");
    }

    @Test
    void run_whenApprovedImmediately_shouldSkipRevisions() {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains(REVIEW, "APPROVED")
                .otherwise(exchange -> "draft-" + exchange.actingAs());

        RunState state = run(model, config(3));

        assertThat(model.exchangesWhereSystemContains(REVISION)).isEmpty();
        assertThat(state.feedbackOutcome()).contains(new FeedbackOutcome(true, 1));
        assertThat(state.timeline()).hasSize(3);
        assertThat(state.timeline().get(2).aggregator()).isTrue();
        assertThat(state.revisions("backend")).isEmpty();
    }

    @Test
    void run_shouldNotifyListenerOfTurnsAndReviewRounds() {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains(REVIEW, "frontend: tighten spacing")
                .otherwise(exchange -> "draft-" + exchange.actingAs());
        List<String> turns = new ArrayList<>();
        List<FeedbackIteration> rounds = new ArrayList<>();
        RunListener listener = new RunListener() {
            @Override
            public void onTurnCompleted(TimelineEntry entry) {
                turns.add(entry.agentId());
            }

            @Override
            public void onFeedbackIteration(FeedbackIteration iteration) {
                rounds.add(iteration);
            }
        };

        RunState state = run(model, config(2), listener);

        assertThat(turns).hasSize(state.timeline().size());
        assertThat(rounds).extracting(FeedbackIteration::iteration).containsExactly(1, 2);
        assertThat(rounds).noneMatch(FeedbackIteration::approved);
        assertThat(rounds.get(0).feedback()).containsEntry("frontend", "tighten spacing");
        assertThat(state.feedbackIterations()).isEqualTo(rounds);
    }

    @Test
    void run_whenReviewerDeclaresTools_shouldShowToolOutputsInReviewPrompt() {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains(REVIEW, "APPROVED")
                .otherwise(exchange -> "draft-" + exchange.actingAs());
        AgentDefinition reviewer = new AgentDefinition(
                "reviewer", "Reviewer", "Approve complete designs",
                List.of("previous_outputs"), List.of(), DelegationStrategy.AUTO, false);
        WorkflowConfig config = new WorkflowConfig(
                List.of(
                        AgentDefinition.of("backend", "Backend Developer", "Design the API"),
                        AgentDefinition.of("frontend", "Frontend Developer", "Design the UI"),
                        reviewer),
                new WorkflowTopology.Parallel(
                        List.of("backend", "frontend"),
                        "reviewer",
                        new FeedbackLoopSettings(true, 2, "APPROVED", List.of("backend", "frontend"))));

        run(model, config);

        assertThat(model.exchangesWhereSystemContains(REVIEW)).singleElement()
                .extracting(Exchange::user)
                .asString()
                .containsSubsequence(
                        "Tool Outputs:",
                        "[previous_outputs] succeeded",
                        "backend:\ndraft-Backend Developer",
                        "frontend:\ndraft-Frontend Developer",
                        "Agent Outputs to Review:");
    }

    private static WorkflowConfig config(int maxIterations) {
        return new WorkflowConfig(
                List.of(
                        AgentDefinition.of("backend", "Backend Developer", "Design the API"),
                        AgentDefinition.of("frontend", "Frontend Developer", "Design the UI"),
                        AgentDefinition.of("reviewer", "Reviewer", "Approve complete designs")),
                new WorkflowTopology.Parallel(
                        List.of("backend", "frontend"),
                        "reviewer",
                        new FeedbackLoopSettings(true, maxIterations, "APPROVED", List.of("backend", "frontend"))));
    }

    private static RunState run(FakeChatModel model, WorkflowConfig config) {
        return run(model, config, RunListener.NONE);
    }

    private static RunState run(FakeChatModel model, WorkflowConfig config, RunListener listener) {
        WorkflowLogger logger = new WorkflowLogger();
        try (WorkflowEngine engine = new WorkflowEngine(
                LangChain4jLlmClient.usingChatModel(model),
                ToolRegistry.withBuiltins(logger),
                MemoryStore.noop(),
                WorkflowTracer.disabled(),
                logger,
                Clock.systemUTC())) {
            return engine.run(config, new RunState("Design a todo app"), listener);
        }
    }
}

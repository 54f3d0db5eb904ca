package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.DelegationStrategy;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.SubAgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigLoader;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigurationException;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.FakeChatModel;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackOutcome;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolRegistry;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class WorkflowEngineTest {

    @Test
    void run_withUnknownReference_shouldFailBeforeAnyModelCall() {
        FakeChatModel model = new FakeChatModel();
        WorkflowConfig config = new WorkflowConfig(
                List.of(AgentDefinition.of("a", "A", "goal")),
                new WorkflowTopology.Sequential(List.of("a", "ghost")));

        try (WorkflowEngine engine = engine(model, MemoryStore.noop())) {
            assertThatThrownBy(() -> engine.run(config, new RunState("input")))
                    .isInstanceOf(WorkflowConfigurationException.class)
                    .hasMessageContaining("unknown agent 'ghost'")
                    .hasMessageContaining("available: a");
        }
        assertThat(model.exchanges()).isEmpty();
    }

    @Test
    void run_withDelegatingAgent_shouldRecordSubAgentOutputsUnderParent() {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains("synthesize their outputs", "final report")
                .otherwise(exchange -> "work of " + exchange.system().lines().findFirst().orElse(""));
        AgentDefinition lead = new AgentDefinition(
                "lead",
                "Research Lead",
                "Produce a report",
                List.of(),
                List.of(
                        new SubAgentDefinition("gatherer", "Gatherer", "Gather sources", List.of(), null, List.of()),
                        new SubAgentDefinition("checker", "Fact Checker", "Verify claims", List.of(), null, List.of())),
                DelegationStrategy.SEQUENTIAL,
                false);
        WorkflowConfig config = new WorkflowConfig(List.of(lead), new WorkflowTopology.Sequential(List.of("lead")));

        RunState state;
        try (WorkflowEngine engine = engine(model, MemoryStore.noop())) {
            state = engine.run(config, new RunState("Research solar power"));
        }

        assertThat(state.timeline()).extracting(TimelineEntry::agentId).containsExactly("lead");
        assertThat(state.output("lead")).contains("final report");
        assertThat(state.subAgentOutputs("lead")).containsOnlyKeys("gatherer", "checker");
        assertThat(state.subAgentOutputs("lead").get("checker"))
                .isEqualTo("work of You are Fact Checker, working as part of Research Lead's team.");
    }

    @Test
    void run_withPersistentMemory_shouldQueryByRoleAndGoalAndStoreCommittedTurns() {
        FakeChatModel model = FakeChatModel.summarizingByEcho().otherwise(exchange -> "answer");
        RecordingMemoryStore memory = new RecordingMemoryStore();
        AgentDefinition remembering = new AgentDefinition(
                "analyst", "Analyst", "Analyse churn", List.of(), List.of(), DelegationStrategy.AUTO, true);
        AgentDefinition forgetful = AgentDefinition.of("writer", "Writer", "Write it up");
        WorkflowConfig config = new WorkflowConfig(
                List.of(remembering, forgetful), new WorkflowTopology.Sequential(List.of("analyst", "writer")));

        try (WorkflowEngine engine = engine(model, memory)) {
            engine.run(config, new RunState("Why do users leave?"));
        }

        assertThat(memory.queries).containsExactly("Analyst: Analyse churn");
        assertThat(memory.stored).singleElement().satisfies(entry -> {
            assertThat(entry.agentId()).isEqualTo("analyst");
            assertThat(entry.keyInsights()).containsExactly("insight: answer");
        });
        assertThat(model.agentExchanges().get(0).user()).contains("RELEVANT CONTEXT FROM PAST WORKFLOWS", "earlier churn study");
    }

    @Test
    void run_whenMemoryFails_shouldContinueTheRun() {
        FakeChatModel model = FakeChatModel.summarizingByEcho().otherwise(exchange -> "answer");
        MemoryStore broken = new MemoryStore() {
            @Override
            public List<RelevantMemory> query(String text, int topK) {
                throw new IllegalStateException("embedding service down");
            }

            @Override
            public void store(MemoryEntry entry) {
                throw new IllegalStateException("disk full");
            }
        };
        AgentDefinition remembering = new AgentDefinition(
                "analyst", "Analyst", "Analyse churn", List.of(), List.of(), DelegationStrategy.AUTO, true);
        WorkflowConfig config = new WorkflowConfig(List.of(remembering), new WorkflowTopology.Sequential(List.of("analyst")));

        RunState state;
        try (WorkflowEngine engine = engine(model, broken)) {
            state = engine.run(config, new RunState("input"));
        }

        assertThat(state.output("analyst")).contains("answer");
    }

    @Test
    void run_withDryRunModel_shouldCompleteFeedbackWorkflowFromYaml() throws URISyntaxException {
        Path yaml = Path.of(getClass().getResource("/workflows/feedback.yaml").toURI());
        WorkflowConfig config = new WorkflowConfigLoader().load(yaml).config();

        RunState state;
        try (WorkflowEngine engine = engine(LangChain4jLlmClient.fake(), MemoryStore.noop())) {
            state = engine.run(config, new RunState("Design a todo app"));
        }

        assertThat(state.feedbackOutcome()).contains(new FeedbackOutcome(true, 1));
        assertThat(state.timeline()).extracting(TimelineEntry::agentId).containsExactly("backend", "frontend", "reviewer");
        assertThat(state.finalOutput()).hasValueSatisfying(output -> assertThat(output).startsWith("APPROVED"));
    }

    private static WorkflowEngine engine(FakeChatModel model, MemoryStore memory) {
        return engine(LangChain4jLlmClient.usingChatModel(model), memory);
    }

    private static WorkflowEngine engine(LangChain4jLlmClient client, MemoryStore memory) {
        WorkflowLogger logger = new WorkflowLogger();
        return new WorkflowEngine(
                client, ToolRegistry.withBuiltins(logger), memory, WorkflowTracer.disabled(), logger, Clock.systemUTC());
    }

    private static final class RecordingMemoryStore implements MemoryStore {
        final List<String> queries = new CopyOnWriteArrayList<>();
        final List<MemoryEntry> stored = new CopyOnWriteArrayList<>();

        @Override
        public List<RelevantMemory> query(String text, int topK) {
            queries.add(text);
            return List.of(new RelevantMemory(
                    "analyst", "Analyst", "earlier churn study", List.of("pricing matters"), List.of(),
                    Instant.parse("2026-01-01T00:00:00Z"), 0.8));
        }

        @Override
        public void store(MemoryEntry entry) {
            stored.add(entry);
        }
    }
}

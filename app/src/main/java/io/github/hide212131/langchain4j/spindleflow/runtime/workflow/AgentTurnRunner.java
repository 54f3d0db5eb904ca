package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSelector;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummarizer;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import io.github.hide212131.langchain4j.spindleflow.runtime.delegation.DelegationOutcome;
import io.github.hide212131.langchain4j.spindleflow.runtime.delegation.SubAgentCoordinator;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.Prompt;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.PromptBuilder;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.ContextSnapshot;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackIteration;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunListener;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TurnCommit;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolInvoker;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes single agent turns against a context snapshot and commits finished turns. Turn methods
 * are safe to call from worker threads; {@link #commit} runs on the coordinating thread only.
 */
public final class AgentTurnRunner {

    static final double AGENT_TEMPERATURE = 0.2;

    private final LangChain4jLlmClient llmClient;
    private final ContextSummarizer summarizer;
    private final ContextSelector selector;
    private final SubAgentCoordinator coordinator;
    private final ToolInvoker toolInvoker;
    private final MemoryStore memoryStore;
    private final RunSettings settings;
    private final RunListener listener;
    private final Clock clock;
    private final WorkflowTracer tracer;
    private final WorkflowLogger logger;

    AgentTurnRunner(
            LangChain4jLlmClient llmClient,
            ContextSummarizer summarizer,
            ContextSelector selector,
            SubAgentCoordinator coordinator,
            ToolInvoker toolInvoker,
            MemoryStore memoryStore,
            RunSettings settings,
            RunListener listener,
            Clock clock,
            WorkflowTracer tracer,
            WorkflowLogger logger) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /** Per-run knobs taken from the workflow configuration. */
    record RunSettings(int maxContextItems, int memoryTopK) {}

    /** An ordinary turn that sees the summaries chosen for this agent. */
    TurnCommit runTurn(AgentDefinition agent, ContextSnapshot snapshot) {
        return runTurn(agent, snapshot, visibleSummaries(agent, snapshot));
    }

    /** A turn that sees every committed summary, used for aggregators. */
    TurnCommit runTurnWithFullContext(AgentDefinition agent, ContextSnapshot snapshot) {
        return runTurn(agent, snapshot, snapshot.summaries());
    }

    /** A turn driven by a prebuilt prompt, used for reviews and revisions. */
    TurnCommit runPrompt(AgentDefinition agent, Prompt prompt, Integer revisionIteration) {
        return tracer.trace("agent.turn", Map.of("agent.id", agent.id(), "agent.kind", "prompt"), () -> {
            Instant startedAt = clock.instant();
            logger.info("Agent {} ({}) started", agent.id(), agent.role());
            String output = llmClient.generate(prompt.system(), prompt.user(), AGENT_TEMPERATURE).content();
            Instant endedAt = clock.instant();
            TimelineEntry entry = TimelineEntry.of(agent.id(), agent.role(), output, startedAt, endedAt);
            ContextSummary summary = summarizer.summarize(output, agent.id(), agent.role());
            return new TurnCommit(entry, summary, Map.of(), revisionIteration);
        });
    }

    private TurnCommit runTurn(AgentDefinition agent, ContextSnapshot snapshot, List<ContextSummary> summaries) {
        return tracer.trace("agent.turn", Map.of("agent.id", agent.id(), "agent.delegates", agent.delegates()), () -> {
            Instant startedAt = clock.instant();
            logger.info("Agent {} ({}) started", agent.id(), agent.role());
            String output;
            Map<String, String> subAgentOutputs = Map.of();
            if (agent.delegates()) {
                DelegationOutcome outcome = coordinator.delegate(agent, snapshot, summaries);
                output = outcome.output();
                subAgentOutputs = outcome.subAgentOutputs();
            } else {
                String toolOutputs = toolOutputsFor(agent, snapshot);
                Prompt prompt = PromptBuilder.agentTurn(
                        agent, snapshot.userInput(), summaries, toolOutputs, memoriesFor(agent));
                logger.debug("Prompt for {}: system={} chars, user={} chars",
                        agent.id(), prompt.system().length(), prompt.user().length());
                output = llmClient.generate(prompt.system(), prompt.user(), AGENT_TEMPERATURE).content();
            }
            Instant endedAt = clock.instant();
            TimelineEntry entry = TimelineEntry.of(agent.id(), agent.role(), output, startedAt, endedAt);
            ContextSummary summary = summarizer.summarize(output, agent.id(), agent.role());
            return new TurnCommit(entry, summary, subAgentOutputs, null);
        });
    }

    /** Runs the agent's declared tools over the snapshot; empty when it declares none. */
    String toolOutputsFor(AgentDefinition agent, ContextSnapshot snapshot) {
        if (agent.tools().isEmpty()) {
            return "";
        }
        return ToolInvoker.format(
                toolInvoker.invoke(agent.tools(), new ToolContext(snapshot.userInput(), snapshot.outputs())));
    }

    List<ContextSummary> visibleSummaries(AgentDefinition agent, ContextSnapshot snapshot) {
        if (settings.maxContextItems() <= 0) {
            return snapshot.summaries();
        }
        return selector.select(agent, snapshot.summaries(), settings.maxContextItems());
    }

    List<RelevantMemory> memoriesFor(AgentDefinition agent) {
        if (!agent.persistentMemoryEnabled()) {
            return List.of();
        }
        return memoryStore.query(agent.role() + ": " + agent.goal(), settings.memoryTopK());
    }

    /** Writes finished turns into the run state in order, then stores memories and notifies the listener. */
    void commit(RunState state, List<TurnCommit> commits, Map<String, AgentDefinition> agents) {
        state.commitAll(commits);
        for (TurnCommit commit : commits) {
            TimelineEntry entry = commit.entry();
            logger.info("Agent {} completed in {}ms", entry.agentId(), entry.durationMs());
            AgentDefinition agent = agents.get(entry.agentId());
            if (agent != null && agent.persistentMemoryEnabled()) {
                ContextSummary summary = commit.summary();
                memoryStore.store(new MemoryEntry(
                        entry.agentId(),
                        entry.role(),
                        entry.output(),
                        summary.keyInsights(),
                        summary.decisions(),
                        summary.artifacts(),
                        entry.endedAt()));
            }
            listener.onTurnCompleted(entry);
        }
    }

    void recordFeedback(RunState state, FeedbackIteration iteration) {
        state.recordFeedbackIteration(iteration);
        listener.onFeedbackIteration(iteration);
    }

    Instant now() {
        return clock.instant();
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.delegation;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.DelegationStrategy;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.SubAgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.RelevantMemory;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.Prompt;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.ContextSnapshot;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.FanOut;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolInvoker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Plans and runs a parent agent's sub-agents, then asks the parent to synthesize their work into a
 * single output.
 *
 * <p>Sequential delegation shows each sub-agent the outputs of the ones before it. Parallel delegation
 * gives every sub-agent the parent's context only. Nothing is written to the run state here; the
 * enclosing executor commits the returned {@link DelegationOutcome}.</p>
 */
public final class SubAgentCoordinator {

    static final double SUB_AGENT_TEMPERATURE = 0.2;
    static final int SUB_AGENT_MEMORY_TOP_K = 3;

    private final LangChain4jLlmClient llmClient;
    private final ToolInvoker toolInvoker;
    private final MemoryStore memoryStore;
    private final ExecutorService executor;
    private final WorkflowLogger logger;
    private final DelegationPlanParser planParser = new DelegationPlanParser();

    public SubAgentCoordinator(
            LangChain4jLlmClient llmClient,
            ToolInvoker toolInvoker,
            MemoryStore memoryStore,
            ExecutorService executor,
            WorkflowLogger logger) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public DelegationOutcome delegate(AgentDefinition parent, ContextSnapshot snapshot, List<ContextSummary> summaries) {
        if (!parent.delegates()) {
            throw new IllegalArgumentException("Agent '" + parent.id() + "' declares no sub-agents");
        }
        DelegationPlan plan = plan(parent, snapshot.userInput(), summaries);
        logger.info("{} delegates to {} ({}): {}",
                parent.id(), plan.subAgentIds(), plan.mode().name().toLowerCase(Locale.ROOT), plan.reason());
        Map<String, String> subOutputs = plan.mode() == DelegationPlan.Mode.PARALLEL
                ? runParallel(parent, plan, snapshot, summaries)
                : runSequential(parent, plan, snapshot, summaries);
        Prompt synthesis = DelegationPrompts.synthesis(parent, snapshot.userInput(), subOutputs);
        String output = llmClient.generate(synthesis.system(), synthesis.user(), null).content();
        return new DelegationOutcome(plan, subOutputs, output);
    }

    /**
     * Fixed strategies list every sub-agent in declaration order. {@code auto} asks the parent, and an
     * unusable answer falls back to all sub-agents in sequence. A failing planning call propagates.
     */
    public DelegationPlan plan(AgentDefinition parent, String userInput, List<ContextSummary> summaries) {
        List<String> declared = parent.subAgents().stream().map(SubAgentDefinition::id).toList();
        if (parent.delegationStrategy() == DelegationStrategy.SEQUENTIAL) {
            return DelegationPlan.sequential(declared, "Sequential delegation strategy");
        }
        if (parent.delegationStrategy() == DelegationStrategy.PARALLEL) {
            return DelegationPlan.parallel(declared, "Parallel delegation strategy");
        }
        Prompt planning = DelegationPrompts.planning(parent, userInput, summaries);
        String response = llmClient.generate(planning.system(), planning.user(), null).content();
        return planParser.parse(response, parent.subAgents()).orElseGet(() -> {
            logger.warn("Could not read a delegation plan for {}; using all sub-agents in sequence", parent.id());
            return DelegationPlan.fallback(declared);
        });
    }

    private Map<String, String> runSequential(
            AgentDefinition parent, DelegationPlan plan, ContextSnapshot snapshot, List<ContextSummary> summaries) {
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String id : plan.subAgentIds()) {
            SubAgentDefinition sub = requireSubAgent(parent, id);
            outputs.put(id, runSubAgent(sub, parent, snapshot, summaries, new LinkedHashMap<>(outputs)));
        }
        return outputs;
    }

    private Map<String, String> runParallel(
            AgentDefinition parent, DelegationPlan plan, ContextSnapshot snapshot, List<ContextSummary> summaries) {
        List<Supplier<String>> tasks = new ArrayList<>();
        for (String id : plan.subAgentIds()) {
            SubAgentDefinition sub = requireSubAgent(parent, id);
            tasks.add(() -> runSubAgent(sub, parent, snapshot, summaries, Map.of()));
        }
        List<String> results = FanOut.all(tasks, executor);
        Map<String, String> outputs = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            outputs.put(plan.subAgentIds().get(i), results.get(i));
        }
        return outputs;
    }

    private String runSubAgent(
            SubAgentDefinition sub,
            AgentDefinition parent,
            ContextSnapshot snapshot,
            List<ContextSummary> summaries,
            Map<String, String> previousSubOutputs) {
        String toolOutputs = "";
        if (!sub.tools().isEmpty()) {
            toolOutputs = ToolInvoker.format(
                    toolInvoker.invoke(sub.tools(), new ToolContext(snapshot.userInput(), snapshot.outputs())));
        }
        List<RelevantMemory> memories = List.of();
        if (parent.persistentMemoryEnabled()) {
            memories = memoryStore.query(
                    sub.role() + ": " + sub.goal() + "\nUser: " + snapshot.userInput(), SUB_AGENT_MEMORY_TOP_K);
        }
        Prompt prompt = DelegationPrompts.subAgent(
                sub, parent, snapshot.userInput(), summaries, previousSubOutputs, toolOutputs, memories);
        logger.debug("Running sub-agent {} of {}", sub.id(), parent.id());
        return llmClient.generate(prompt.system(), prompt.user(), SUB_AGENT_TEMPERATURE).content();
    }

    private static SubAgentDefinition requireSubAgent(AgentDefinition parent, String id) {
        return parent.subAgent(id).orElseThrow(() -> new IllegalStateException(
                "Sub-agent '" + id + "' is not declared under '" + parent.id() + "'"));
    }
}

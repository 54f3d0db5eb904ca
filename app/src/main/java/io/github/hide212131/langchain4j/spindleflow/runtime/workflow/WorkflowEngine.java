package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.ObservabilityConfig;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.FeedbackLoopSettings;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigValidator;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSelector;
import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummarizer;
import io.github.hide212131.langchain4j.spindleflow.runtime.delegation.SubAgentCoordinator;
import io.github.hide212131.langchain4j.spindleflow.runtime.feedback.FeedbackProcessor;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunListener;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolInvoker;
import io.github.hide212131.langchain4j.spindleflow.runtime.tool.ToolRegistry;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a validated {@link WorkflowConfig} against a fresh {@link RunState}.
 *
 * <p>The engine owns the worker pool used for fan-outs and sub-agent delegation, so close it when
 * done. A single engine may run several workflows one after another; each run gets its own state.</p>
 */
public final class WorkflowEngine implements AutoCloseable {

    private final LangChain4jLlmClient llmClient;
    private final ToolInvoker toolInvoker;
    private final MemoryStore memoryStore;
    private final WorkflowTracer tracer;
    private final WorkflowLogger logger;
    private final Clock clock;
    private final ExecutorService executor;
    private final ContextSummarizer summarizer;
    private final ContextSelector selector;
    private final FeedbackProcessor feedbackProcessor = new FeedbackProcessor();
    private final WorkflowConfigValidator validator = new WorkflowConfigValidator();

    public static WorkflowEngine withDefaults(LangChain4jLlmClient llmClient) {
        return withDefaults(llmClient, MemoryStore.noop());
    }

    public static WorkflowEngine withDefaults(LangChain4jLlmClient llmClient, MemoryStore memoryStore) {
        WorkflowLogger logger = new WorkflowLogger();
        WorkflowTracer tracer = WorkflowTracer.from(ObservabilityConfig.fromEnvironment());
        return new WorkflowEngine(
                llmClient, ToolRegistry.withBuiltins(logger), memoryStore, tracer, logger, Clock.systemUTC());
    }

    public WorkflowEngine(
            LangChain4jLlmClient llmClient,
            ToolInvoker toolInvoker,
            MemoryStore memoryStore,
            WorkflowTracer tracer,
            WorkflowLogger logger,
            Clock clock) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.memoryStore = MemoryStore.nonFatal(Objects.requireNonNull(memoryStore, "memoryStore"), logger);
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = tracer.propagating(Executors.newCachedThreadPool(new WorkerThreadFactory()));
        this.summarizer = new ContextSummarizer(llmClient, logger);
        this.selector = new ContextSelector(logger);
    }

    public RunState run(WorkflowConfig config, RunState state) {
        return run(config, state, RunListener.NONE);
    }

    /**
     * Executes the workflow, writing every turn into {@code state}. Configuration errors surface as
     * {@link io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigurationException}
     * before any model call; a failing turn aborts the run with the state holding every turn
     * committed so far.
     */
    public RunState run(WorkflowConfig config, RunState state, RunListener listener) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(listener, "listener");
        validator.requireValid(config);

        AgentTurnRunner runner = new AgentTurnRunner(
                llmClient,
                summarizer,
                selector,
                new SubAgentCoordinator(llmClient, toolInvoker, memoryStore, executor, logger),
                toolInvoker,
                memoryStore,
                new AgentTurnRunner.RunSettings(config.maxContextItems(), config.memory().topK()),
                listener,
                clock,
                tracer,
                logger);
        String mode = modeOf(config.topology());
        logger.info("Workflow started: mode={}, agents={}", mode, config.agentIds());
        try {
            tracer.trace("workflow.run", Map.of("workflow.mode", mode, "workflow.agents", config.agents().size()),
                    () -> dispatch(config, state, runner));
        } finally {
            summarizer.clearCache();
        }
        logger.info("Workflow finished: {} turn(s)", state.timeline().size());
        return state;
    }

    private void dispatch(WorkflowConfig config, RunState state, AgentTurnRunner runner) {
        WorkflowTopology topology = config.topology();
        if (topology instanceof WorkflowTopology.Sequential sequential) {
            new SequentialExecutor(runner).execute(sequential, config, state);
            return;
        }
        WorkflowTopology.Parallel parallel = (WorkflowTopology.Parallel) topology;
        ParallelExecutor parallelExecutor = new ParallelExecutor(runner, executor, tracer, logger);
        Optional<FeedbackLoopSettings> loop = parallel.activeFeedbackLoop();
        if (loop.isEmpty()) {
            parallelExecutor.execute(parallel, config, state);
            return;
        }
        FeedbackLoopResult result = new IterativeFeedbackExecutor(
                runner, parallelExecutor, executor, feedbackProcessor, tracer, logger)
                .execute(parallel, loop.get(), config, state);
        logger.info("Feedback loop ended {} after {} iteration(s)", result.state(), result.iterations());
    }

    private static String modeOf(WorkflowTopology topology) {
        if (topology instanceof WorkflowTopology.Sequential) {
            return "sequential";
        }
        return ((WorkflowTopology.Parallel) topology).activeFeedbackLoop().isPresent() ? "feedback" : "parallel";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "spindleflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

package io.github.hide212131.langchain4j.spindleflow.app.cli;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.MemorySettings;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigLoader;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfigurationException;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.EmbeddingMemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LlmConfiguration;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LlmProvider;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackIteration;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunListener;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.workflow.WorkflowEngine;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point that wires PicoCLI with the workflow engine.
 */
@Command(name = "spindleflow", mixinStandardHelpOptions = true,
        description = "Run multi-agent workflows described in YAML")
public final class SpindleFlowCliApp implements Runnable {

    static final int EXIT_CONFIGURATION_ERROR = 1;
    static final int EXIT_RUN_FAILURE = 2;

    private static final int PREVIEW_LENGTH = 160;

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(new DefaultRuntimeFactory());
    }

    static CommandLine commandLineInstance(RuntimeFactory runtimeFactory) {
        CommandLine cmd = new CommandLine(new SpindleFlowCliApp());
        WorkflowConfigLoader loader = new WorkflowConfigLoader();
        cmd.addSubcommand("run", new RunCommand(runtimeFactory, loader));
        cmd.addSubcommand("validate", new ValidateCommand(loader));
        return cmd;
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(new DefaultRuntimeFactory(), args, out, err);
    }

    static int run(RuntimeFactory runtimeFactory, String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = commandLineInstance(runtimeFactory);
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /** Builds the model client and memory store a run needs. */
    interface RuntimeFactory {

        LangChain4jLlmClient llmClient(boolean dryRun);

        MemoryStore memoryStore(MemorySettings settings, boolean dryRun, WorkflowLogger logger);
    }

    static final class DefaultRuntimeFactory implements RuntimeFactory {

        private final WorkflowLogger logger = new WorkflowLogger(DefaultRuntimeFactory.class);
        private LlmConfiguration configuration;

        @Override
        public LangChain4jLlmClient llmClient(boolean dryRun) {
            configuration = new LlmConfigurationLoader().load(dryRun ? LlmProvider.MOCK : null);
            logger.info("Provider {} (model={}, apiKey={})",
                    configuration.provider(), configuration.openAiModel(), configuration.maskedApiKey());
            return LangChain4jLlmClient.from(configuration);
        }

        @Override
        public MemoryStore memoryStore(MemorySettings settings, boolean dryRun, WorkflowLogger logger) {
            if (!settings.enabled()) {
                return MemoryStore.noop();
            }
            if (dryRun || configuration == null || configuration.provider() != LlmProvider.OPENAI) {
                logger.warn("Persistent memory needs the openai provider for embeddings; memory is disabled for this run");
                return MemoryStore.noop();
            }
            OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                    .apiKey(configuration.openAiApiKey())
                    .modelName(configuration.embeddingModel())
                    .timeout(configuration.timeout());
            if (configuration.openAiBaseUrl() != null) {
                builder.baseUrl(configuration.openAiBaseUrl());
            }
            EmbeddingModel embeddingModel = builder.build();
            return EmbeddingMemoryStore.persistent(embeddingModel, settings.storePath(), logger);
        }
    }

    @Command(name = "run", description = "Execute a workflow for the given input")
    static final class RunCommand implements Callable<Integer> {

        @Option(names = "--config", required = true, description = "Path to the workflow YAML")
        Path configPath;

        @ArgGroup(exclusive = true, multiplicity = "1")
        InputSource input;

        @Option(names = "--dry-run", description = "Use the built-in dry-run model instead of a provider")
        boolean dryRun;

        @Spec
        CommandSpec commandSpec;

        private final RuntimeFactory runtimeFactory;
        private final WorkflowConfigLoader loader;

        RunCommand(RuntimeFactory runtimeFactory, WorkflowConfigLoader loader) {
            this.runtimeFactory = runtimeFactory;
            this.loader = loader;
        }

        static final class InputSource {
            @Option(names = "--input", required = true, description = "User input text")
            String text;

            @Option(names = "--input-file", required = true, description = "File holding the user input")
            Path file;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();
            WorkflowConfig config;
            String userInput;
            LangChain4jLlmClient client;
            try {
                WorkflowConfigLoader.LoadResult loaded = loader.load(configPath);
                loaded.warnings().forEach(warning -> out.println("Warning: " + warning));
                config = loaded.config();
                userInput = readInput();
                client = runtimeFactory.llmClient(dryRun);
            } catch (WorkflowConfigurationException e) {
                printConfigurationError(err, e);
                return EXIT_CONFIGURATION_ERROR;
            } catch (IllegalStateException | IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_CONFIGURATION_ERROR;
            }

            WorkflowLogger logger = new WorkflowLogger(SpindleFlowCliApp.class);
            MemoryStore memoryStore;
            try {
                memoryStore = runtimeFactory.memoryStore(config.memory(), dryRun, logger);
            } catch (RuntimeException e) {
                logger.warn("Persistent memory unavailable, continuing without it: {}", e.getMessage());
                memoryStore = MemoryStore.noop();
            }
            RunState state = new RunState(userInput);
            try (WorkflowEngine engine = WorkflowEngine.withDefaults(client, memoryStore)) {
                engine.run(config, state, new ConsoleRunListener(out));
            } catch (WorkflowConfigurationException e) {
                printConfigurationError(err, e);
                return EXIT_CONFIGURATION_ERROR;
            } catch (RuntimeException e) {
                err.println("Run failed after " + state.timeline().size() + " turn(s): " + e.getMessage());
                return EXIT_RUN_FAILURE;
            }

            out.println();
            out.println("Final output:");
            out.println(state.finalOutput().orElse("(none)"));
            state.feedbackOutcome().ifPresent(outcome -> out.printf(
                    "Feedback loop: %s after %d iteration(s)%n",
                    outcome.approved() ? "approved" : "not approved",
                    outcome.iterations()));
            LangChain4jLlmClient.ProviderMetrics metrics = client.metrics();
            out.printf(
                    "Tokens in/out/total: %d/%d/%d (calls=%d, durationMs=%d)%n",
                    metrics.totalInputTokens(),
                    metrics.totalOutputTokens(),
                    metrics.totalTokenCount(),
                    metrics.callCount(),
                    metrics.totalDurationMs());
            return 0;
        }

        private String readInput() {
            if (input.text != null) {
                return input.text;
            }
            try {
                return Files.readString(input.file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new WorkflowConfigurationException(
                        "Failed to read input file: " + input.file,
                        List.of("Check that the file exists and is readable"),
                        e);
            }
        }
    }

    @Command(name = "validate", description = "Check a workflow YAML without running it")
    static final class ValidateCommand implements Callable<Integer> {

        @Option(names = "--config", required = true, description = "Path to the workflow YAML")
        Path configPath;

        @Spec
        CommandSpec commandSpec;

        private final WorkflowConfigLoader loader;

        ValidateCommand(WorkflowConfigLoader loader) {
            this.loader = loader;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            WorkflowConfigLoader.LoadResult loaded;
            try {
                loaded = loader.load(configPath);
            } catch (WorkflowConfigurationException e) {
                printConfigurationError(commandSpec.commandLine().getErr(), e);
                return EXIT_CONFIGURATION_ERROR;
            }
            loaded.warnings().forEach(warning -> out.println("Warning: " + warning));
            WorkflowConfig config = loaded.config();
            out.println("Configuration OK: " + configPath);
            out.println("Agents: " + String.join(", ", config.agentIds()));
            out.println("Topology: " + describe(config.topology()));
            return 0;
        }

        private static String describe(WorkflowTopology topology) {
            if (topology instanceof WorkflowTopology.Sequential sequential) {
                return "sequential " + String.join(" -> ", sequential.steps());
            }
            WorkflowTopology.Parallel parallel = (WorkflowTopology.Parallel) topology;
            String base = "parallel [" + String.join(", ", parallel.branches()) + "] -> " + parallel.aggregator();
            return parallel.activeFeedbackLoop()
                    .map(loop -> base + " (feedback loop, max " + loop.maxIterations() + " iteration(s), targets "
                            + String.join(", ", loop.feedbackTargets()) + ")")
                    .orElse(base);
        }
    }

    private static void printConfigurationError(PrintWriter err, WorkflowConfigurationException e) {
        err.println("Configuration error: " + e.getMessage());
        e.hints().forEach(hint -> err.println("  - " + hint));
    }

    /** Prints turns as they are committed. */
    static final class ConsoleRunListener implements RunListener {

        private final PrintWriter out;

        ConsoleRunListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onTurnCompleted(TimelineEntry entry) {
            StringBuilder line = new StringBuilder("[").append(entry.agentId()).append("] ").append(entry.role());
            if (entry.branchId() != null) {
                line.append(" (").append(entry.branchId()).append('#').append(entry.branchIndex()).append(')');
            }
            if (entry.iteration() != null) {
                line.append(" iteration ").append(entry.iteration());
            }
            if (entry.aggregator()) {
                line.append(" aggregator");
            }
            line.append(" in ").append(entry.durationMs()).append("ms: ").append(preview(entry.output()));
            out.println(line);
        }

        @Override
        public void onFeedbackIteration(FeedbackIteration iteration) {
            out.printf("Review %d: %s%n", iteration.iteration(), iteration.approved() ? "approved" : "changes requested");
        }

        private static String preview(String output) {
            String flat = output.replaceAll("\\s+", " ").strip();
            return flat.length() <= PREVIEW_LENGTH ? flat : flat.substring(0, PREVIEW_LENGTH) + "...";
        }
    }
}

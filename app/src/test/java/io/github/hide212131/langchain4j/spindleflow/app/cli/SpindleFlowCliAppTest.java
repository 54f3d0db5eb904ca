package io.github.hide212131.langchain4j.spindleflow.app.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.MemorySettings;
import io.github.hide212131.langchain4j.spindleflow.runtime.memory.MemoryStore;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.FakeChatModel;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SpindleFlowCliAppTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void runCommand_dryRun_shouldPrintTurnsFinalOutputAndTokens() throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "run", "--config", workflow("sequential.yaml"), "--input", "the history of tea", "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("[researcher] Researcher in ")
                .contains("[writer] Writer in ")
                .contains("Final output:")
                .contains("Tokens in/out/total:");
    }

    @Test
    void runCommand_feedbackWorkflow_shouldReportLoopOutcome() throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "run", "--config", workflow("feedback.yaml"), "--input", "build a todo app", "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("(parallel-1#1) iteration 0")
                .contains("Review 1: approved")
                .contains("aggregator")
                .contains("Feedback loop: approved after 1 iteration(s)");
    }

    @Test
    void runCommand_withInputFile_shouldUseFileContents(@TempDir Path tempDir) throws Exception {
        Path inputFile = tempDir.resolve("input.txt");
        Files.writeString(inputFile, "input from file");
        FakeChatModel model = FakeChatModel.summarizingByEcho().otherwise(exchange -> "done");

        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(new FixedRuntimeFactory(model)),
                "run", "--config", workflow("sequential.yaml"), "--input-file", inputFile.toString());

        assertThat(exitCode).isZero();
        assertThat(model.agentExchanges()).isNotEmpty()
                .allSatisfy(exchange -> assertThat(exchange.user()).contains("input from file"));
    }

    @Test
    void runCommand_withInvalidConfig_shouldExitWithConfigurationError() throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "run", "--config", workflow("invalid.yaml"), "--input", "x", "--dry-run");

        assertThat(exitCode).isEqualTo(SpindleFlowCliApp.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Configuration error").contains("Duplicate agent id");
    }

    @Test
    void runCommand_whenModelFails_shouldExitWithRunFailure() throws Exception {
        FakeChatModel model = FakeChatModel.summarizingByEcho()
                .whenSystemContains("Writer", exchange -> {
                    throw new IllegalStateException("rate limited");
                });

        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(new FixedRuntimeFactory(model)),
                "run", "--config", workflow("sequential.yaml"), "--input", "x");

        assertThat(exitCode).isEqualTo(SpindleFlowCliApp.EXIT_RUN_FAILURE);
        assertThat(err.toString()).contains("Run failed after 1 turn(s)").contains("rate limited");
    }

    @Test
    void runCommand_whenMemoryStoreCannotOpen_shouldRunWithoutMemory() throws Exception {
        FakeChatModel model = FakeChatModel.summarizingByEcho().otherwise(exchange -> "done");
        SpindleFlowCliApp.RuntimeFactory factory = new FixedRuntimeFactory(model) {
            @Override
            public MemoryStore memoryStore(MemorySettings settings, boolean dryRun, WorkflowLogger logger) {
                throw new IllegalStateException("memory file unreadable");
            }
        };

        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(factory),
                "run", "--config", workflow("sequential.yaml"), "--input", "the history of tea");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Final output:");
    }

    @Test
    void runCommand_withMissingInputFile_shouldFail(@TempDir Path tempDir) throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "run", "--config", workflow("sequential.yaml"),
                "--input-file", tempDir.resolve("missing.txt").toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(SpindleFlowCliApp.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Failed to read input file");
    }

    @Test
    void runCommand_withoutInput_shouldBeRejectedByParser() throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "run", "--config", workflow("sequential.yaml"), "--dry-run");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--input");
    }

    @Test
    void validateCommand_shouldDescribeTopology() throws Exception {
        int exitCode = execute(SpindleFlowCliApp.commandLineInstance(),
                "validate", "--config", workflow("feedback.yaml"));

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Configuration OK")
                .contains("Agents: backend, frontend, reviewer")
                .contains("Topology: parallel [backend, frontend] -> reviewer (feedback loop, max 3 iteration(s)");
    }

    private int execute(CommandLine commandLine, String... args) {
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String workflow(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/workflows/" + name).toURI()).toString();
    }

    private static class FixedRuntimeFactory implements SpindleFlowCliApp.RuntimeFactory {

        private final FakeChatModel model;

        private FixedRuntimeFactory(FakeChatModel model) {
            this.model = model;
        }

        @Override
        public LangChain4jLlmClient llmClient(boolean dryRun) {
            return LangChain4jLlmClient.usingChatModel(model);
        }

        @Override
        public MemoryStore memoryStore(MemorySettings settings, boolean dryRun, WorkflowLogger logger) {
            return MemoryStore.noop();
        }
    }
}

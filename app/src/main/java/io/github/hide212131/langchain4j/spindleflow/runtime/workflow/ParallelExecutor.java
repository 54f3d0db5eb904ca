package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.ContextSnapshot;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TurnCommit;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.FanOut;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Fans branches out over one snapshot as an agentic parallel workflow, waits for all of them,
 * commits in branch order from the trailing barrier action, then runs the aggregator against every
 * committed summary.
 *
 * <p>If any branch fails the failure propagates after all branches have settled and nothing from
 * that fan-out is committed.</p>
 */
final class ParallelExecutor {

    static final String INITIAL_FAN_OUT_ID = "parallel-1";

    private final AgentTurnRunner runner;
    private final ExecutorService executor;
    private final WorkflowTracer tracer;
    private final WorkflowLogger logger;

    ParallelExecutor(AgentTurnRunner runner, ExecutorService executor, WorkflowTracer tracer, WorkflowLogger logger) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    void execute(WorkflowTopology.Parallel topology, WorkflowConfig config, RunState state) {
        fanOut(agents(topology.branches(), config), state, config, null);
        AgentDefinition aggregator = config.requireAgent(topology.aggregator());
        TurnCommit commit = runner.runTurnWithFullContext(aggregator, state.snapshot());
        runner.commit(state, List.of(commit.withEntry(commit.entry().asAggregator())), config.agentsById());
    }

    /**
     * Runs the initial fan-out and commits it.
     *
     * @param iteration feedback-loop iteration to tag entries with, or {@code null} outside a loop
     */
    List<TurnCommit> fanOut(List<AgentDefinition> branches, RunState state, WorkflowConfig config, Integer iteration) {
        ContextSnapshot snapshot = state.snapshot();
        logger.info("Fan-out {} over {} branch(es)", INITIAL_FAN_OUT_ID, branches.size());
        List<Supplier<TurnCommit>> tasks = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            AgentDefinition branch = branches.get(i);
            int index = i + 1;
            tasks.add(() -> {
                TurnCommit commit = runner.runTurn(branch, snapshot);
                TimelineEntry entry = commit.entry().inBranch(INITIAL_FAN_OUT_ID, index);
                return commit.withEntry(iteration != null ? entry.atIteration(iteration) : entry);
            });
        }
        Supplier<List<TurnCommit>> run = () -> FanOut.all(
                tasks, executor, finished -> runner.commit(state, finished, config.agentsById()));
        return tracer.trace(
                "workflow.fanout", Map.of("fanout.id", INITIAL_FAN_OUT_ID, "fanout.size", branches.size()), run);
    }

    static List<AgentDefinition> agents(List<String> ids, WorkflowConfig config) {
        List<AgentDefinition> agents = new ArrayList<>();
        for (String id : ids) {
            agents.add(config.requireAgent(id));
        }
        return agents;
    }
}

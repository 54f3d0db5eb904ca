package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.agentic.UntypedAgent;
import dev.langchain4j.agentic.workflow.SequentialAgentService;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TurnCommit;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.AgenticInvocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs steps one after another as an agentic sequence; each step sees what the earlier steps
 * committed.
 */
final class SequentialExecutor {

    private final AgentTurnRunner runner;

    SequentialExecutor(AgentTurnRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    void execute(WorkflowTopology.Sequential topology, WorkflowConfig config, RunState state) {
        AgenticInvocation invocation = new AgenticInvocation();
        List<Object> steps = new ArrayList<>();
        for (String step : topology.steps()) {
            AgentDefinition agent = config.requireAgent(step);
            steps.add(invocation.action(scope -> {
                TurnCommit commit = runner.runTurn(agent, state.snapshot());
                runner.commit(state, List.of(commit), config.agentsById());
            }));
        }
        SequentialAgentService<UntypedAgent> sequence = AgenticServices.sequenceBuilder();
        UntypedAgent workflow = sequence.name("sequential").subAgents(steps.toArray()).build();
        invocation.invoke(workflow, state.userInput());
    }
}

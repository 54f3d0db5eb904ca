package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.agentic.UntypedAgent;
import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.FeedbackLoopSettings;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowConfig;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.WorkflowTopology;
import io.github.hide212131.langchain4j.spindleflow.runtime.feedback.FeedbackProcessor;
import io.github.hide212131.langchain4j.spindleflow.runtime.feedback.FeedbackResult;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.FeedbackPrompts;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.FeedbackPrompts.ReviewedOutput;
import io.github.hide212131.langchain4j.spindleflow.runtime.prompt.Prompt;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.FeedbackIteration;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.RunState;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TimelineEntry;
import io.github.hide212131.langchain4j.spindleflow.runtime.state.TurnCommit;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.AgenticInvocation;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.FanOut;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.ScopeKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Parallel workflow whose aggregator reviews the branches and sends targeted feedback back until it
 * approves or the iteration limit is reached.
 *
 * <p>The review and revise steps run as an agentic loop bounded by the iteration limit. States move
 * {@code INITIAL -> REVIEW -> (APPROVED | EXHAUSTED | REVISE -> REVIEW ...)}; the phase lives in
 * the loop's scope and a terminal phase ends it. The final review is the run's aggregator entry; no
 * revision round follows it.</p>
 */
final class IterativeFeedbackExecutor {

    static final String DEFAULT_REVISION_FEEDBACK = "Please review and improve your output.";

    private static final ScopeKey<Integer> ITERATION = ScopeKey.of("feedback.iteration", Integer.class);
    private static final ScopeKey<FeedbackLoopState> PHASE = ScopeKey.of("feedback.phase", FeedbackLoopState.class);
    private static final ScopeKey<FeedbackResult> VERDICT = ScopeKey.of("feedback.verdict", FeedbackResult.class);

    private final AgentTurnRunner runner;
    private final ParallelExecutor parallelExecutor;
    private final ExecutorService executor;
    private final FeedbackProcessor feedbackProcessor;
    private final WorkflowTracer tracer;
    private final WorkflowLogger logger;

    IterativeFeedbackExecutor(
            AgentTurnRunner runner,
            ParallelExecutor parallelExecutor,
            ExecutorService executor,
            FeedbackProcessor feedbackProcessor,
            WorkflowTracer tracer,
            WorkflowLogger logger) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.parallelExecutor = Objects.requireNonNull(parallelExecutor, "parallelExecutor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.feedbackProcessor = Objects.requireNonNull(feedbackProcessor, "feedbackProcessor");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    FeedbackLoopResult execute(
            WorkflowTopology.Parallel topology, FeedbackLoopSettings loop, WorkflowConfig config, RunState state) {
        AgentDefinition reviewer = config.requireAgent(topology.aggregator());

        List<TurnCommit> initial = parallelExecutor.fanOut(
                ParallelExecutor.agents(topology.branches(), config), state, config, 0);
        Map<String, ReviewedOutput> underReview = new LinkedHashMap<>();
        for (TurnCommit commit : initial) {
            TimelineEntry entry = commit.entry();
            underReview.put(entry.agentId(), new ReviewedOutput(entry.agentId(), entry.role(), entry.output()));
        }
        transition(FeedbackLoopState.INITIAL, FeedbackLoopState.REVIEW);

        AgenticInvocation invocation = new AgenticInvocation();
        Object reviewStep = invocation.action(scope -> {
            int round = ITERATION.readOptional(scope).orElse(0) + 1;
            ITERATION.write(scope, round);
            FeedbackResult result = tracer.trace(
                    "feedback.review",
                    Map.of("feedback.iteration", round, "agent.id", reviewer.id()),
                    () -> review(reviewer, loop, config, state, underReview, round));
            VERDICT.write(scope, result);
            if (result.approved()) {
                PHASE.write(scope, transition(FeedbackLoopState.REVIEW, FeedbackLoopState.APPROVED));
            } else if (round >= loop.maxIterations()) {
                logger.warn("Reviewer {} did not approve within {} iteration(s)", reviewer.id(), loop.maxIterations());
                PHASE.write(scope, transition(FeedbackLoopState.REVIEW, FeedbackLoopState.EXHAUSTED));
            } else {
                PHASE.write(scope, transition(FeedbackLoopState.REVIEW, FeedbackLoopState.REVISE));
            }
        });
        Object reviseStep = invocation.action(scope -> {
            if (PHASE.readRequired(scope).isTerminal()) {
                return;
            }
            revise(loop, config, state, VERDICT.readRequired(scope), underReview, ITERATION.readRequired(scope));
            PHASE.write(scope, transition(FeedbackLoopState.REVISE, FeedbackLoopState.REVIEW));
        });

        UntypedAgent feedbackLoop = AgenticServices.loopBuilder()
                .name("feedback-loop")
                .subAgents(reviewStep, reviseStep)
                .maxIterations(loop.maxIterations())
                .exitCondition(scope -> PHASE.readOptional(scope).map(FeedbackLoopState::isTerminal).orElse(false))
                .output(scope -> {
                    FeedbackLoopState phase = PHASE.readRequired(scope);
                    return new FeedbackLoopResult(
                            phase, phase == FeedbackLoopState.APPROVED, ITERATION.readRequired(scope));
                })
                .build();
        return (FeedbackLoopResult) invocation.invoke(feedbackLoop, state.userInput());
    }

    private FeedbackResult review(
            AgentDefinition reviewer,
            FeedbackLoopSettings loop,
            WorkflowConfig config,
            RunState state,
            Map<String, ReviewedOutput> underReview,
            int iteration) {
        Prompt prompt = FeedbackPrompts.review(
                reviewer,
                state.userInput(),
                List.copyOf(underReview.values()),
                iteration,
                loop.approvalKeyword(),
                runner.toolOutputsFor(reviewer, state.snapshot()),
                runner.memoriesFor(reviewer));
        TurnCommit review = runner.runPrompt(reviewer, prompt, null);
        String reviewText = review.entry().output();
        FeedbackResult result = feedbackProcessor.process(reviewText, loop.feedbackTargets(), loop.approvalKeyword());
        logger.info("Review iteration {}: approved={}, feedback for {}", iteration, result.approved(),
                result.feedback().keySet());

        TimelineEntry entry = review.entry().atIteration(iteration);
        if (result.approved() || iteration >= loop.maxIterations()) {
            entry = entry.asAggregator();
        }
        runner.commit(state, List.of(review.withEntry(entry)), config.agentsById());
        runner.recordFeedback(state, new FeedbackIteration(
                iteration, reviewText, result.approved(), result.feedback(), runner.now()));
        tracer.addEvent("feedback.verdict", Map.of("approved", String.valueOf(result.approved())));
        return result;
    }

    private void revise(
            FeedbackLoopSettings loop,
            WorkflowConfig config,
            RunState state,
            FeedbackResult result,
            Map<String, ReviewedOutput> underReview,
            int iteration) {
        String fanOutId = "revision-" + iteration;
        List<Supplier<TurnCommit>> tasks = new ArrayList<>();
        for (String targetId : loop.feedbackTargets()) {
            AgentDefinition target = config.requireAgent(targetId);
            ReviewedOutput previous = underReview.get(targetId);
            String previousOutput = previous != null ? previous.output() : state.output(targetId).orElse("");
            String feedback = result.feedbackFor(targetId).orElse(DEFAULT_REVISION_FEEDBACK);
            Prompt prompt = FeedbackPrompts.revision(target, state.userInput(), previousOutput, feedback, iteration);
            int index = tasks.size() + 1;
            tasks.add(() -> {
                TurnCommit commit = runner.runPrompt(target, prompt, iteration);
                return commit.withEntry(commit.entry().inBranch(fanOutId, index).atIteration(iteration));
            });
        }
        logger.info("Fan-out {} over {} revision(s)", fanOutId, tasks.size());
        Supplier<List<TurnCommit>> run = () -> FanOut.all(tasks, executor, revised -> {
            for (TurnCommit commit : revised) {
                TimelineEntry entry = commit.entry();
                underReview.put(entry.agentId(), new ReviewedOutput(entry.agentId(), entry.role(), entry.output()));
            }
            runner.commit(state, revised, config.agentsById());
        });
        tracer.trace("workflow.fanout", Map.of("fanout.id", fanOutId, "fanout.size", tasks.size()), run);
    }

    private FeedbackLoopState transition(FeedbackLoopState from, FeedbackLoopState to) {
        logger.debug("Feedback loop {} -> {}", from, to);
        return to;
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.state;

import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable store for a single run. Writes go through {@link #commit(TurnCommit)} and
 * {@link #commitAll(List)} so an output, its timeline entry and its summary always change together.
 *
 * <p>Not thread-safe: the store is confined to the coordinating thread, and concurrent work reads a
 * {@link #snapshot()} instead.</p>
 */
public final class RunState {

    private final String userInput;
    private final Map<String, String> outputs = new LinkedHashMap<>();
    private final List<TimelineEntry> timeline = new ArrayList<>();
    private final Map<String, ContextSummary> summaries = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> subAgentOutputs = new LinkedHashMap<>();
    private final List<FeedbackIteration> feedbackIterations = new ArrayList<>();
    private final Map<String, Map<Integer, String>> revisions = new LinkedHashMap<>();

    public RunState(String userInput) {
        this.userInput = Objects.requireNonNull(userInput, "userInput");
    }

    public String userInput() {
        return userInput;
    }

    public void commit(TurnCommit commit) {
        Objects.requireNonNull(commit, "commit");
        TimelineEntry entry = commit.entry();
        timeline.add(entry);
        outputs.put(entry.agentId(), entry.output());
        summaries.put(entry.agentId(), commit.summary());
        if (!commit.subAgentOutputs().isEmpty()) {
            subAgentOutputs.put(entry.agentId(), new LinkedHashMap<>(commit.subAgentOutputs()));
        }
        if (commit.revisionIteration() != null) {
            revisions.computeIfAbsent(entry.agentId(), ignored -> new LinkedHashMap<>())
                    .put(commit.revisionIteration(), entry.output());
        }
    }

    /** Commits a completed fan-out in order. Callers invoke this only once every member has finished. */
    public void commitAll(List<TurnCommit> commits) {
        List<TurnCommit> ordered = List.copyOf(commits);
        ordered.forEach(this::commit);
    }

    public void recordFeedbackIteration(FeedbackIteration iteration) {
        feedbackIterations.add(Objects.requireNonNull(iteration, "iteration"));
    }

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(userInput, new ArrayList<>(summaries.values()), outputs);
    }

    public Optional<String> output(String agentId) {
        return Optional.ofNullable(outputs.get(agentId));
    }

    public Map<String, String> outputs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public List<TimelineEntry> timeline() {
        return List.copyOf(timeline);
    }

    public Optional<ContextSummary> summary(String agentId) {
        return Optional.ofNullable(summaries.get(agentId));
    }

    /** Latest summary per agent, ordered by each agent's first commit. */
    public List<ContextSummary> summaries() {
        return List.copyOf(summaries.values());
    }

    public Map<String, String> subAgentOutputs(String parentId) {
        Map<String, String> outputsOfParent = subAgentOutputs.get(parentId);
        return outputsOfParent == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputsOfParent));
    }

    public List<FeedbackIteration> feedbackIterations() {
        return List.copyOf(feedbackIterations);
    }

    public Map<Integer, String> revisions(String agentId) {
        Map<Integer, String> byIteration = revisions.get(agentId);
        return byIteration == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byIteration));
    }

    /** Outcome of the feedback loop, empty when the run had none. */
    public Optional<FeedbackOutcome> feedbackOutcome() {
        if (feedbackIterations.isEmpty()) {
            return Optional.empty();
        }
        FeedbackIteration last = feedbackIterations.get(feedbackIterations.size() - 1);
        return Optional.of(new FeedbackOutcome(last.approved(), feedbackIterations.size()));
    }

    /** Output of the most recent turn, or empty before the first commit. */
    public Optional<String> finalOutput() {
        if (timeline.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(timeline.get(timeline.size() - 1).output());
    }
}

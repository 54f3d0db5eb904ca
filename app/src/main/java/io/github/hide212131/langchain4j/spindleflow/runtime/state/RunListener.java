package io.github.hide212131.langchain4j.spindleflow.runtime.state;

/**
 * Read-only observer of a run. Callbacks fire on the coordinating thread right after the matching
 * state commit.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {};

    default void onTurnCompleted(TimelineEntry entry) {}

    default void onFeedbackIteration(FeedbackIteration iteration) {}
}

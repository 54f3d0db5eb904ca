package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

/**
 * Final position of a feedback loop.
 *
 * @param iterations number of review rounds that ran
 */
public record FeedbackLoopResult(FeedbackLoopState state, boolean approved, int iterations) {

    public FeedbackLoopResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Feedback loop ended in non-terminal state " + state);
        }
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.workflow;

/** Phases of the review/revise loop. */
public enum FeedbackLoopState {
    INITIAL,
    REVIEW,
    REVISE,
    APPROVED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == APPROVED || this == EXHAUSTED;
    }
}

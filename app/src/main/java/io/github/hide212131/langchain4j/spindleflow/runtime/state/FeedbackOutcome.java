package io.github.hide212131.langchain4j.spindleflow.runtime.state;

/** Terminal result of a feedback loop: approved, or unapproved after {@code iterations} reviews. */
public record FeedbackOutcome(boolean approved, int iterations) {}

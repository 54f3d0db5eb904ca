package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.List;
import java.util.Objects;

/** Review/revise loop settings attached to a parallel workflow's aggregator. */
public record FeedbackLoopSettings(
        boolean enabled,
        int maxIterations,
        String approvalKeyword,
        List<String> feedbackTargets) {

    public static final int MIN_ITERATIONS = 1;
    public static final int MAX_ITERATIONS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 5;
    public static final String DEFAULT_APPROVAL_KEYWORD = "APPROVED";

    public FeedbackLoopSettings {
        Objects.requireNonNull(approvalKeyword, "approvalKeyword");
        feedbackTargets = feedbackTargets == null ? List.of() : List.copyOf(feedbackTargets);
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One review round of a feedback loop; feedback keeps the reviewer's target order. */
public record FeedbackIteration(
        int iteration,
        String reviewerOutput,
        boolean approved,
        Map<String, String> feedback,
        Instant timestamp) {

    public FeedbackIteration {
        Objects.requireNonNull(timestamp, "timestamp");
        reviewerOutput = reviewerOutput == null ? "" : reviewerOutput;
        feedback = feedback == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(feedback));
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.feedback;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Parsed reviewer verdict: approval plus feedback per target agent, in target order. */
public record FeedbackResult(boolean approved, Map<String, String> feedback) {

    public FeedbackResult {
        feedback = feedback == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(feedback));
    }

    public Optional<String> feedbackFor(String agentId) {
        return Optional.ofNullable(feedback.get(agentId));
    }
}

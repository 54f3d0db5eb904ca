package io.github.hide212131.langchain4j.spindleflow.runtime.context;

import java.util.List;
import java.util.Objects;

/**
 * Bounded structured compression of one agent's latest output.
 *
 * @param outputReference id of the agent whose full output lives in the run timeline
 */
public record ContextSummary(
        String agentId,
        String role,
        List<String> keyInsights,
        List<String> decisions,
        List<String> artifacts,
        List<String> nextSteps,
        String outputReference) {

    public static final int MAX_KEY_INSIGHTS = 5;

    public ContextSummary {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(role, "role");
        keyInsights = keyInsights == null
                ? List.of()
                : List.copyOf(keyInsights.subList(0, Math.min(MAX_KEY_INSIGHTS, keyInsights.size())));
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        outputReference = outputReference == null ? agentId : outputReference;
    }

    public static ContextSummary of(String agentId, String role, List<String> keyInsights) {
        return new ContextSummary(agentId, role, keyInsights, List.of(), List.of(), List.of(), agentId);
    }

    /** Every list item joined by spaces, for keyword matching. */
    public String searchableText() {
        StringBuilder text = new StringBuilder();
        for (List<String> items : List.of(keyInsights, decisions, artifacts, nextSteps)) {
            for (String item : items) {
                text.append(item).append(' ');
            }
        }
        return text.toString().trim();
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** A stored memory returned for a query, with its relevance score in {@code [0, 1]}. */
public record RelevantMemory(
        String agentId,
        String role,
        String content,
        List<String> keyInsights,
        List<String> decisions,
        Instant timestamp,
        double score) {

    public RelevantMemory {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }
}

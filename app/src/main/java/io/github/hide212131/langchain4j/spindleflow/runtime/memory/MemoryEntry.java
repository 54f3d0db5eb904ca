package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** A finished agent turn offered to long-term memory. */
public record MemoryEntry(
        String agentId,
        String role,
        String content,
        List<String> keyInsights,
        List<String> decisions,
        List<String> artifacts,
        Instant timestamp) {

    public MemoryEntry {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(timestamp, "timestamp");
        content = content == null ? "" : content;
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /** Text that gets embedded: role, insights and decisions. */
    public String embeddingText() {
        return role + ": " + String.join(" ", keyInsights) + ". " + String.join(" ", decisions);
    }
}

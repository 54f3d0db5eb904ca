package io.github.hide212131.langchain4j.spindleflow.runtime.tool;

import java.util.Objects;

/** Outcome of one tool call. A failed call carries the error message as payload. */
public record ToolResult(String toolName, boolean success, long durationMs, String payload) {

    public ToolResult {
        Objects.requireNonNull(toolName, "toolName");
        payload = payload == null ? "" : payload;
    }
}

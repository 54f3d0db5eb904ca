package io.github.hide212131.langchain4j.spindleflow.runtime.tool;

import java.util.List;

/**
 * Runs an agent's declared tools before its model call.
 */
public interface ToolInvoker {

    List<ToolResult> invoke(List<String> toolNames, ToolContext context);

    /** Renders results for inclusion in a prompt; empty when there is nothing to show. */
    static String format(List<ToolResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (ToolResult result : results) {
            text.append('[').append(result.toolName()).append("] ");
            text.append(result.success() ? "succeeded" : "failed");
            text.append(" in ").append(result.durationMs()).append("ms\n");
            text.append(result.payload()).append("\n\n");
        }
        return text.toString().trim();
    }
}

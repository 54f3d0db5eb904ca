package io.github.hide212131.langchain4j.spindleflow.runtime.state;

import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one finished agent turn writes into a {@link RunState}.
 *
 * @param revisionIteration set when the turn revised an earlier output
 */
public record TurnCommit(
        TimelineEntry entry,
        ContextSummary summary,
        Map<String, String> subAgentOutputs,
        Integer revisionIteration) {

    public TurnCommit {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(summary, "summary");
        if (!summary.agentId().equals(entry.agentId())) {
            throw new IllegalArgumentException(
                    "Summary for '" + summary.agentId() + "' cannot be committed with a turn of '" + entry.agentId() + "'");
        }
        subAgentOutputs = subAgentOutputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(subAgentOutputs));
    }

    public TurnCommit(TimelineEntry entry, ContextSummary summary) {
        this(entry, summary, Map.of(), null);
    }

    public TurnCommit withEntry(TimelineEntry replacement) {
        return new TurnCommit(replacement, summary, subAgentOutputs, revisionIteration);
    }
}

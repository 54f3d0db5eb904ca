package io.github.hide212131.langchain4j.spindleflow.runtime.state;

import io.github.hide212131.langchain4j.spindleflow.runtime.context.ContextSummary;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time view of a {@link RunState}. Concurrent tasks read this instead of the live
 * store, so sibling branches never observe each other's results.
 */
public record ContextSnapshot(String userInput, List<ContextSummary> summaries, Map<String, String> outputs) {

    public ContextSnapshot {
        Objects.requireNonNull(userInput, "userInput");
        summaries = List.copyOf(summaries);
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static ContextSnapshot initial(String userInput) {
        return new ContextSnapshot(userInput, List.of(), Map.of());
    }
}

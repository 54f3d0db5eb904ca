package io.github.hide212131.langchain4j.spindleflow.runtime.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Arguments handed to every tool: the run's input and the outputs visible to the calling agent. */
public record ToolContext(String userInput, Map<String, String> previousOutputs) {

    public ToolContext {
        Objects.requireNonNull(userInput, "userInput");
        previousOutputs = previousOutputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(previousOutputs));
    }
}

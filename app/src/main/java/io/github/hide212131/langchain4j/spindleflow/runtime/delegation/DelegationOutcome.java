package io.github.hide212131.langchain4j.spindleflow.runtime.delegation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Result of a delegated turn: the plan followed, each sub-agent's output and the synthesized output. */
public record DelegationOutcome(DelegationPlan plan, Map<String, String> subAgentOutputs, String output) {

    public DelegationOutcome {
        Objects.requireNonNull(plan, "plan");
        subAgentOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(subAgentOutputs));
        output = output == null ? "" : output;
    }
}

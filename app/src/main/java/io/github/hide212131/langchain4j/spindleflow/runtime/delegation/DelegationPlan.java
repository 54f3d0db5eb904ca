package io.github.hide212131.langchain4j.spindleflow.runtime.delegation;

import java.util.List;
import java.util.Objects;

/**
 * Which sub-agents a parent invokes and how. Ids are validated against the parent's declared
 * sub-agents before a plan is built.
 *
 * @param fallback true when the plan replaced an unusable planner response
 */
public record DelegationPlan(List<String> subAgentIds, Mode mode, String reason, boolean fallback) {

    public enum Mode {
        SEQUENTIAL,
        PARALLEL
    }

    public DelegationPlan {
        subAgentIds = List.copyOf(Objects.requireNonNull(subAgentIds, "subAgentIds"));
        Objects.requireNonNull(mode, "mode");
        reason = reason == null ? "" : reason;
    }

    public static DelegationPlan sequential(List<String> subAgentIds, String reason) {
        return new DelegationPlan(subAgentIds, Mode.SEQUENTIAL, reason, false);
    }

    public static DelegationPlan parallel(List<String> subAgentIds, String reason) {
        return new DelegationPlan(subAgentIds, Mode.PARALLEL, reason, false);
    }

    public static DelegationPlan fallback(List<String> subAgentIds) {
        return new DelegationPlan(subAgentIds, Mode.SEQUENTIAL, "Fallback: using all sub-agents", true);
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.delegation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.SubAgentDefinition;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.LenientJson;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a planner response of the form {@code {"sub_agents": [...], "sequence": ..., "reason": ...}}.
 * Unknown ids are dropped; anything unusable yields an empty result so the caller can fall back.
 */
public final class DelegationPlanParser {

    public Optional<DelegationPlan> parse(String response, List<SubAgentDefinition> declared) {
        Optional<JsonNode> node = LenientJson.extractObject(response);
        if (node.isEmpty()) {
            return Optional.empty();
        }
        JsonNode json = node.get();
        JsonNode requested = json.get("sub_agents");
        if (requested == null || !requested.isArray()) {
            return Optional.empty();
        }
        Set<String> declaredIds = new LinkedHashSet<>();
        declared.forEach(sub -> declaredIds.add(sub.id()));
        Set<String> selected = new LinkedHashSet<>();
        for (JsonNode item : requested) {
            String id = item.asText("").trim();
            if (declaredIds.contains(id)) {
                selected.add(id);
            }
        }
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        JsonNode reasonNode = json.get("reason");
        String reason = reasonNode != null && reasonNode.isTextual() ? reasonNode.asText() : "No reason provided";
        JsonNode sequence = json.get("sequence");
        boolean parallel = sequence != null
                && "parallel".equals(sequence.asText("").trim().toLowerCase(Locale.ROOT));
        List<String> ids = List.copyOf(selected);
        return Optional.of(parallel ? DelegationPlan.parallel(ids, reason) : DelegationPlan.sequential(ids, reason));
    }
}

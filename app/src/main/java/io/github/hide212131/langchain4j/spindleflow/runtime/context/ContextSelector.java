package io.github.hide212131.langchain4j.spindleflow.runtime.context;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.runtime.config.AgentDefinition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Ranks summaries by relevance to an agent: 40% recency, 40% goal keyword overlap, 20% content
 * richness. Ties keep their original order.
 */
public final class ContextSelector {

    public static final int DEFAULT_MAX_ITEMS = 5;

    private static final double RECENCY_WEIGHT = 0.4;
    private static final double KEYWORD_WEIGHT = 0.4;
    private static final double RICHNESS_WEIGHT = 0.2;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "be",
            "been", "being", "have", "has", "had", "do", "does", "did", "will",
            "would", "should", "could", "may", "might", "must", "can", "this",
            "that", "these", "those", "it", "its");

    private final WorkflowLogger logger;

    public ContextSelector(WorkflowLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public List<ContextSummary> select(AgentDefinition agent, List<ContextSummary> summaries, int maxItems) {
        return select(agent.id(), agent.goal(), summaries, maxItems);
    }

    public List<ContextSummary> select(String agentId, String goal, List<ContextSummary> summaries, int maxItems) {
        if (summaries.isEmpty() || maxItems <= 0) {
            return List.of();
        }
        List<String> goalKeywords = extractKeywords(goal);
        List<Scored> scored = new ArrayList<>(summaries.size());
        for (int i = 0; i < summaries.size(); i++) {
            ContextSummary summary = summaries.get(i);
            scored.add(new Scored(summary, score(goalKeywords, summary, i, summaries.size())));
        }
        // List.sort is stable, so equal scores keep pool order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<ContextSummary> selected = scored.stream()
                .limit(maxItems)
                .map(Scored::summary)
                .toList();
        logger.debug("Selected {} of {} summaries for {}", selected.size(), summaries.size(), agentId);
        return selected;
    }

    double score(List<String> goalKeywords, ContextSummary summary, int position, int total) {
        double recency = (double) position / total;
        return RECENCY_WEIGHT * recency
                + KEYWORD_WEIGHT * keywordOverlap(goalKeywords, summary)
                + RICHNESS_WEIGHT * richness(summary);
    }

    static double keywordOverlap(List<String> goalKeywords, ContextSummary summary) {
        if (goalKeywords.isEmpty()) {
            return 0.0;
        }
        String text = summary.searchableText().toLowerCase(Locale.ROOT);
        long matches = goalKeywords.stream().filter(text::contains).count();
        return (double) matches / goalKeywords.size();
    }

    static double richness(ContextSummary summary) {
        return Math.min(summary.keyInsights().size() / 5.0, 1.0) * 0.4
                + Math.min(summary.decisions().size() / 3.0, 1.0) * 0.3
                + Math.min(summary.artifacts().size() / 3.0, 1.0) * 0.2
                + Math.min(summary.nextSteps().size() / 3.0, 1.0) * 0.1;
    }

    static List<String> extractKeywords(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ").split("\\s+"))
                .filter(word -> word.length() > 2 && !STOP_WORDS.contains(word))
                .toList();
    }

    private record Scored(ContextSummary summary, double score) {}
}

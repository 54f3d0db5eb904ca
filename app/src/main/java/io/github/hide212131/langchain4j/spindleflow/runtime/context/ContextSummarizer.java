package io.github.hide212131.langchain4j.spindleflow.runtime.context;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.spindleflow.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.spindleflow.runtime.support.LenientJson;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compresses agent output into a {@link ContextSummary} through a model call. Never throws: model or
 * parse failures degrade to a truncated-output summary.
 */
public final class ContextSummarizer {

    static final int CACHE_KEY_PREFIX_LENGTH = 100;
    static final int FALLBACK_LENGTH = 250;
    static final double TEMPERATURE = 0.3;

    static final String SYSTEM_PROMPT =
            "You are a precise context summarization assistant. Extract and structure key information from agent outputs.";

    private final LangChain4jLlmClient llmClient;
    private final WorkflowLogger logger;
    private final Map<String, ContextSummary> cache = new ConcurrentHashMap<>();

    public ContextSummarizer(LangChain4jLlmClient llmClient, WorkflowLogger logger) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public ContextSummary summarize(String output, String agentId, String role) {
        String text = output == null ? "" : output;
        String cacheKey = agentId + "-" + text.substring(0, Math.min(CACHE_KEY_PREFIX_LENGTH, text.length()));
        ContextSummary cached = cache.get(cacheKey);
        if (cached != null) {
            logger.debug("Summary cache hit for {}", agentId);
            return cached;
        }
        Optional<ContextSummary> parsed;
        try {
            String response = llmClient.generate(SYSTEM_PROMPT, buildPrompt(role, text), TEMPERATURE).content();
            parsed = parse(response, agentId, role);
        } catch (RuntimeException e) {
            logger.warn("Summarization failed for {}; using truncated output: {}", agentId, e.getMessage());
            return fallback(text, agentId, role);
        }
        if (parsed.isEmpty()) {
            logger.warn("Summarization response for {} was not valid JSON; using truncated output", agentId);
            return fallback(text, agentId, role);
        }
        ContextSummary summary = parsed.get();
        cache.put(cacheKey, summary);
        logger.debug("Summarized {}: {} insights, {} decisions, {} artifacts, {} next steps",
                agentId,
                summary.keyInsights().size(),
                summary.decisions().size(),
                summary.artifacts().size(),
                summary.nextSteps().size());
        return summary;
    }

    public void clearCache() {
        cache.clear();
    }

    int cacheSize() {
        return cache.size();
    }

    static String buildPrompt(String role, String output) {
        return """
                Extract key information from the following agent output:

                Agent Role: %s
                Output: %s

                Provide a structured summary in the following JSON format:
                {
                  "keyInsights": ["insight1", "insight2", "insight3"],
                  "decisions": ["decision1", "decision2"],
                  "artifacts": ["artifact1", "artifact2"],
                  "nextSteps": ["step1", "step2"]
                }

                Guidelines:
                - keyInsights: 3-5 most important findings or observations
                - decisions: Key decisions or choices made
                - artifacts: Files, outputs, or deliverables created (if any)
                - nextSteps: Recommendations or suggestions for subsequent work

                Keep the entire summary under 250 words. Focus on actionable and relevant information.
                Return ONLY the JSON object, no additional text.""".formatted(role, output);
    }

    private static Optional<ContextSummary> parse(String response, String agentId, String role) {
        Optional<JsonNode> node = LenientJson.extractObject(response);
        if (node.isEmpty()) {
            return Optional.empty();
        }
        JsonNode json = node.get();
        return Optional.of(new ContextSummary(
                agentId,
                role,
                LenientJson.stringArray(json, "keyInsights"),
                LenientJson.stringArray(json, "decisions"),
                LenientJson.stringArray(json, "artifacts"),
                LenientJson.stringArray(json, "nextSteps"),
                agentId));
    }

    static ContextSummary fallback(String output, String agentId, String role) {
        String trimmed = output.strip();
        String insight = trimmed.isEmpty()
                ? "(no output)"
                : trimmed.substring(0, Math.min(FALLBACK_LENGTH, trimmed.length()));
        return new ContextSummary(agentId, role, List.of(insight), List.of(), List.of(), List.of(), agentId);
    }
}

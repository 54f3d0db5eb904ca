package io.github.hide212131.langchain4j.spindleflow.runtime.provider;

import java.time.Duration;
import java.util.Objects;

/** Resolved provider settings. */
public record LlmConfiguration(
        LlmProvider provider,
        String openAiApiKey,
        String openAiBaseUrl,
        String openAiModel,
        Duration timeout,
        String embeddingModel) {

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public LlmConfiguration {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(timeout, "timeout");
    }

    public String maskedApiKey() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            return "(none)";
        }
        if (openAiApiKey.length() <= MASK_THRESHOLD) {
            return "****";
        }
        return "****" + openAiApiKey.substring(openAiApiKey.length() - MASK_SUFFIX_LENGTH);
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.provider;

import java.util.Locale;

/**
 * Language model backend selected for a run.
 */
public enum LlmProvider {
    MOCK,
    OPENAI;

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return MOCK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "openai" -> OPENAI;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Unsupported LLM_PROVIDER value: " + value);
        };
    }
}

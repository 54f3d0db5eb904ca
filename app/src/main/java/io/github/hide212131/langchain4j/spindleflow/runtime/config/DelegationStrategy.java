package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.Locale;

/** How a parent agent selects and orders its sub-agents. */
public enum DelegationStrategy {
    AUTO,
    SEQUENTIAL,
    PARALLEL;

    public static DelegationStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "sequential" -> SEQUENTIAL;
            case "parallel" -> PARALLEL;
            default -> throw new IllegalArgumentException("Unknown delegation strategy: " + value);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

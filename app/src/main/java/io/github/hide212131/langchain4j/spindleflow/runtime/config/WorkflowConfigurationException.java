package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.List;

/**
 * Raised when a workflow file cannot be read, parsed or validated. Carries remediation hints for
 * the command line.
 */
public final class WorkflowConfigurationException extends RuntimeException {

    private final List<String> hints;

    public WorkflowConfigurationException(String message, List<String> hints) {
        super(message);
        this.hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public WorkflowConfigurationException(String message, List<String> hints, Throwable cause) {
        super(message, cause);
        this.hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public List<String> hints() {
        return hints;
    }
}

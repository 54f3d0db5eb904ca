package io.github.hide212131.langchain4j.spindleflow.infra.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the workflow runtime.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger() {
        this(WorkflowLogger.class);
    }

    public WorkflowLogger(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(owner);
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }
}

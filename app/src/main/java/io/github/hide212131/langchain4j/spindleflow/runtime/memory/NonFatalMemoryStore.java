package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import java.util.List;
import java.util.Objects;

final class NonFatalMemoryStore implements MemoryStore {

    private final MemoryStore delegate;
    private final WorkflowLogger logger;

    NonFatalMemoryStore(MemoryStore delegate, WorkflowLogger logger) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public List<RelevantMemory> query(String text, int topK) {
        try {
            return delegate.query(text, topK);
        } catch (RuntimeException e) {
            logger.warn("Memory query failed; continuing without memories: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void store(MemoryEntry entry) {
        try {
            delegate.store(entry);
        } catch (RuntimeException e) {
            logger.warn("Failed to store memory for {}: {}", entry.agentId(), e.getMessage());
        }
    }
}

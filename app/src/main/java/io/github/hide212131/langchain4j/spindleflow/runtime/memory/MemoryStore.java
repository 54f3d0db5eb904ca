package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import java.util.List;

/**
 * Semantic memory shared across runs. Implementations may be called from several worker threads.
 */
public interface MemoryStore {

    List<RelevantMemory> query(String text, int topK);

    void store(MemoryEntry entry);

    /** Store used when memory is not configured: queries return nothing and writes are dropped. */
    static MemoryStore noop() {
        return NoopMemoryStore.INSTANCE;
    }

    /** Wraps a store so query and write failures are logged instead of thrown. */
    static MemoryStore nonFatal(MemoryStore delegate, WorkflowLogger logger) {
        return new NonFatalMemoryStore(delegate, logger);
    }
}

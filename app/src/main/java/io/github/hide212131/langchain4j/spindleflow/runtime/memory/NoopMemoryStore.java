package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import java.util.List;

enum NoopMemoryStore implements MemoryStore {
    INSTANCE;

    @Override
    public List<RelevantMemory> query(String text, int topK) {
        return List.of();
    }

    @Override
    public void store(MemoryEntry entry) {
    }
}

package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.nio.file.Path;

/** Persistent memory settings; a disabled instance turns memory lookups into no-ops. */
public record MemorySettings(boolean enabled, Path storePath, int topK) {

    public static final int DEFAULT_TOP_K = 5;
    public static final Path DEFAULT_STORE_PATH = Path.of(".spindleflow", "memory.json");

    public static MemorySettings disabled() {
        return new MemorySettings(false, DEFAULT_STORE_PATH, DEFAULT_TOP_K);
    }
}

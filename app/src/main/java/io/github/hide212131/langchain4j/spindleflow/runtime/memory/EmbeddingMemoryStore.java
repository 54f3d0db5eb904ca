package io.github.hide212131.langchain4j.spindleflow.runtime.memory;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Memory backed by a LangChain4j {@link EmbeddingModel} and an {@link InMemoryEmbeddingStore}. When a
 * file is given the store is loaded from it on creation and rewritten after every write.
 */
public final class EmbeddingMemoryStore implements MemoryStore {

    static final int MAX_CONTENT_LENGTH = 40_000;
    private static final String LIST_SEPARATOR = "\n";

    private final EmbeddingModel embeddingModel;
    private final InMemoryEmbeddingStore<TextSegment> store;
    private final Path file;
    private final WorkflowLogger logger;

    private EmbeddingMemoryStore(
            EmbeddingModel embeddingModel, InMemoryEmbeddingStore<TextSegment> store, Path file, WorkflowLogger logger) {
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        this.store = Objects.requireNonNull(store, "store");
        this.file = file;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static EmbeddingMemoryStore inMemory(EmbeddingModel embeddingModel, WorkflowLogger logger) {
        return new EmbeddingMemoryStore(embeddingModel, new InMemoryEmbeddingStore<>(), null, logger);
    }

    public static EmbeddingMemoryStore persistent(EmbeddingModel embeddingModel, Path file, WorkflowLogger logger) {
        Objects.requireNonNull(file, "file");
        InMemoryEmbeddingStore<TextSegment> store;
        if (Files.isRegularFile(file)) {
            try {
                store = InMemoryEmbeddingStore.fromFile(file);
                logger.info("Loaded persistent memory from {}", file);
            } catch (RuntimeException e) {
                logger.warn("Persistent memory at {} is unreadable, starting empty: {}", file, e.getMessage());
                store = new InMemoryEmbeddingStore<>();
            }
        } else {
            store = new InMemoryEmbeddingStore<>();
        }
        return new EmbeddingMemoryStore(embeddingModel, store, file, logger);
    }

    @Override
    public List<RelevantMemory> query(String text, int topK) {
        Embedding queryEmbedding = embeddingModel.embed(text).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(topK)
                .minScore(0.0)
                .build();
        List<RelevantMemory> memories = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : store.search(request).matches()) {
            TextSegment segment = match.embedded();
            if (segment == null) {
                continue;
            }
            memories.add(toMemory(segment.metadata(), match.score()));
        }
        logger.debug("Memory query returned {} matches", memories.size());
        return memories;
    }

    @Override
    public synchronized void store(MemoryEntry entry) {
        String embeddingText = entry.embeddingText();
        Embedding embedding = embeddingModel.embed(embeddingText).content();
        Metadata metadata = new Metadata()
                .put("agentId", entry.agentId())
                .put("role", entry.role())
                .put("content", truncate(entry.content()))
                .put("keyInsights", String.join(LIST_SEPARATOR, entry.keyInsights()))
                .put("decisions", String.join(LIST_SEPARATOR, entry.decisions()))
                .put("artifacts", String.join(LIST_SEPARATOR, entry.artifacts()))
                .put("timestamp", entry.timestamp().toEpochMilli());
        store.add(embedding, TextSegment.from(embeddingText, metadata));
        if (file != null) {
            persist();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create memory directory for " + file, e);
        }
        store.serializeToFile(file);
    }

    private static RelevantMemory toMemory(Metadata metadata, Double score) {
        Long timestamp = metadata.getLong("timestamp");
        return new RelevantMemory(
                valueOrEmpty(metadata.getString("agentId")),
                valueOrEmpty(metadata.getString("role")),
                valueOrEmpty(metadata.getString("content")),
                split(metadata.getString("keyInsights")),
                split(metadata.getString("decisions")),
                timestamp != null ? Instant.ofEpochMilli(timestamp) : null,
                score != null ? Math.max(0.0, Math.min(1.0, score)) : 0.0);
    }

    private static List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(LIST_SEPARATOR)).filter(item -> !item.isBlank()).toList();
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String truncate(String content) {
        return content.length() <= MAX_CONTENT_LENGTH ? content : content.substring(0, MAX_CONTENT_LENGTH);
    }
}

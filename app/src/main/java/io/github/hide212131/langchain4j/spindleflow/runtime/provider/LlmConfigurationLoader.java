package io.github.hide212131.langchain4j.spindleflow.runtime.provider;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves provider settings, preferring process environment variables and falling back to a
 * {@code .env} file.
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";
    static final String ENV_OPENAI_EMBEDDING_MODEL = "OPENAI_EMBEDDING_MODEL";

    static final String DEFAULT_MODEL = "gpt-4o-mini";
    static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-3-small";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider = overrideProvider != null
                ? overrideProvider
                : LlmProvider.from(resolveWithPriority(ENV_LLM_PROVIDER));
        String apiKey = trimToNull(resolveWithPriority(ENV_OPENAI_API_KEY));
        if (provider == LlmProvider.OPENAI && apiKey == null) {
            throw new IllegalStateException("OPENAI_API_KEY is required when LLM_PROVIDER=openai");
        }
        String model = trimToNull(resolveWithPriority(ENV_OPENAI_MODEL));
        String embeddingModel = trimToNull(resolveWithPriority(ENV_OPENAI_EMBEDDING_MODEL));
        return new LlmConfiguration(
                provider,
                apiKey,
                trimToNull(resolveWithPriority(ENV_OPENAI_BASE_URL)),
                model != null ? model : DEFAULT_MODEL,
                resolveTimeout(),
                embeddingModel != null ? embeddingModel : DEFAULT_EMBEDDING_MODEL);
    }

    private Duration resolveTimeout() {
        String raw = trimToNull(resolveWithPriority(ENV_OPENAI_TIMEOUT_SECONDS));
        if (raw == null) {
            return DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(
                    "OPENAI_TIMEOUT_SECONDS must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException("OPENAI_TIMEOUT_SECONDS must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

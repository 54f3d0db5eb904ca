package io.github.hide212131.langchain4j.spindleflow.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LlmConfigurationLoaderTest {

    private static Dotenv emptyDotenv() {
        return Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().directory("does-not-exist").load();
    }

    @Test
    @DisplayName("Defaults to the mock provider when nothing is configured")
    void defaultIsMockWhenNoEnv() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(), emptyDotenv());

        LlmConfiguration config = loader.load();

        assertThat(config.provider()).isEqualTo(LlmProvider.MOCK);
        assertThat(config.openAiApiKey()).isNull();
        assertThat(config.openAiBaseUrl()).isNull();
        assertThat(config.openAiModel()).isEqualTo(LlmConfigurationLoader.DEFAULT_MODEL);
        assertThat(config.embeddingModel()).isEqualTo(LlmConfigurationLoader.DEFAULT_EMBEDDING_MODEL);
        assertThat(config.timeout()).isEqualTo(LlmConfigurationLoader.DEFAULT_TIMEOUT);
    }

    @Test
    @DisplayName("LLM_PROVIDER=openai without a key is rejected")
    void errorWhenOpenAiKeyMissing() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_LLM_PROVIDER, "openai"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    @DisplayName("An unknown provider name is rejected")
    void errorWhenProviderUnknown() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_LLM_PROVIDER, "anthropic"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anthropic");
    }

    @Test
    @DisplayName("A dry-run override wins over the configured provider")
    void overrideProviderWins() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_LLM_PROVIDER, "openai"), emptyDotenv());

        assertThat(loader.load(LlmProvider.MOCK).provider()).isEqualTo(LlmProvider.MOCK);
    }

    @Test
    @DisplayName("Timeouts must be positive whole seconds")
    void timeoutValidation() {
        LlmConfigurationLoader custom = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_OPENAI_TIMEOUT_SECONDS, "240"), emptyDotenv());
        LlmConfigurationLoader negative = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_OPENAI_TIMEOUT_SECONDS, "-10"), emptyDotenv());
        LlmConfigurationLoader garbage = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_OPENAI_TIMEOUT_SECONDS, "soon"), emptyDotenv());

        assertThat(custom.load().timeout()).isEqualTo(Duration.ofSeconds(240));
        assertThatThrownBy(negative::load).hasMessageContaining("OPENAI_TIMEOUT_SECONDS");
        assertThatThrownBy(garbage::load).hasMessageContaining("OPENAI_TIMEOUT_SECONDS");
    }

    @Test
    @DisplayName("Environment variables win; .env is read only for missing keys")
    void preferEnvironmentOverDotenv(@TempDir Path tempDir) throws IOException {
        Files.writeString(
                tempDir.resolve(".env"),
                """
                LLM_PROVIDER=openai
                OPENAI_API_KEY=from-dotenv
                OPENAI_BASE_URL=https://api.example.com
                OPENAI_MODEL=gpt-dotenv
                OPENAI_EMBEDDING_MODEL=embed-dotenv
                """,
                StandardCharsets.UTF_8);
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMalformed()
                .ignoreIfMissing()
                .directory(tempDir.toString())
                .load();

        LlmConfigurationLoader loader = new LlmConfigurationLoader(
                Map.of(
                        LlmConfigurationLoader.ENV_LLM_PROVIDER, "mock",
                        LlmConfigurationLoader.ENV_OPENAI_API_KEY, "from-env",
                        LlmConfigurationLoader.ENV_OPENAI_BASE_URL, "",
                        LlmConfigurationLoader.ENV_OPENAI_MODEL, "gpt-env"),
                dotenv);

        LlmConfiguration config = loader.load();

        assertThat(config.provider()).isEqualTo(LlmProvider.MOCK);
        assertThat(config.openAiApiKey()).isEqualTo("from-env");
        assertThat(config.openAiBaseUrl()).isNull();
        assertThat(config.openAiModel()).isEqualTo("gpt-env");
        assertThat(config.embeddingModel()).isEqualTo("embed-dotenv");
        assertThat(config.maskedApiKey()).isEqualTo("****");
    }
}

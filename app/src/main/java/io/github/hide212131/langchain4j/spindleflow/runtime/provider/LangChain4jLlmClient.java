package io.github.hide212131.langchain4j.spindleflow.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LangChain4j wrapper exposing the {@code generate(system, user, temperature)} capability used by the
 * workflow runtime. Safe to call from several worker threads at once.
 */
public final class LangChain4jLlmClient {

    private final ChatModel chatModel;
    private final Clock clock;
    private final String modelName;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();
    private final AtomicInteger cumulativeInputTokens = new AtomicInteger();
    private final AtomicInteger cumulativeOutputTokens = new AtomicInteger();

    private LangChain4jLlmClient(ChatModel chatModel, Clock clock, String modelName) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.modelName = modelName;
    }

    public static LangChain4jLlmClient from(LlmConfiguration configuration) {
        return from(configuration, new OpenAiChatModelFactory(), Clock.systemUTC());
    }

    static LangChain4jLlmClient from(LlmConfiguration configuration, ChatModelFactory factory, Clock clock) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.provider() == LlmProvider.MOCK) {
            return new LangChain4jLlmClient(new DryRunChatModel(), clock, null);
        }
        if (configuration.openAiApiKey() == null) {
            throw new IllegalStateException("OPENAI_API_KEY must be set");
        }
        OpenAiConfig openAiConfig = new OpenAiConfig(
                configuration.openAiApiKey(),
                configuration.openAiBaseUrl(),
                configuration.openAiModel(),
                configuration.timeout());
        return new LangChain4jLlmClient(factory.create(openAiConfig), clock, openAiConfig.modelName);
    }

    public static LangChain4jLlmClient usingChatModel(ChatModel chatModel) {
        return new LangChain4jLlmClient(chatModel, Clock.systemUTC(), null);
    }

    public static LangChain4jLlmClient fake() {
        return new LangChain4jLlmClient(new DryRunChatModel(), Clock.systemUTC(), null);
    }

    /**
     * Sends one system and one user message. A {@code null} temperature leaves the model default.
     * Provider failures propagate to the caller.
     */
    public CompletionResult generate(String system, String user, Double temperature) {
        Instant start = clock.instant();
        List<ChatMessage> messages = new ArrayList<>(2);
        if (system != null && !system.isBlank()) {
            messages.add(SystemMessage.from(system));
        }
        messages.add(UserMessage.from(user == null || user.isBlank() ? "(empty)" : user));
        ChatRequestParameters parameters = temperature == null
                ? ChatRequestParameters.builder().build()
                : ChatRequestParameters.builder().temperature(temperature).build();
        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .parameters(parameters)
                .build();
        ChatResponse response = chatModel.chat(request);
        long durationMs = Duration.between(start, clock.instant()).toMillis();
        AiMessage aiMessage = response.aiMessage();
        String content = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        TokenUsage usage = response.tokenUsage();
        recordMetrics(usage, durationMs);
        return new CompletionResult(content, usage, durationMs);
    }

    public String modelName() {
        return modelName;
    }

    public ProviderMetrics metrics() {
        return new ProviderMetrics(
                callCount.get(),
                cumulativeDurationMs.get(),
                cumulativeInputTokens.get(),
                cumulativeOutputTokens.get());
    }

    public record CompletionResult(String content, TokenUsage tokenUsage, long durationMs) {}

    public record ProviderMetrics(int callCount, long totalDurationMs, int totalInputTokens, int totalOutputTokens) {
        public int totalTokenCount() {
            return totalInputTokens + totalOutputTokens;
        }
    }

    interface ChatModelFactory {
        ChatModel create(OpenAiConfig config);
    }

    static final class OpenAiConfig {
        final String apiKey;
        final String baseUrl;
        final String modelName;
        final Duration timeout;

        OpenAiConfig(String apiKey, String baseUrl, String modelName, Duration timeout) {
            this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
            this.baseUrl = baseUrl;
            this.modelName = Objects.requireNonNull(modelName, "modelName");
            this.timeout = Objects.requireNonNull(timeout, "timeout");
        }
    }

    private static final class OpenAiChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(OpenAiConfig config) {
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(config.apiKey)
                    .modelName(config.modelName)
                    .timeout(config.timeout);
            if (config.baseUrl != null) {
                builder.baseUrl(config.baseUrl);
            }
            return builder.build();
        }
    }

    /**
     * Deterministic model for dry runs: answers summarization, planning and review prompts with
     * well-formed replies so every workflow path can execute offline.
     */
    private static final class DryRunChatModel implements ChatModel {

        private static final Pattern APPROVAL_KEYWORD = Pattern.compile("respond with \"([^\"]+)\"");
        private static final Pattern SUB_AGENT_LINE = Pattern.compile("(?m)^- (\\S+) \\(");

        @Override
        public ChatResponse doChat(ChatRequest request) {
            String system = "";
            for (ChatMessage message : request.messages()) {
                if (message instanceof SystemMessage systemMessage) {
                    system = systemMessage.text();
                }
            }
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(reply(system)))
                    .tokenUsage(new TokenUsage(0, 0, 0))
                    .build();
        }

        private String reply(String system) {
            if (system.contains("context summarization")) {
                return "{\"keyInsights\":[\"dry-run insight\"],\"decisions\":[],\"artifacts\":[],\"nextSteps\":[]}";
            }
            Matcher keyword = APPROVAL_KEYWORD.matcher(system);
            if (keyword.find()) {
                return keyword.group(1) + " - dry-run review";
            }
            if (system.contains("team lead with specialized sub-agents")) {
                List<String> ids = new ArrayList<>();
                Matcher line = SUB_AGENT_LINE.matcher(system);
                while (line.find()) {
                    ids.add("\"" + line.group(1) + "\"");
                }
                return "{\"sub_agents\":" + ids + ",\"sequence\":\"sequential\",\"reason\":\"dry-run\"}";
            }
            String firstLine = system.lines().findFirst().orElse("assistant");
            return "[dry-run] " + firstLine;
        }
    }

    private void recordMetrics(TokenUsage usage, long durationMs) {
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        if (usage != null) {
            if (usage.inputTokenCount() != null) {
                cumulativeInputTokens.addAndGet(usage.inputTokenCount());
            }
            if (usage.outputTokenCount() != null) {
                cumulativeOutputTokens.addAndGet(usage.outputTokenCount());
            }
        }
    }
}

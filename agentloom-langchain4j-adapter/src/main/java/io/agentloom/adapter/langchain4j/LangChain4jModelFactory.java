package io.agentloom.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// Creates LangChain4j models, reasoning engines and history compressors by model name.
///
/// ### Supported prefixes
/// - `claude` - Anthropic
/// - `gpt`, `o1` - OpenAI
/// - `deepseek` - DeepSeek through the OpenAI-compatible API at {@value #DEEPSEEK_BASE_URL}
///
/// API keys are looked up in the credentials map under the provider key
/// (`anthropic_api_key`, `openai_api_key`, `deepseek_api_key`) or the matching
/// environment-style name (`ANTHROPIC_API_KEY`, ...).
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
///
/// @see LangChain4jReasoningEngine
/// @see LangChain4jHistoryCompressor
public class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final long DEFAULT_TIMEOUT_SECONDS = 60;
    private static final double DEFAULT_TEMPERATURE = 0.7;

    /// @param modelName model name, may be null
    /// @return `true` if a provider is known for the name
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("deepseek");
    }

    /// Creates a reasoning engine over a streaming model.
    ///
    /// @param options model parameters, not null
    /// @param credentials API keys, not null
    /// @return new engine, never null
    /// @throws IllegalArgumentException if the model is not supported
    /// @throws IllegalStateException if the required API key is missing
    public LangChain4jReasoningEngine createReasoningEngine(
            ModelOptions options, Map<String, String> credentials) {
        logger.info("Creating LangChain4j reasoning engine with model: " + options.model());
        return new LangChain4jReasoningEngine(createStreamingModel(options, credentials));
    }

    /// Creates a summarizing history compressor over a blocking model.
    ///
    /// @param options model parameters, not null
    /// @param credentials API keys, not null
    /// @return new compressor, never null
    public LangChain4jHistoryCompressor createHistoryCompressor(
            ModelOptions options, Map<String, String> credentials) {
        logger.info("Creating LangChain4j history compressor with model: " + options.model());
        return new LangChain4jHistoryCompressor(createChatModel(options, credentials));
    }

    /// Creates the streaming model for the name's provider.
    ///
    /// @param options model parameters, not null
    /// @param credentials API keys, not null
    /// @return configured model, never null
    public StreamingChatModel createStreamingModel(
            ModelOptions options, Map<String, String> credentials) {
        String modelName = options.model();

        if (modelName.startsWith("claude")) {
            var builder =
                    AnthropicStreamingChatModel.builder()
                            .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                            .modelName(modelName)
                            .temperature(temperature(options))
                            .maxTokens(maxTokens(options))
                            .timeout(timeout(options));
            if (options.topP() != null) builder.topP(options.topP());
            return builder.build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return openAiStreaming(options, credentials, null);
        } else if (modelName.startsWith("deepseek")) {
            return openAiStreaming(options, credentials, DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    /// Creates the blocking model for the name's provider.
    ///
    /// @param options model parameters, not null
    /// @param credentials API keys, not null
    /// @return configured model, never null
    public ChatModel createChatModel(ModelOptions options, Map<String, String> credentials) {
        String modelName = options.model();

        if (modelName.startsWith("claude")) {
            var builder =
                    AnthropicChatModel.builder()
                            .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                            .modelName(modelName)
                            .temperature(temperature(options))
                            .maxTokens(maxTokens(options))
                            .timeout(timeout(options));
            if (options.topP() != null) builder.topP(options.topP());
            return builder.build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return openAi(options, credentials, null);
        } else if (modelName.startsWith("deepseek")) {
            return openAi(options, credentials, DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private StreamingChatModel openAiStreaming(
            ModelOptions options, Map<String, String> credentials, String baseUrl) {
        var builder =
                OpenAiStreamingChatModel.builder()
                        .apiKey(openAiKey(credentials, baseUrl))
                        .modelName(options.model())
                        .temperature(temperature(options))
                        .maxTokens(maxTokens(options))
                        .timeout(timeout(options));
        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (options.topP() != null) builder.topP(options.topP());
        return builder.build();
    }

    private ChatModel openAi(ModelOptions options, Map<String, String> credentials, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(openAiKey(credentials, baseUrl))
                        .modelName(options.model())
                        .temperature(temperature(options))
                        .maxTokens(maxTokens(options))
                        .timeout(timeout(options));
        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (options.topP() != null) builder.topP(options.topP());
        return builder.build();
    }

    private String openAiKey(Map<String, String> credentials, String baseUrl) {
        if (DEEPSEEK_BASE_URL.equals(baseUrl)) {
            return requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY");
        }
        return requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");
    }

    /// Looks up an API key, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-null value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private double temperature(ModelOptions options) {
        return options.temperature() != null ? options.temperature() : DEFAULT_TEMPERATURE;
    }

    private int maxTokens(ModelOptions options) {
        return options.maxTokens() != null ? options.maxTokens() : DEFAULT_MAX_TOKENS;
    }

    private Duration timeout(ModelOptions options) {
        return Duration.ofSeconds(
                options.timeoutSeconds() != null ? options.timeoutSeconds() : DEFAULT_TIMEOUT_SECONDS);
    }
}

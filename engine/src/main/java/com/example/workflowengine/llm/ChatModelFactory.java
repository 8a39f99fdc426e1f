package com.example.workflowengine.llm;

import dev.langchain4j.http.client.jdk.JdkHttpClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds a {@link ChatModel} for an OpenAI-compatible chat-completion endpoint configured on an agent component.
 * <p>
 * Requests are posted to the component's {@code api_url} exactly as configured; no
 * {@code /chat/completions} path is appended.
 * </p>
 */
@Component
public class ChatModelFactory {

    private final Duration timeout;
    private final double defaultTemperature;
    private final int defaultMaxTokens;

    public ChatModelFactory(
            @Value("${engine.llm.timeout:30s}") Duration timeout,
            @Value("${engine.llm.temperature:0.7}") double defaultTemperature,
            @Value("${engine.llm.max-tokens:1500}") int defaultMaxTokens) {
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    /**
     * Builds a ChatModel for the given endpoint. Null temperature or maxTokens fall back to the configured defaults.
     */
    public ChatModel build(String apiUrl, String apiKey, String modelName, Double temperature, Integer maxTokens) {
        Objects.requireNonNull(apiUrl, "apiUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(modelName, "modelName");
        String url = apiUrl.trim();
        return OpenAiChatModel.builder()
                .httpClientBuilder(new FixedUrlHttpClientBuilder(url, JdkHttpClient.builder()
                        .connectTimeout(timeout)
                        .readTimeout(timeout)))
                .apiKey(apiKey.trim())
                .baseUrl(url)
                .modelName(modelName.trim())
                .temperature(temperature != null ? temperature : defaultTemperature)
                .maxTokens(maxTokens != null ? maxTokens : defaultMaxTokens)
                .timeout(timeout)
                .build();
    }

    public double defaultTemperature() {
        return defaultTemperature;
    }

    public int defaultMaxTokens() {
        return defaultMaxTokens;
    }
}

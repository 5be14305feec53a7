package com.skindx.infrastructure.ai.provider;

import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Factories for every {@link ProviderKind}. Clients are only built when the router
 * first asks for a provider, and a blank API key makes the provider unavailable.
 */
@Configuration
public class ProviderClientConfig {

    @Value("${providers.internal.enabled:true}")
    private boolean internalEnabled;

    @Value("${providers.internal.timeout-seconds:10}")
    private long internalTimeoutSeconds;

    @Value("${providers.openrouter.api-key:}")
    private String openRouterApiKey;

    @Value("${providers.openrouter.base-url:https://openrouter.ai/api/v1}")
    private String openRouterBaseUrl;

    @Value("${providers.openrouter.model:anthropic/claude-3-haiku}")
    private String openRouterModel;

    @Value("${providers.openrouter.timeout-seconds:30}")
    private long openRouterTimeoutSeconds;

    @Value("${providers.gemini.api-key:}")
    private String geminiApiKey;

    @Value("${providers.gemini.base-url:https://generativelanguage.googleapis.com/v1beta/openai/}")
    private String geminiBaseUrl;

    @Value("${providers.gemini.model:gemini-1.5-flash}")
    private String geminiModel;

    @Value("${providers.gemini.timeout-seconds:30}")
    private long geminiTimeoutSeconds;

    @Value("${providers.groq.api-key:}")
    private String groqApiKey;

    @Value("${providers.groq.base-url:https://api.groq.com/openai/v1}")
    private String groqBaseUrl;

    @Value("${providers.groq.model:llama-3.1-70b-versatile}")
    private String groqModel;

    @Value("${providers.groq.timeout-seconds:15}")
    private long groqTimeoutSeconds;

    @Bean
    public AiProviderFactory internalProviderFactory() {
        return AiProviderFactory.of(ProviderKind.INTERNAL, () -> {
            if (!internalEnabled) {
                throw new ProviderUnavailableException("Internal model disabled");
            }
            return new InternalModelProvider(Duration.ofSeconds(internalTimeoutSeconds));
        });
    }

    @Bean
    public AiProviderFactory openRouterProviderFactory(ProviderPromptBuilder promptBuilder,
                                                       ProviderResponseParser responseParser) {
        return AiProviderFactory.of(ProviderKind.OPENROUTER, () -> openAiCompatible(
                ProviderKind.OPENROUTER, "OpenRouter", openRouterApiKey, openRouterBaseUrl, openRouterModel,
                openRouterTimeoutSeconds, false, promptBuilder, responseParser));
    }

    @Bean
    public AiProviderFactory geminiProviderFactory(ProviderPromptBuilder promptBuilder,
                                                   ProviderResponseParser responseParser) {
        return AiProviderFactory.of(ProviderKind.GEMINI, () -> openAiCompatible(
                ProviderKind.GEMINI, "Gemini", geminiApiKey, geminiBaseUrl, geminiModel,
                geminiTimeoutSeconds, true, promptBuilder, responseParser));
    }

    @Bean
    public AiProviderFactory groqProviderFactory(ProviderPromptBuilder promptBuilder,
                                                 ProviderResponseParser responseParser) {
        return AiProviderFactory.of(ProviderKind.GROQ, () -> openAiCompatible(
                ProviderKind.GROQ, "Groq", groqApiKey, groqBaseUrl, groqModel,
                groqTimeoutSeconds, false, promptBuilder, responseParser));
    }

    private static AiProvider openAiCompatible(ProviderKind kind, String displayName, String apiKey,
                                               String baseUrl, String model, long timeoutSeconds, boolean vision,
                                               ProviderPromptBuilder promptBuilder,
                                               ProviderResponseParser responseParser) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderUnavailableException(displayName + " API key not configured");
        }
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        // SDK retries off: fallback and retry belong to the router
        var client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .timeout(timeout)
                .maxRetries(0)
                .build();
        return new OpenAiCompatibleProvider(kind, client, model, timeout, vision, promptBuilder, responseParser);
    }
}

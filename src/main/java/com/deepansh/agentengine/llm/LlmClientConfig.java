package com.deepansh.agentengine.llm;

import com.deepansh.agentengine.retry.AnthropicRateLimitHintExtractor;
import com.deepansh.agentengine.retry.OpenAiRateLimitHintExtractor;
import com.deepansh.agentengine.retry.RateLimitHintExtractor;
import com.deepansh.agentengine.retry.RetryAfterHintExtractor;
import com.deepansh.agentengine.exception.AgentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.Map;

/**
 * Creates the active provider round trip from llm.provider (env LLM_PROVIDER),
 * and the rate-limit hint extractor matching that provider's headers.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LlmClientConfig {

    private static final Map<String, String> SIGNUP_URLS = Map.of(
            "openai", "https://platform.openai.com/api-keys",
            "groq", "https://console.groq.com/keys",
            "gemini", "https://aistudio.google.com/app/apikey"
    );

    private final LlmProperties llmProperties;

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderProperties active = llmProperties.activeProvider();
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", llmProperties.getProvider().toUpperCase());
        log.info("  Model               : {}", active != null ? active.getModel() : "<not configured>");
        log.info("================================================================");
    }

    /** The raw provider round trip; the engine wraps it in a RetryingRoundTrip. */
    @Bean("activeLlmClient")
    public ProviderRoundTrip activeLlmClient(ObjectMapper objectMapper,
                                             @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        String provider = llmProperties.getProvider().toLowerCase();
        LlmProviderProperties props = requireActive(provider);
        logKey(provider.toUpperCase(), props.getApiKey(), provider.toUpperCase() + "_API_KEY",
                SIGNUP_URLS.getOrDefault(provider, "your provider's console"));
        return new OpenAiCompatibleRoundTrip(props, objectMapper, provider, builder.clone());
    }

    @Bean
    public RateLimitHintExtractor rateLimitHintExtractor(Clock clock) {
        LlmProviderProperties props = requireActive(llmProperties.getProvider().toLowerCase());
        return switch (props.getRateLimitHeaders().toLowerCase()) {
            case "openai" -> new OpenAiRateLimitHintExtractor(clock);
            case "anthropic" -> new AnthropicRateLimitHintExtractor(clock);
            case "none" -> RateLimitHintExtractor.none();
            default -> new RetryAfterHintExtractor(clock);
        };
    }

    private LlmProviderProperties requireActive(String provider) {
        LlmProviderProperties props = llmProperties.getProviders().get(provider);
        if (props == null) {
            throw new AgentException("No configuration for llm provider '" + provider
                    + "'. Known providers: " + llmProperties.getProviders().keySet());
        }
        return props;
    }

    private void logKey(String name, String key, String envVar, String signupUrl) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
            log.error("  Get a key at: {}", signupUrl);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}

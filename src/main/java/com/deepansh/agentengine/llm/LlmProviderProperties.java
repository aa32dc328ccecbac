package com.deepansh.agentengine.llm;

import lombok.Data;

/**
 * Holds config for a single OpenAI-compatible provider.
 * Populated from application.yml under llm.providers.{openai|groq|gemini}.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 2048;
    private double temperature = 0.2;

    /** Which rate-limit headers the provider sends: openai, anthropic or retry-after */
    private String rateLimitHeaders = "retry-after";

    /** Send response_format=json_schema when no tools are offered */
    private boolean nativeStructuredOutput = true;
}

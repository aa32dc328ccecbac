package com.deepansh.agentengine.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /** Key into {@link #providers}; set with LLM_PROVIDER */
    private String provider = "groq";

    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 120_000;
    private int maxConnections = 50;

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    public LlmProviderProperties activeProvider() {
        return providers.get(provider.toLowerCase());
    }
}

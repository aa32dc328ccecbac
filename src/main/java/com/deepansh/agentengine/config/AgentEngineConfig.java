package com.deepansh.agentengine.config;

import com.deepansh.agentengine.core.AgentExecutionEngine;
import com.deepansh.agentengine.llm.ProviderRoundTrip;
import com.deepansh.agentengine.retry.RateLimitHintExtractor;
import com.deepansh.agentengine.retry.RetryConfiguration;
import com.deepansh.agentengine.retry.RetryPolicy;
import com.deepansh.agentengine.retry.RetryingRoundTrip;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@Slf4j
public class AgentEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryingRoundTrip retryingRoundTrip(@Qualifier("activeLlmClient") ProviderRoundTrip llmClient,
                                               RateLimitHintExtractor hintExtractor,
                                               AgentProperties properties) {
        RetryConfiguration retry = properties.toRetryConfiguration();
        log.info("LLM retries: preset={}, maxRetries={}, baseDelay={}ms, maxDelay={}ms",
                properties.getRetry().getPreset(), retry.maxRetries(),
                retry.baseDelay().toMillis(), retry.maxDelay().toMillis());
        return new RetryingRoundTrip(llmClient, new RetryPolicy(retry), hintExtractor);
    }

    @Bean
    public AgentExecutionEngine agentExecutionEngine(RetryingRoundTrip roundTrip,
                                                     @Qualifier("toolExecutor") Executor toolExecutor,
                                                     ObjectMapper objectMapper) {
        return new AgentExecutionEngine(roundTrip, toolExecutor, objectMapper);
    }
}

package com.deepansh.agentengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for the engine, isolated from the web thread pool so long agent runs
 * never starve HTTP request handling.
 *
 * - toolExecutor: tool calls of one step run here concurrently
 * - agentRunExecutor: background runs started through POST /runs
 *
 * Queue capacity gives backpressure; a full queue rejects the task, which the engine
 * reports as a tool error.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolExecutor")
    public Executor toolExecutor(AgentProperties properties) {
        return pool(properties.getToolPool(), "agent-tool-");
    }

    @Bean(name = "agentRunExecutor")
    public Executor agentRunExecutor(AgentProperties properties) {
        return pool(properties.getRunPool(), "agent-run-");
    }

    private static ThreadPoolTaskExecutor pool(AgentProperties.Pool size, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size.getCoreSize());
        executor.setMaxPoolSize(Math.max(size.getCoreSize(), size.getMaxSize()));
        executor.setQueueCapacity(size.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}

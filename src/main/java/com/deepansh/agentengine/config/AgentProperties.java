package com.deepansh.agentengine.config;

import com.deepansh.agentengine.core.AgentConfiguration;
import com.deepansh.agentengine.retry.RetryConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine defaults bound from application.yml under agent.*
 * Per-request values in an AgentRunRequest override the loop settings.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private int maxSteps = 10;
    private boolean autoExecuteTools = true;
    private int maxDuplicateToolCalls = 2;

    /** Null or absent means no per-tool ceiling */
    private Integer maxToolCallsPerTool = 5;

    /** How long a finished run stays addressable before the controller forgets it */
    private Duration runRetention = Duration.ofMinutes(10);

    private Retry retry = new Retry();
    private Pool toolPool = new Pool(4, 16, 100);
    private Pool runPool = new Pool(2, 8, 50);

    @Data
    public static class Retry {
        /** default, disabled, aggressive or conservative */
        private String preset = "default";

        /** Overrides the preset's retry count when set */
        private Integer maxRetries;
    }

    @Data
    public static class Pool {
        private int coreSize;
        private int maxSize;
        private int queueCapacity;

        public Pool() {
        }

        public Pool(int coreSize, int maxSize, int queueCapacity) {
            this.coreSize = coreSize;
            this.maxSize = maxSize;
            this.queueCapacity = queueCapacity;
        }
    }

    public AgentConfiguration toConfiguration() {
        return AgentConfiguration.builder()
                .maxSteps(maxSteps)
                .autoExecuteTools(autoExecuteTools)
                .maxDuplicateToolCalls(maxDuplicateToolCalls)
                .maxToolCallsPerTool(maxToolCallsPerTool)
                .build();
    }

    public RetryConfiguration toRetryConfiguration() {
        RetryConfiguration preset = RetryConfiguration.preset(retry.getPreset());
        if (retry.getMaxRetries() == null) {
            return preset;
        }
        return RetryConfiguration.custom(retry.getMaxRetries(), preset.baseDelay(), preset.maxDelay(),
                preset.jitterFraction());
    }
}

package com.deepansh.agentengine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Vendor-neutral output of one round trip: the prose the model wrote and the tool
 * calls it asked for, each in the order the model produced them.
 */
@Value
@Builder(toBuilder = true)
public class ProviderResponse {

    @Singular
    List<String> textBlocks;

    @Singular
    List<ToolCall> toolCalls;

    StopReason stopReason;

    @Builder.Default
    TokenUsage usage = TokenUsage.ZERO;

    String model;

    public String text() {
        return String.join("", textBlocks);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}

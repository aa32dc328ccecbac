package com.deepansh.agentengine.model;

import com.deepansh.agentengine.tool.ToolDefinition;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Vendor-neutral input of one round trip.
 * {@code toolChoice} is null when no tools are offered.
 */
@Value
@Builder
public class ProviderRequest {

    @Singular
    List<Message> messages;

    @Singular
    List<ToolDefinition> tools;

    ToolChoice toolChoice;

    /** Nullable: the provider may use it for native structured output */
    OutputSchema<?> responseSchema;

    String systemPrompt;
}

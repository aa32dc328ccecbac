package com.deepansh.agentengine.llm;

import com.deepansh.agentengine.model.ProviderRequest;
import com.deepansh.agentengine.model.ProviderResponse;

public interface ProviderRoundTrip {

    /**
     * Send the conversation, the tools the model may call and the expected answer schema
     * to the provider, and return its reply.
     *
     * @param request messages, tools, tool choice, response schema and system prompt
     * @return prose and tool calls in model order, with stop reason and token usage
     * @throws ProviderException classified failure; anything else is treated as fatal
     */
    ProviderResponse execute(ProviderRequest request);
}

package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.OutputSchema;
import com.deepansh.agentengine.tool.ToolRegistry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one run needs. Give a {@code prompt}, seed {@code history} to continue an
 * earlier conversation, or both (the prompt is appended after the history).
 */
@Value
@Builder(toBuilder = true)
public class AgentRunSpec<T> {

    /** Optional; a random id is assigned when absent */
    String runId;

    String prompt;

    @Singular("historyMessage")
    List<Message> history;

    String systemPrompt;

    ToolRegistry tools;

    OutputSchema<T> outputSchema;

    @Builder.Default
    AgentConfiguration configuration = AgentConfiguration.DEFAULT;

    /** Optional; the engine's default policy is used when absent */
    TerminationPolicy terminationPolicy;
}

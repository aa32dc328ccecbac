package com.deepansh.agentengine.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class AgentRunRequest {

    @NotBlank(message = "prompt must not be blank")
    private String prompt;

    private String systemPrompt;

    /**
     * Optional prior conversation. When present the prompt is appended after it,
     * so a caller can continue a run that ended earlier.
     */
    private List<Message> history;

    /** Optional subset of registered tool names. Null means all registered tools. */
    private List<String> tools;

    /** Optional JSON Schema for the final answer. Defaults to {@code {answer: string}}. */
    private Map<String, Object> outputSchema;

    private String outputSchemaName;

    // Loop overrides; null falls back to the agent.* defaults
    @Min(value = 1, message = "maxSteps must be at least 1")
    private Integer maxSteps;

    private Boolean autoExecuteTools;

    @Min(value = 0, message = "maxDuplicateToolCalls must not be negative")
    private Integer maxDuplicateToolCalls;

    @Min(value = 1, message = "maxToolCallsPerTool must be at least 1")
    private Integer maxToolCallsPerTool;
}

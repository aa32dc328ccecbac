package com.deepansh.agentengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Id assigned by the provider; echoed back in the matching tool result */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}

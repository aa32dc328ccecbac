package com.deepansh.agentengine.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows exactly how to invoke the tool.
 *
 * A failure the model should see and recover from is returned as
 * {@link ToolOutput#error(String)}. A thrown exception aborts the whole run with TOOL_ERROR.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters. */
    Map<String, Object> getInputSchema();

    ToolOutput execute(Map<String, Object> arguments) throws Exception;
}

package com.deepansh.agentengine.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run loop limits. {@code maxToolCallsPerTool} null means no per-tool ceiling.
 */
@Value
@Builder(toBuilder = true)
public class AgentConfiguration {

    public static final AgentConfiguration DEFAULT = AgentConfiguration.builder().build();

    /** Model round trips allowed before the run fails with MAX_STEPS_EXCEEDED */
    @Builder.Default
    int maxSteps = 10;

    /** When false the run pauses after emitting tool calls until results are submitted */
    @Builder.Default
    boolean autoExecuteTools = true;

    /** Identical calls (same tool, same canonical arguments) tolerated before stopping */
    @Builder.Default
    int maxDuplicateToolCalls = 2;

    @Builder.Default
    Integer maxToolCallsPerTool = 5;
}

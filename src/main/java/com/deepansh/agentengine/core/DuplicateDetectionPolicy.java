package com.deepansh.agentengine.core;

import java.util.Map;

/**
 * Stops a run that keeps repeating itself: the same tool with the same canonical arguments
 * more than {@code maxDuplicateToolCalls} times, or any one tool more than
 * {@code maxToolCallsPerTool} times in total.
 */
public class DuplicateDetectionPolicy implements TerminationPolicy {

    @Override
    public TerminationDecision decide(AgentContext context) {
        AgentConfiguration config = context.getConfiguration();

        for (Map.Entry<ToolCallKey, Integer> entry : context.getToolCallCounts().entrySet()) {
            if (entry.getValue() > config.getMaxDuplicateToolCalls()) {
                ToolCallKey key = entry.getKey();
                return TerminationDecision.stop(TerminationReason.DUPLICATE_CALLS_DETECTED,
                        "Tool '" + key.toolName() + "' called " + entry.getValue()
                                + " times with arguments " + key.canonicalArguments());
            }
        }

        Integer perToolLimit = config.getMaxToolCallsPerTool();
        if (perToolLimit != null) {
            for (Map.Entry<String, Integer> entry : context.getPerToolCounts().entrySet()) {
                if (entry.getValue() > perToolLimit) {
                    return TerminationDecision.stop(TerminationReason.TOOL_CALL_LIMIT_REACHED,
                            "Tool '" + entry.getKey() + "' called " + entry.getValue()
                                    + " times, limit is " + perToolLimit);
                }
            }
        }
        return TerminationDecision.proceed();
    }
}

package com.deepansh.agentengine.tool;

/**
 * Runs one tool invocation from the raw JSON arguments the model produced.
 */
@FunctionalInterface
public interface ToolExecutor {

    ToolOutput run(String argumentsJson) throws Exception;
}

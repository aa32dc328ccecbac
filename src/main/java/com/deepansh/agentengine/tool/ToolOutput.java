package com.deepansh.agentengine.tool;

/**
 * Result of a tool invocation. {@code isError} marks a failure the tool reported itself;
 * the run keeps going and the model sees the output.
 */
public record ToolOutput(String output, boolean isError) {

    public ToolOutput {
        output = output == null ? "" : output;
    }

    public static ToolOutput success(String output) {
        return new ToolOutput(output, false);
    }

    public static ToolOutput error(String output) {
        return new ToolOutput(output, true);
    }
}

package com.deepansh.agentengine.tool.impl;

import com.deepansh.agentengine.tool.AgentTool;
import com.deepansh.agentengine.tool.ToolOutput;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Returns its input unchanged, prefixed with {@code "Echo: "}. Lets a caller confirm
 * that a model can emit a well-formed tool call and read the result back.
 */
@Component
public class EchoTool implements AgentTool {

    static final int MAX_REPEAT = 5;

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Returns the given text verbatim, optionally repeated up to " + MAX_REPEAT
                + " times on separate lines. Only useful for verifying tool calls round-trip.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "Text to return"
                        ),
                        "repeat", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_REPEAT,
                                "description", "How many times to repeat the text (default 1)"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public ToolOutput execute(Map<String, Object> arguments) {
        Object message = arguments.get("message");
        if (message == null) {
            return ToolOutput.error("'message' argument is required");
        }
        if (!(message instanceof String text)) {
            return ToolOutput.error("'message' must be a string, got " + message.getClass().getSimpleName());
        }

        Object repeatArg = arguments.getOrDefault("repeat", 1);
        if (!(repeatArg instanceof Integer repeat) || repeat < 1 || repeat > MAX_REPEAT) {
            return ToolOutput.error("'repeat' must be an integer between 1 and " + MAX_REPEAT);
        }
        return ToolOutput.success("Echo: " + String.join("\n", Collections.nCopies(repeat, text)));
    }
}

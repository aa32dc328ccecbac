package com.deepansh.agentengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * One externally observable unit of an agent run.
 *
 * A run emits any number of {@link Thinking}, {@link ToolCallStep} and {@link ToolResultStep}
 * values and ends with exactly one {@link FinalResponse}, or with an error instead.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AgentStep.Thinking.class, name = "thinking"),
        @JsonSubTypes.Type(value = AgentStep.ToolCallStep.class, name = "toolCall"),
        @JsonSubTypes.Type(value = AgentStep.ToolResultStep.class, name = "toolResult"),
        @JsonSubTypes.Type(value = AgentStep.FinalResponse.class, name = "finalResponse")
})
public sealed interface AgentStep
        permits AgentStep.Thinking, AgentStep.ToolCallStep, AgentStep.ToolResultStep, AgentStep.FinalResponse {

    enum Kind {
        THINKING("thinking"),
        TOOL_CALL("toolCall"),
        TOOL_RESULT("toolResult"),
        FINAL_RESPONSE("finalResponse");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    @JsonIgnore
    Kind kind();

    /** Prose the model produced without it being the final answer. */
    record Thinking(String text) implements AgentStep {
        @Override
        public Kind kind() {
            return Kind.THINKING;
        }
    }

    record ToolCallStep(String id, String name, Map<String, Object> arguments) implements AgentStep {
        @Override
        public Kind kind() {
            return Kind.TOOL_CALL;
        }
    }

    record ToolResultStep(String id, String name, String output, boolean isError) implements AgentStep {
        @Override
        public Kind kind() {
            return Kind.TOOL_RESULT;
        }
    }

    /** Terminal step: the decoded, schema-conforming answer and the JSON it came from. */
    record FinalResponse(Object output, String rawJson) implements AgentStep {
        @Override
        public Kind kind() {
            return Kind.FINAL_RESPONSE;
        }

        public <T> T outputAs(Class<T> type) {
            return type.cast(output);
        }
    }

    static AgentStep thinking(String text) {
        return new Thinking(text);
    }

    static AgentStep toolCall(ToolCall call) {
        return new ToolCallStep(call.getId(), call.getToolName(),
                call.getArguments() == null ? Map.of() : call.getArguments());
    }

    static AgentStep toolResult(String id, String name, String output, boolean isError) {
        return new ToolResultStep(id, name, output, isError);
    }

    static AgentStep finalResponse(Object output, String rawJson) {
        return new FinalResponse(output, rawJson);
    }
}

package com.deepansh.agentengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One entry of the conversation history sent to the provider.
 * History is append-only within a run; the engine never edits a message after adding it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /** Present when role = tool: the tool reported a failure in its output */
    private boolean error;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back verbatim so the provider can correlate the tool results.
     */
    private List<ToolCall> toolCalls;

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.assistant)
                .content(content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .build();
    }

    public static Message toolResult(String toolCallId, String name, String content, boolean error) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(toolCallId)
                .name(name)
                .content(content)
                .error(error)
                .build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}

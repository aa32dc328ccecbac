package com.deepansh.agentengine.core;

/**
 * Identity of a tool call for duplicate detection: tool name plus the canonical
 * (key-sorted) JSON form of its arguments.
 */
public record ToolCallKey(String toolName, String canonicalArguments) {
}

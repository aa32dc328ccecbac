package com.deepansh.agentengine.model;

/**
 * Why the model stopped generating. Provider-neutral; each round trip maps its own
 * finish reasons onto these.
 */
public enum StopReason {
    END_TURN,
    TOOL_USE,
    MAX_TOKENS,
    STOP_SEQUENCE
}

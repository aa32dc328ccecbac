package com.deepansh.agentengine.core;

public enum TerminationReason {
    COMPLETED(false),
    MAX_STEPS_EXCEEDED(true),
    DUPLICATE_CALLS_DETECTED(true),
    TOOL_CALL_LIMIT_REACHED(true),
    TOOL_NOT_FOUND(false),
    TOOL_ERROR(false),
    OUTPUT_DECODING_FAILED(false),
    PROVIDER_ERROR(false),
    CANCELLED(true);

    private final boolean resumable;

    TerminationReason(boolean resumable) {
        this.resumable = resumable;
    }

    /** True when the conversation so far is sound and a caller may continue it with a new run. */
    public boolean isResumable() {
        return resumable;
    }
}

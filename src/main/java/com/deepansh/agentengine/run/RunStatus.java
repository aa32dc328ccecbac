package com.deepansh.agentengine.run;

public enum RunStatus {
    RUNNING,
    AWAITING_TOOL_RESULTS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isDone() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

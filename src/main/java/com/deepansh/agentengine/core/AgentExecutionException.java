package com.deepansh.agentengine.core;

import lombok.Getter;

/**
 * Why a run ended without a final answer. Thrown from {@link AgentRun#next()}.
 */
@Getter
public class AgentExecutionException extends RuntimeException {

    private final String runId;
    private final TerminationReason reason;

    /** Phase the run was in when it failed */
    private final LoopPhase phase;

    private final String detail;

    public AgentExecutionException(String runId, TerminationReason reason, LoopPhase phase,
                                   String detail, Throwable cause) {
        super(reason + (detail == null ? "" : ": " + detail), cause);
        this.runId = runId;
        this.reason = reason;
        this.phase = phase;
        this.detail = detail;
    }

    public boolean isResumable() {
        return reason.isResumable();
    }
}

package com.deepansh.agentengine.core;

/**
 * Outcome of a {@link TerminationPolicy}: proceed, or stop with a reason.
 */
public record TerminationDecision(TerminationReason reason, String detail) {

    private static final TerminationDecision PROCEED = new TerminationDecision(null, null);

    public static TerminationDecision proceed() {
        return PROCEED;
    }

    public static TerminationDecision stop(TerminationReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("stop requires a reason");
        }
        return new TerminationDecision(reason, detail);
    }

    public boolean shouldStop() {
        return reason != null;
    }
}

package com.deepansh.agentengine.core;

/**
 * Consulted after every tool round to decide whether the loop may ask the model again.
 */
@FunctionalInterface
public interface TerminationPolicy {

    TerminationDecision decide(AgentContext context);

    /** Duplicate and per-tool checks first, then the step budget. */
    static TerminationPolicy defaultPolicy() {
        return new CompositeTerminationPolicy(new DuplicateDetectionPolicy(), new StandardTerminationPolicy());
    }
}

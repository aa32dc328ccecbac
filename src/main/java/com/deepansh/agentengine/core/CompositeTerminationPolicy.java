package com.deepansh.agentengine.core;

import java.util.List;

/**
 * Evaluates policies in order and returns the first stop.
 */
public class CompositeTerminationPolicy implements TerminationPolicy {

    private final List<TerminationPolicy> policies;

    public CompositeTerminationPolicy(TerminationPolicy... policies) {
        this(List.of(policies));
    }

    public CompositeTerminationPolicy(List<TerminationPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    @Override
    public TerminationDecision decide(AgentContext context) {
        for (TerminationPolicy policy : policies) {
            TerminationDecision decision = policy.decide(context);
            if (decision.shouldStop()) {
                return decision;
            }
        }
        return TerminationDecision.proceed();
    }
}

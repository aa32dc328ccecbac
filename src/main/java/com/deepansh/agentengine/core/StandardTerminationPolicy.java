package com.deepansh.agentengine.core;

public class StandardTerminationPolicy implements TerminationPolicy {

    @Override
    public TerminationDecision decide(AgentContext context) {
        int maxSteps = context.getConfiguration().getMaxSteps();
        if (context.getStepCount() >= maxSteps) {
            return TerminationDecision.stop(TerminationReason.MAX_STEPS_EXCEEDED,
                    "Step budget of " + maxSteps + " used up");
        }
        return TerminationDecision.proceed();
    }
}

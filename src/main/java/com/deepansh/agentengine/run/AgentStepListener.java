package com.deepansh.agentengine.run;

import com.deepansh.agentengine.model.AgentStep;

/**
 * Push-style observer of a background run. Steps arrive in emission order on the thread
 * driving the run; a late subscriber first receives the steps it missed.
 */
public interface AgentStepListener {

    void onStep(AgentStep step);

    /** Called once with the decoded final answer. */
    default void onComplete(Object output) {
    }

    /** Called once when the run ends without an answer, usually with an AgentExecutionException. */
    default void onError(Throwable error) {
    }
}

package com.deepansh.agentengine.exception;

/**
 * Misconfiguration or misuse of the engine: invalid schemas, unknown tool subsets,
 * calls that are illegal in the run's current state. Never retried.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

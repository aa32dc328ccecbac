package com.deepansh.agentengine.exception;

/**
 * The run exists but cannot accept the requested operation in its current state,
 * e.g. tool results for a run that is not paused.
 */
public class InvalidRunStateException extends AgentException {

    public InvalidRunStateException(String message) {
        super(message);
    }
}

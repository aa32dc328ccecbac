package com.deepansh.agentengine.exception;

public class RunNotFoundException extends AgentException {

    public RunNotFoundException(String runId) {
        super("No agent run with id '" + runId + "'");
    }
}

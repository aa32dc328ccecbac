package com.deepansh.agentengine.model;

public enum ToolChoice {
    AUTO,
    NONE,
    REQUIRED;

    public String wireValue() {
        return name().toLowerCase();
    }
}

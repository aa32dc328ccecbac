package com.deepansh.agentengine.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied result for a tool call of a run started with autoExecuteTools = false.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolResultSubmission {

    @NotBlank(message = "id must not be blank")
    private String id;

    private String output;

    private boolean error;
}

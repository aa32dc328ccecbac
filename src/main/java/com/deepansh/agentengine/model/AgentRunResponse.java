package com.deepansh.agentengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentRunResponse {

    private String runId;

    /** RUNNING, AWAITING_TOOL_RESULTS, COMPLETED, FAILED or CANCELLED */
    private String status;

    /** Current loop phase label, e.g. awaitingModel */
    private String phase;

    /** Termination reason once the run has ended */
    private String reason;

    private Object output;

    @Builder.Default
    private List<AgentStep> steps = new ArrayList<>();

    private int stepsUsed;
    private int inputTokens;
    private int outputTokens;

    /** Error message if the run failed or was cancelled */
    private String error;

    /** True when a caller may restart with adjusted tools or budget */
    private Boolean resumable;
}

package com.deepansh.agentengine.api;

import com.deepansh.agentengine.core.AgentExecutionException;
import com.deepansh.agentengine.core.LoopPhase;
import com.deepansh.agentengine.model.AgentRunRequest;
import com.deepansh.agentengine.model.AgentRunResponse;
import com.deepansh.agentengine.model.AgentStep;
import com.deepansh.agentengine.model.ToolResultSubmission;
import com.deepansh.agentengine.run.AgentExecutionController;
import com.deepansh.agentengine.run.AgentRunHandle;
import com.deepansh.agentengine.run.AgentStepListener;
import com.deepansh.agentengine.tool.ToolOutput;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent run endpoints.
 *
 * POST   /api/v1/agent/runs                    start in the background, 202 {runId, status}
 * POST   /api/v1/agent/run                     run synchronously
 * GET    /api/v1/agent/runs/{id}               status, phase and steps
 * GET    /api/v1/agent/runs/{id}/stream        SSE: one event per step, then complete or error
 * POST   /api/v1/agent/runs/{id}/cancel
 * POST   /api/v1/agent/runs/{id}/tool-results  resume a run paused for tool results
 * DELETE /api/v1/agent/runs/{id}
 * GET    /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentExecutionController executionController;

    @PostMapping("/runs")
    public ResponseEntity<Map<String, String>> start(@Valid @RequestBody AgentRunRequest request) {
        AgentRunHandle handle = executionController.start(request);
        log.info("Agent run accepted [run={}]", handle.getRunId());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("runId", handle.getRunId(), "status", handle.status().name()));
    }

    @PostMapping("/run")
    public ResponseEntity<AgentRunResponse> run(@Valid @RequestBody AgentRunRequest request) {
        AgentRunHandle handle = executionController.runSync(request);
        return ResponseEntity.ok(toResponse(handle));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<AgentRunResponse> get(@PathVariable String runId) {
        return ResponseEntity.ok(toResponse(executionController.find(runId)));
    }

    @GetMapping("/runs/{runId}/stream")
    public SseEmitter stream(@PathVariable String runId) {
        AgentRunHandle handle = executionController.find(runId);
        SseEmitter emitter = new SseEmitter(0L);

        AgentStepListener listener = new AgentStepListener() {
            @Override
            public void onStep(AgentStep step) {
                send(emitter, step.kind().label(), step);
            }

            @Override
            public void onComplete(Object output) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("runId", runId);
                body.put("output", output);
                send(emitter, "complete", body);
                emitter.complete();
            }

            @Override
            public void onError(Throwable error) {
                send(emitter, "error", errorBody(error));
                emitter.complete();
            }
        };

        emitter.onCompletion(() -> handle.unsubscribe(listener));
        emitter.onTimeout(() -> handle.unsubscribe(listener));
        emitter.onError(e -> handle.unsubscribe(listener));
        handle.subscribe(listener);
        return emitter;
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String runId) {
        executionController.cancel(runId);
        AgentRunHandle handle = executionController.find(runId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("runId", runId, "status", handle.status().name()));
    }

    @PostMapping("/runs/{runId}/tool-results")
    public ResponseEntity<Map<String, String>> submitToolResults(
            @PathVariable String runId,
            @Valid @RequestBody List<@Valid ToolResultSubmission> results) {
        Map<String, ToolOutput> outputs = new LinkedHashMap<>();
        results.forEach(r -> outputs.put(r.getId(), new ToolOutput(r.getOutput(), r.isError())));
        executionController.submitToolResults(runId, outputs);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("runId", runId, "status", executionController.find(runId).status().name()));
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<Void> discard(@PathVariable String runId) {
        executionController.discard(runId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private static void send(SseEmitter emitter, String event, Object data) {
        try {
            emitter.send(SseEmitter.event().name(event).data(data));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Map<String, Object> errorBody(Throwable error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.getMessage());
        if (error instanceof AgentExecutionException ex) {
            body.put("reason", ex.getReason().name());
            body.put("phase", ex.getPhase().label());
            body.put("resumable", ex.isResumable());
        }
        return body;
    }

    static AgentRunResponse toResponse(AgentRunHandle handle) {
        LoopPhase phase = handle.currentPhase();
        AgentRunResponse.AgentRunResponseBuilder response = AgentRunResponse.builder()
                .runId(handle.getRunId())
                .status(handle.status().name())
                .phase(phase.label())
                .steps(handle.steps())
                .stepsUsed(handle.stepCount())
                .inputTokens(handle.usage().inputTokens())
                .outputTokens(handle.usage().outputTokens());

        if (phase instanceof LoopPhase.Terminated terminated) {
            response.reason(terminated.reason().name());
        }
        handle.output().ifPresent(response::output);
        handle.error().ifPresent(error -> {
            response.error(error.getMessage());
            if (error instanceof AgentExecutionException ex) {
                response.resumable(ex.isResumable());
            }
        });
        return response.build();
    }
}

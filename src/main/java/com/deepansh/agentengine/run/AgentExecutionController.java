package com.deepansh.agentengine.run;

import com.deepansh.agentengine.config.AgentProperties;
import com.deepansh.agentengine.core.AgentConfiguration;
import com.deepansh.agentengine.core.AgentExecutionEngine;
import com.deepansh.agentengine.core.AgentRun;
import com.deepansh.agentengine.core.AgentRunSpec;
import com.deepansh.agentengine.core.LoopPhase;
import com.deepansh.agentengine.exception.RunNotFoundException;
import com.deepansh.agentengine.model.AgentRunRequest;
import com.deepansh.agentengine.model.OutputSchema;
import com.deepansh.agentengine.tool.ToolOutput;
import com.deepansh.agentengine.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Lifecycle wrapper over background runs: start, observe, cancel, feed tool results.
 *
 * Runs stay addressable by id until {@link #discard(String)} or until they have been finished
 * for longer than {@code agent.run-retention}. Paused runs are never dropped. Nothing is persisted.
 */
@Service
@Slf4j
public class AgentExecutionController {

    public static final String DEFAULT_SCHEMA_NAME = "answer";

    public static final Map<String, Object> DEFAULT_OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "answer", Map.of(
                            "type", "string",
                            "description", "The final answer to the user's request"
                    )
            ),
            "required", List.of("answer")
    );

    private final AgentExecutionEngine engine;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final Executor runExecutor;
    private final Clock clock;

    private final Map<String, AgentRunHandle> runs = new ConcurrentHashMap<>();

    public AgentExecutionController(AgentExecutionEngine engine,
                                    ToolRegistry toolRegistry,
                                    AgentProperties properties,
                                    @Qualifier("agentRunExecutor") Executor runExecutor,
                                    Clock clock) {
        this.engine = engine;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /** Starts a run in the background from a REST request. */
    public AgentRunHandle start(AgentRunRequest request) {
        return start(toSpec(request));
    }

    public <T> AgentRunHandle start(AgentRunSpec<T> spec) {
        return launch(spec, runExecutor);
    }

    /**
     * Runs to completion (or pause) on the calling thread. The run is still registered, so it
     * can be inspected and, if paused, resumed through the usual methods.
     */
    public AgentRunHandle runSync(AgentRunRequest request) {
        return launch(toSpec(request), Runnable::run);
    }

    public AgentRunHandle find(String runId) {
        AgentRunHandle handle = runs.get(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        return handle;
    }

    public Collection<AgentRunHandle> list() {
        evictExpired();
        return List.copyOf(runs.values());
    }

    public void cancel(String runId) {
        find(runId).cancel();
    }

    public LoopPhase currentPhase(String runId) {
        return find(runId).currentPhase();
    }

    public void submitToolResults(String runId, Map<String, ToolOutput> outputs) {
        find(runId).submitToolResults(outputs);
    }

    /** Cancels the run if still going and forgets it. */
    public void discard(String runId) {
        AgentRunHandle handle = runs.remove(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        if (!handle.status().isDone()) {
            handle.cancel();
        }
        log.info("Run discarded [run={}]", runId);
    }

    /** Drops runs that finished more than the retention period ago. */
    void evictExpired() {
        Duration retention = properties.getRunRetention();
        Instant cutoff = clock.instant().minus(retention);
        runs.values().removeIf(handle -> {
            boolean expired = handle.getFinishedAt().map(finished -> finished.isBefore(cutoff)).orElse(false);
            if (expired) {
                log.debug("Evicting finished run [run={}, status={}]", handle.getRunId(), handle.status());
            }
            return expired;
        });
    }

    private <T> AgentRunHandle launch(AgentRunSpec<T> spec, Executor executor) {
        evictExpired();
        AgentRun<T> run = engine.start(spec);
        AgentRunHandle handle = new AgentRunHandle(run, executor, clock);
        runs.put(run.getRunId(), handle);
        handle.pump();
        return handle;
    }

    AgentRunSpec<Map<String, Object>> toSpec(AgentRunRequest request) {
        AgentConfiguration defaults = properties.toConfiguration();
        AgentConfiguration.AgentConfigurationBuilder config = defaults.toBuilder();
        if (request.getMaxSteps() != null) {
            config.maxSteps(request.getMaxSteps());
        }
        if (request.getAutoExecuteTools() != null) {
            config.autoExecuteTools(request.getAutoExecuteTools());
        }
        if (request.getMaxDuplicateToolCalls() != null) {
            config.maxDuplicateToolCalls(request.getMaxDuplicateToolCalls());
        }
        if (request.getMaxToolCallsPerTool() != null) {
            config.maxToolCallsPerTool(request.getMaxToolCallsPerTool());
        }

        Map<String, Object> schema = request.getOutputSchema() != null && !request.getOutputSchema().isEmpty()
                ? request.getOutputSchema() : DEFAULT_OUTPUT_SCHEMA;
        String schemaName = request.getOutputSchemaName() != null && !request.getOutputSchemaName().isBlank()
                ? request.getOutputSchemaName() : DEFAULT_SCHEMA_NAME;

        AgentRunSpec.AgentRunSpecBuilder<Map<String, Object>> spec = AgentRunSpec.<Map<String, Object>>builder()
                .prompt(request.getPrompt())
                .systemPrompt(request.getSystemPrompt())
                .tools(toolRegistry.select(request.getTools()))
                .outputSchema(OutputSchema.untyped(schemaName, schema))
                .configuration(config.build());
        if (request.getHistory() != null) {
            spec.history(request.getHistory());
        }
        return spec.build();
    }
}

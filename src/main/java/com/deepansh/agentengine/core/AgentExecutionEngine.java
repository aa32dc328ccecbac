package com.deepansh.agentengine.core;

import com.deepansh.agentengine.exception.AgentException;
import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.OutputSchema;
import com.deepansh.agentengine.retry.RetryingRoundTrip;
import com.deepansh.agentengine.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Tool-calling agent loop (reason, act, observe) that ends in a schema-typed answer.
 *
 * Per-run flow:
 * 1. Ask the model, with the history, the tool definitions and the output schema
 * 2. Tool calls: run them concurrently, append the results, consult the termination policy, repeat
 * 3. Schema-conforming JSON: decode it and finish
 * 4. Anything else: remind the model of the expected format and repeat
 *
 * The engine is stateless and thread-safe; every {@link #start} builds a fresh {@link AgentContext}.
 */
@Slf4j
public class AgentExecutionEngine {

    private final RetryingRoundTrip roundTrip;
    private final Executor toolExecutor;
    private final ObjectMapper objectMapper;
    private final OutputDecoder decoder;
    private final TerminationPolicy defaultPolicy;

    public AgentExecutionEngine(RetryingRoundTrip roundTrip, Executor toolExecutor, ObjectMapper objectMapper) {
        this(roundTrip, toolExecutor, objectMapper, TerminationPolicy.defaultPolicy());
    }

    public AgentExecutionEngine(RetryingRoundTrip roundTrip, Executor toolExecutor,
                                ObjectMapper objectMapper, TerminationPolicy defaultPolicy) {
        this.roundTrip = roundTrip;
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
        this.decoder = new OutputDecoder(objectMapper);
        this.defaultPolicy = defaultPolicy;
    }

    /**
     * Prepares a run. No model call happens until the returned run is iterated.
     *
     * @throws AgentException when the spec has neither prompt nor history, or lacks tools or schema
     */
    public <T> AgentRun<T> start(AgentRunSpec<T> spec) {
        OutputSchema<T> schema = spec.getOutputSchema();
        ToolRegistry tools = spec.getTools();
        if (schema == null) {
            throw new AgentException("An output schema is required");
        }
        if (tools == null) {
            throw new AgentException("A tool registry is required (it may be empty)");
        }

        List<Message> seed = new ArrayList<>(spec.getHistory());
        if (spec.getPrompt() != null && !spec.getPrompt().isBlank()) {
            seed.add(Message.user(spec.getPrompt()));
        }
        if (seed.isEmpty()) {
            throw new AgentException("A run needs a prompt or seeded history");
        }

        String runId = spec.getRunId() != null ? spec.getRunId() : UUID.randomUUID().toString();
        AgentConfiguration config = spec.getConfiguration() != null
                ? spec.getConfiguration() : AgentConfiguration.DEFAULT;
        AgentContext context = new AgentContext(runId, config, seed);
        TerminationPolicy policy = spec.getTerminationPolicy() != null ? spec.getTerminationPolicy() : defaultPolicy;

        log.info("Agent run started [run={}, tools={}, schema={}, maxSteps={}, history={}]",
                runId, tools.toolCount(), schema.name(), config.getMaxSteps(), seed.size());

        return new AgentRun<>(runId, context, tools, schema, systemPrompt(spec.getSystemPrompt(), schema),
                policy, roundTrip, toolExecutor, decoder, objectMapper);
    }

    private String systemPrompt(String base, OutputSchema<?> schema) {
        String instructions = decoder.instructionsFor(schema);
        if (base == null || base.isBlank()) {
            return instructions;
        }
        return base.strip() + "\n\n" + instructions;
    }
}

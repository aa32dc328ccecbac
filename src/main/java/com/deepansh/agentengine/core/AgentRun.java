package com.deepansh.agentengine.core;

import com.deepansh.agentengine.exception.AgentException;
import com.deepansh.agentengine.exception.InvalidRunStateException;
import com.deepansh.agentengine.llm.ProviderException;
import com.deepansh.agentengine.model.AgentStep;
import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.OutputSchema;
import com.deepansh.agentengine.model.ProviderRequest;
import com.deepansh.agentengine.model.ProviderResponse;
import com.deepansh.agentengine.model.TokenUsage;
import com.deepansh.agentengine.model.ToolCall;
import com.deepansh.agentengine.model.ToolChoice;
import com.deepansh.agentengine.retry.RetryingRoundTrip;
import com.deepansh.agentengine.tool.ToolDefinition;
import com.deepansh.agentengine.tool.ToolExecutor;
import com.deepansh.agentengine.tool.ToolOutput;
import com.deepansh.agentengine.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single agent run, driven lazily by iteration.
 *
 * Nothing happens until {@link #hasNext()} is called; each call advances the loop only as far as
 * needed to produce the next step. The last element is a {@link AgentStep.FinalResponse}, or
 * {@link #next()} throws an {@link AgentExecutionException} instead. Single use, and meant to be
 * iterated by one thread; {@link #cancel()}, {@link #currentPhase()} and
 * {@link #submitToolResults(Map)} may be called from others.
 */
@Slf4j
public class AgentRun<T> implements Iterator<AgentStep> {

    static final String FORMAT_REMINDER = "Your last reply was not a JSON document matching the "
            + "required output schema \"%s\". Reply with only that JSON document, or call a tool.";

    private final String runId;
    private final AgentContext context;
    private final ToolRegistry tools;
    private final List<ToolDefinition> toolDefinitions;
    private final OutputSchema<T> schema;
    private final String systemPrompt;
    private final TerminationPolicy policy;

    private final RetryingRoundTrip roundTrip;
    private final Executor toolExecutor;
    private final OutputDecoder decoder;
    private final ObjectMapper objectMapper;

    private final Deque<AgentStep> pending = new ArrayDeque<>();
    private AgentExecutionException failure;
    private boolean finished;
    private boolean finalOutputRequested;
    private T result;

    private volatile boolean cancelled;
    private volatile Map<String, ToolOutput> submittedResults;

    AgentRun(String runId, AgentContext context, ToolRegistry tools, OutputSchema<T> schema,
             String systemPrompt, TerminationPolicy policy, RetryingRoundTrip roundTrip,
             Executor toolExecutor, OutputDecoder decoder, ObjectMapper objectMapper) {
        this.runId = runId;
        this.context = context;
        this.tools = tools;
        this.toolDefinitions = tools.getAllDefinitions();
        this.schema = schema;
        this.systemPrompt = systemPrompt;
        this.policy = policy;
        this.roundTrip = roundTrip;
        this.toolExecutor = toolExecutor;
        this.decoder = decoder;
        this.objectMapper = objectMapper;
    }

    public String getRunId() {
        return runId;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && failure == null && !finished && !paused()) {
            advance();
        }
        return !pending.isEmpty() || failure != null;
    }

    @Override
    public AgentStep next() {
        if (!hasNext()) {
            throw new NoSuchElementException(isAwaitingToolResults()
                    ? "Run " + runId + " is waiting for tool results"
                    : "Run " + runId + " has finished");
        }
        if (!pending.isEmpty()) {
            return pending.poll();
        }
        AgentExecutionException error = failure;
        failure = null;
        finished = true;
        throw error;
    }

    public Stream<AgentStep> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }

    /** Requests cancellation; honoured at the next phase boundary. In-flight work is not interrupted. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public LoopPhase currentPhase() {
        return context.getPhase();
    }

    /** True when tool calls were emitted with autoExecuteTools off and no results were submitted yet. */
    public boolean isAwaitingToolResults() {
        return context.getPhase() instanceof LoopPhase.ExecutingTools
                && !context.getConfiguration().isAutoExecuteTools()
                && submittedResults == null;
    }

    /**
     * Supplies results for a paused run, one per pending call id. Iteration resumes afterwards.
     */
    public void submitToolResults(Map<String, ToolOutput> outputs) {
        if (!isAwaitingToolResults()) {
            throw new InvalidRunStateException("Run " + runId + " is not waiting for tool results");
        }
        LoopPhase.ExecutingTools phase = (LoopPhase.ExecutingTools) context.getPhase();
        List<String> missing = phase.pendingCalls().stream()
                .map(ToolCall::getId)
                .filter(id -> outputs == null || !outputs.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new InvalidRunStateException("Missing tool results for call ids " + missing);
        }
        submittedResults = Map.copyOf(outputs);
        log.info("Tool results submitted [run={}, calls={}]", runId, outputs.size());
    }

    public int getStepCount() {
        return context.getStepCount();
    }

    public TokenUsage getUsage() {
        return context.getUsage();
    }

    /** History so far, which a caller may seed into a new run to continue the conversation. */
    public List<Message> getMessages() {
        return context.getMessages();
    }

    public Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    private boolean paused() {
        return isAwaitingToolResults() && !cancelled;
    }

    private void advance() {
        LoopPhase phase = context.getPhase();
        if (phase instanceof LoopPhase.Terminated) {
            finished = true;
        } else if (phase instanceof LoopPhase.ExecutingTools executing) {
            executeTools(executing);
        } else {
            awaitModel();
        }
    }

    private void awaitModel() {
        if (cancelled) {
            fail(TerminationReason.CANCELLED, "Cancelled before model call", null);
            return;
        }
        int maxSteps = context.getConfiguration().getMaxSteps();
        if (context.getStepCount() >= maxSteps) {
            fail(TerminationReason.MAX_STEPS_EXCEEDED, "Step budget of " + maxSteps + " used up", null);
            return;
        }

        int step = context.getStepCount() + 1;
        log.info("Agent step {}/{} [run={}]", step, maxSteps, runId);

        // after a non-conforming reply the next request offers no tools, so the provider can apply the schema
        List<ToolDefinition> offered = finalOutputRequested ? List.of() : toolDefinitions;
        finalOutputRequested = false;
        ProviderRequest request = ProviderRequest.builder()
                .messages(context.getMessages())
                .tools(offered)
                .toolChoice(offered.isEmpty() ? null : ToolChoice.AUTO)
                .responseSchema(schema)
                .systemPrompt(systemPrompt)
                .build();

        ProviderResponse response;
        try {
            response = roundTrip.execute(request,
                    event -> context.transitionTo(new LoopPhase.Retrying(event.attempt(), event.delay())));
        } catch (ProviderException e) {
            fail(TerminationReason.PROVIDER_ERROR, e.getMessage(), e);
            return;
        }
        context.transitionTo(LoopPhase.awaitingModel());

        context.incrementStep();
        context.addUsage(response.getUsage());

        List<ToolCall> calls = withCallIds(response.getToolCalls(), step);
        String text = response.text();
        context.appendMessage(Message.assistant(text.isEmpty() ? null : text, calls));

        if (!calls.isEmpty()) {
            if (!text.isBlank()) {
                pending.add(AgentStep.thinking(text));
            }
            for (ToolCall call : calls) {
                pending.add(AgentStep.toolCall(call));
                if (tools.lookup(call.getToolName()).isEmpty()) {
                    fail(TerminationReason.TOOL_NOT_FOUND, "Model called unknown tool '" + call.getToolName() + "'", null);
                    return;
                }
            }
            log.info("Model requested {} tool call(s) {} [run={}, step={}]", calls.size(),
                    calls.stream().map(ToolCall::getToolName).toList(), runId, step);
            context.transitionTo(new LoopPhase.ExecutingTools(calls));
            return;
        }

        Optional<JsonNode> document = decoder.parseConforming(text, schema);
        if (document.isPresent()) {
            try {
                T value = decoder.decode(document.get(), schema);
                result = value;
                pending.add(AgentStep.finalResponse(value, decoder.toJson(document.get())));
                context.transitionTo(new LoopPhase.Terminated(TerminationReason.COMPLETED));
                log.info("Agent run completed [run={}, steps={}, tokens={}]",
                        runId, context.getStepCount(), context.getUsage().totalTokens());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                fail(TerminationReason.OUTPUT_DECODING_FAILED,
                        "Answer matched schema '" + schema.name() + "' but could not be bound to "
                                + schema.type().getSimpleName() + ": " + e.getMessage(), e);
            }
            return;
        }

        log.debug("Reply does not match schema '{}' [run={}, step={}]: {}", schema.name(), runId, step, text);
        if (!text.isBlank()) {
            pending.add(AgentStep.thinking(text));
        }
        context.appendMessage(Message.user(String.format(FORMAT_REMINDER, schema.name())));
        finalOutputRequested = !toolDefinitions.isEmpty();
    }

    private void executeTools(LoopPhase.ExecutingTools phase) {
        if (cancelled) {
            fail(TerminationReason.CANCELLED, "Cancelled before tool execution", null);
            return;
        }
        List<ToolCall> calls = phase.pendingCalls();

        List<CompletableFuture<ToolOutput>> futures;
        Map<String, ToolOutput> submitted = submittedResults;
        if (submitted != null) {
            submittedResults = null;
            futures = calls.stream()
                    .map(call -> CompletableFuture.completedFuture(submitted.get(call.getId())))
                    .toList();
        } else {
            try {
                futures = calls.stream()
                        .map(call -> CompletableFuture.supplyAsync(() -> invoke(call), toolExecutor))
                        .toList();
            } catch (RejectedExecutionException e) {
                fail(TerminationReason.TOOL_ERROR, "Tool executor rejected the calls: " + e.getMessage(), e);
                return;
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> null)
                    .join();
        }

        calls.forEach(context::recordToolCall);

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            ToolOutput output;
            try {
                output = futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Tool [{}] threw [run={}, call={}]", call.getToolName(), runId, call.getId(), cause);
                fail(TerminationReason.TOOL_ERROR,
                        "Tool '" + call.getToolName() + "' failed: " + cause.getMessage(), cause);
                return;
            }
            pending.add(AgentStep.toolResult(call.getId(), call.getToolName(), output.output(), output.isError()));
            context.appendMessage(Message.toolResult(call.getId(), call.getToolName(), output.output(), output.isError()));
        }

        TerminationDecision decision = policy.decide(context);
        if (decision.shouldStop()) {
            fail(decision.reason(), decision.detail(), null);
            return;
        }
        context.transitionTo(LoopPhase.awaitingModel());
    }

    private ToolOutput invoke(ToolCall call) {
        ToolExecutor executor = tools.lookup(call.getToolName())
                .orElseThrow(() -> new AgentException("Tool '" + call.getToolName() + "' disappeared"));
        log.info("Executing tool: [{}] [run={}, call={}]", call.getToolName(), runId, call.getId());
        try {
            ToolOutput output = executor.run(objectMapper.writeValueAsString(call.getArguments()));
            return output == null ? ToolOutput.success("") : output;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    /** Providers occasionally omit call ids; results must still be correlatable. */
    private List<ToolCall> withCallIds(List<ToolCall> calls, int step) {
        List<ToolCall> normalized = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            ToolCall.ToolCallBuilder copy = call.toBuilder();
            if (call.getId() == null || call.getId().isBlank()) {
                copy.id("call_" + step + "_" + i);
            }
            if (call.getArguments() == null) {
                copy.arguments(new HashMap<>());
            }
            normalized.add(copy.build());
        }
        return normalized;
    }

    private void fail(TerminationReason reason, String detail, Throwable cause) {
        LoopPhase phaseAtFailure = context.getPhase();
        if (phaseAtFailure instanceof LoopPhase.Retrying) {
            phaseAtFailure = LoopPhase.awaitingModel();
        }
        context.transitionTo(new LoopPhase.Terminated(reason));
        failure = new AgentExecutionException(runId, reason, phaseAtFailure, detail, cause);
        log.warn("Agent run aborted [run={}, reason={}, steps={}]: {}",
                runId, reason, context.getStepCount(), detail);
    }
}

package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.TokenUsage;
import com.deepansh.agentengine.model.ToolCall;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds all mutable state for a single agent run.
 *
 * Only the thread driving the run mutates it. {@link #getPhase()} is the one field
 * other threads read, so it is volatile.
 */
public class AgentContext {

    @Getter
    private final String runId;

    @Getter
    private final AgentConfiguration configuration;

    private final List<Message> messages = new ArrayList<>();
    private final Map<ToolCallKey, Integer> toolCallCounts = new LinkedHashMap<>();
    private final Map<String, Integer> perToolCounts = new LinkedHashMap<>();

    @Getter
    private int stepCount;

    @Getter
    private TokenUsage usage = TokenUsage.ZERO;

    private volatile LoopPhase phase = LoopPhase.awaitingModel();

    public AgentContext(String runId, AgentConfiguration configuration, List<Message> seed) {
        this.runId = runId;
        this.configuration = configuration;
        if (seed != null) {
            messages.addAll(seed);
        }
    }

    /** Read-only view of the history, oldest first. */
    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void appendMessage(Message message) {
        messages.add(message);
    }

    public int incrementStep() {
        return ++stepCount;
    }

    public void addUsage(TokenUsage delta) {
        usage = usage.plus(delta);
    }

    public void recordToolCall(ToolCall call) {
        toolCallCounts.merge(ArgumentCanonicalizer.keyOf(call.getToolName(), call.getArguments()), 1, Integer::sum);
        perToolCounts.merge(call.getToolName(), 1, Integer::sum);
    }

    public int countOf(ToolCallKey key) {
        return toolCallCounts.getOrDefault(key, 0);
    }

    public Map<ToolCallKey, Integer> getToolCallCounts() {
        return Collections.unmodifiableMap(toolCallCounts);
    }

    public Map<String, Integer> getPerToolCounts() {
        return Collections.unmodifiableMap(perToolCounts);
    }

    public LoopPhase getPhase() {
        return phase;
    }

    /**
     * Moves to {@code next} unless the run already terminated.
     *
     * @return false when the run was already terminated and the phase did not change
     */
    public boolean transitionTo(LoopPhase next) {
        if (phase.isTerminal()) {
            return false;
        }
        phase = next;
        return true;
    }
}

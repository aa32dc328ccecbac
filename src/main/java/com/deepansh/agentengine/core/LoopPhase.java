package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.ToolCall;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.util.List;

/**
 * Where a run currently is. Exactly one phase is active at a time and
 * {@link Terminated} is absorbing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "phase")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LoopPhase.AwaitingModel.class, name = "awaitingModel"),
        @JsonSubTypes.Type(value = LoopPhase.ExecutingTools.class, name = "executingTools"),
        @JsonSubTypes.Type(value = LoopPhase.Retrying.class, name = "retrying"),
        @JsonSubTypes.Type(value = LoopPhase.Terminated.class, name = "terminated")
})
public sealed interface LoopPhase
        permits LoopPhase.AwaitingModel, LoopPhase.ExecutingTools, LoopPhase.Retrying, LoopPhase.Terminated {

    record AwaitingModel() implements LoopPhase {
        @Override
        public String label() {
            return "awaitingModel";
        }
    }

    record ExecutingTools(List<ToolCall> pendingCalls) implements LoopPhase {
        public ExecutingTools {
            pendingCalls = List.copyOf(pendingCalls);
        }

        @Override
        public String label() {
            return "executingTools";
        }
    }

    /** Entered from inside a round trip while it waits to retry; left when the round trip returns. */
    record Retrying(int attempt, Duration nextDelay) implements LoopPhase {
        @Override
        public String label() {
            return "retrying";
        }
    }

    record Terminated(TerminationReason reason) implements LoopPhase {
        @Override
        public String label() {
            return "terminated";
        }
    }

    @JsonIgnore
    String label();

    @JsonIgnore
    default boolean isTerminal() {
        return this instanceof Terminated;
    }

    static LoopPhase awaitingModel() {
        return new AwaitingModel();
    }
}

package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TerminationPolicyTest {

    @Test
    void standard_stopsWhenStepBudgetUsed() {
        AgentContext context = context(AgentConfiguration.builder().maxSteps(2).build());
        StandardTerminationPolicy policy = new StandardTerminationPolicy();

        context.incrementStep();
        assertThat(policy.decide(context).shouldStop()).isFalse();

        context.incrementStep();
        assertThat(policy.decide(context).reason()).isEqualTo(TerminationReason.MAX_STEPS_EXCEEDED);
    }

    @Test
    void duplicate_toleratesUpToLimit() {
        AgentContext context = context(AgentConfiguration.builder().maxDuplicateToolCalls(2).build());
        DuplicateDetectionPolicy policy = new DuplicateDetectionPolicy();

        context.recordToolCall(call("search", Map.of("q", "java")));
        context.recordToolCall(call("search", Map.of("q", "java")));
        assertThat(policy.decide(context).shouldStop()).isFalse();

        context.recordToolCall(call("search", Map.of("q", "java")));
        TerminationDecision decision = policy.decide(context);
        assertThat(decision.reason()).isEqualTo(TerminationReason.DUPLICATE_CALLS_DETECTED);
        assertThat(decision.detail()).contains("search");
    }

    @Test
    void duplicate_differentArgumentsAreDistinct() {
        AgentContext context = context(AgentConfiguration.builder()
                .maxDuplicateToolCalls(1).maxToolCallsPerTool(null).build());

        context.recordToolCall(call("search", Map.of("q", "a")));
        context.recordToolCall(call("search", Map.of("q", "b")));
        context.recordToolCall(call("search", Map.of("q", "c")));

        assertThat(new DuplicateDetectionPolicy().decide(context).shouldStop()).isFalse();
    }

    @Test
    void perToolLimit_stopsWithToolCallLimitReached() {
        AgentContext context = context(AgentConfiguration.builder()
                .maxDuplicateToolCalls(10).maxToolCallsPerTool(2).build());

        context.recordToolCall(call("search", Map.of("q", "a")));
        context.recordToolCall(call("search", Map.of("q", "b")));
        assertThat(new DuplicateDetectionPolicy().decide(context).shouldStop()).isFalse();

        context.recordToolCall(call("search", Map.of("q", "c")));
        assertThat(new DuplicateDetectionPolicy().decide(context).reason())
                .isEqualTo(TerminationReason.TOOL_CALL_LIMIT_REACHED);
    }

    @Test
    void perToolLimit_nullMeansUnlimited() {
        AgentContext context = context(AgentConfiguration.builder()
                .maxDuplicateToolCalls(100).maxToolCallsPerTool(null).build());
        for (int i = 0; i < 50; i++) {
            context.recordToolCall(call("search", Map.of("q", i)));
        }
        assertThat(new DuplicateDetectionPolicy().decide(context).shouldStop()).isFalse();
    }

    @Test
    void composite_returnsFirstStopInOrder() {
        AgentContext context = context(AgentConfiguration.builder().maxSteps(1).maxDuplicateToolCalls(0).build());
        context.incrementStep();
        context.recordToolCall(call("search", Map.of()));

        TerminationDecision decision = TerminationPolicy.defaultPolicy().decide(context);

        assertThat(decision.reason()).isEqualTo(TerminationReason.DUPLICATE_CALLS_DETECTED);
    }

    @Test
    void composite_proceedsWhenAllProceed() {
        TerminationPolicy policy = new CompositeTerminationPolicy(
                ctx -> TerminationDecision.proceed(), ctx -> TerminationDecision.proceed());
        assertThat(policy.decide(context(AgentConfiguration.DEFAULT)).shouldStop()).isFalse();
    }

    private static AgentContext context(AgentConfiguration config) {
        return new AgentContext("run-1", config, List.of(Message.user("hi")));
    }

    private static ToolCall call(String tool, Map<String, Object> args) {
        return ToolCall.builder().id("c").toolName(tool).arguments(args).build();
    }
}

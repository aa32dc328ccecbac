package com.deepansh.agentengine.testsupport;

import com.deepansh.agentengine.llm.ProviderRoundTrip;
import com.deepansh.agentengine.model.ProviderRequest;
import com.deepansh.agentengine.model.ProviderResponse;
import com.deepansh.agentengine.model.StopReason;
import com.deepansh.agentengine.model.TokenUsage;
import com.deepansh.agentengine.model.ToolCall;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fake provider that plays back a fixed script of replies and failures, in order,
 * and records every request it receives.
 */
public class ScriptedRoundTrip implements ProviderRoundTrip {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<ProviderRequest> requests = new CopyOnWriteArrayList<>();

    public ScriptedRoundTrip reply(ProviderResponse response) {
        script.add(response);
        return this;
    }

    public ScriptedRoundTrip replyText(String text) {
        return reply(ProviderResponse.builder()
                .textBlock(text)
                .stopReason(StopReason.END_TURN)
                .usage(new TokenUsage(10, 5))
                .build());
    }

    public ScriptedRoundTrip replyToolCalls(ToolCall... calls) {
        return replyToolCalls(null, calls);
    }

    public ScriptedRoundTrip replyToolCalls(String prose, ToolCall... calls) {
        ProviderResponse.ProviderResponseBuilder builder = ProviderResponse.builder()
                .stopReason(StopReason.TOOL_USE)
                .usage(new TokenUsage(10, 5));
        if (prose != null) {
            builder.textBlock(prose);
        }
        for (ToolCall call : calls) {
            builder.toolCall(call);
        }
        return reply(builder.build());
    }

    public ScriptedRoundTrip fail(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    @Override
    public synchronized ProviderResponse execute(ProviderRequest request) {
        requests.add(request);
        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("Script exhausted after " + requests.size() + " request(s)");
        }
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        return (ProviderResponse) next;
    }

    public List<ProviderRequest> requests() {
        return requests;
    }

    public int callCount() {
        return requests.size();
    }

    public static ToolCall call(String id, String toolName, Map<String, Object> arguments) {
        return ToolCall.builder().id(id).toolName(toolName).arguments(arguments).build();
    }
}

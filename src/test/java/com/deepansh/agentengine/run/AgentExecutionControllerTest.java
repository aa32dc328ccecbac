package com.deepansh.agentengine.run;

import com.deepansh.agentengine.config.AgentProperties;
import com.deepansh.agentengine.core.AgentExecutionEngine;
import com.deepansh.agentengine.core.AgentExecutionException;
import com.deepansh.agentengine.core.AgentRunSpec;
import com.deepansh.agentengine.core.LoopPhase;
import com.deepansh.agentengine.core.TerminationReason;
import com.deepansh.agentengine.exception.RunNotFoundException;
import com.deepansh.agentengine.llm.ProviderException;
import com.deepansh.agentengine.model.AgentRunRequest;
import com.deepansh.agentengine.model.AgentStep;
import com.deepansh.agentengine.retry.RetryConfiguration;
import com.deepansh.agentengine.retry.RetryPolicy;
import com.deepansh.agentengine.retry.RetryingRoundTrip;
import com.deepansh.agentengine.testsupport.ScriptedRoundTrip;
import com.deepansh.agentengine.tool.ToolOutput;
import com.deepansh.agentengine.tool.ToolRegistry;
import com.deepansh.agentengine.tool.impl.CalculatorTool;
import com.deepansh.agentengine.tool.impl.EchoTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static com.deepansh.agentengine.testsupport.ScriptedRoundTrip.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentExecutionControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ScriptedRoundTrip provider;
    private AgentProperties properties;
    private List<Runnable> deferred;
    private AgentExecutionController controller;

    @BeforeEach
    void setUp() {
        provider = new ScriptedRoundTrip();
        properties = new AgentProperties();
        deferred = new ArrayList<>();
        controller = controller(Runnable::run);
    }

    @Test
    void runSync_completesOnCallingThread() {
        provider.replyToolCalls(call("c1", "calculator", Map.of("expression", "6*7")))
                .replyText("{\"answer\":\"42\"}");

        AgentRunHandle handle = controller.runSync(request("What is 6*7?"));

        assertThat(handle.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(handle.output()).contains(Map.of("answer", "42"));
        assertThat(handle.steps()).hasSize(3);
        assertThat(handle.getStartedAt()).isEqualTo(NOW);
        assertThat(controller.find(handle.getRunId())).isSameAs(handle);
        assertThat(handle.result()).isCompletedWithValue(Map.of("answer", "42"));
    }

    @Test
    void start_runsOnRunExecutor() {
        AgentExecutionController background = controller(deferred::add);
        provider.replyText("{\"answer\":\"later\"}");

        AgentRunHandle handle = background.start(request("hi"));

        assertThat(handle.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(provider.callCount()).isZero();

        deferred.forEach(Runnable::run);

        assertThat(handle.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(handle.output()).contains(Map.of("answer", "later"));
    }

    @Test
    void failedRun_exposesErrorAndFailsFuture() {
        provider.fail(ProviderException.fatal(401, "invalid key", null));

        AgentRunHandle handle = controller.runSync(request("hi"));

        assertThat(handle.status()).isEqualTo(RunStatus.FAILED);
        assertThat(handle.output()).isEmpty();
        assertThat(handle.error()).get().isInstanceOfSatisfying(AgentExecutionException.class,
                e -> assertThat(e.getReason()).isEqualTo(TerminationReason.PROVIDER_ERROR));
        assertThatThrownBy(() -> handle.awaitResult(Duration.ofSeconds(1)))
                .isInstanceOf(AgentExecutionException.class);
    }

    @Test
    void requestOverrides_replaceConfiguredDefaults() {
        AgentRunRequest request = request("q");
        request.setMaxSteps(3);
        request.setAutoExecuteTools(false);
        request.setTools(List.of("echo"));
        request.setOutputSchemaName("verdict");
        request.setOutputSchema(Map.of("type", "object", "required", List.of("verdict")));

        AgentRunSpec<Map<String, Object>> spec = controller.toSpec(request);

        assertThat(spec.getConfiguration().getMaxSteps()).isEqualTo(3);
        assertThat(spec.getConfiguration().isAutoExecuteTools()).isFalse();
        assertThat(spec.getConfiguration().getMaxDuplicateToolCalls()).isEqualTo(properties.getMaxDuplicateToolCalls());
        assertThat(spec.getTools().toolCount()).isEqualTo(1);
        assertThat(spec.getOutputSchema().name()).isEqualTo("verdict");
    }

    @Test
    void toSpec_withoutSchema_usesDefaultAnswerSchema() {
        AgentRunSpec<Map<String, Object>> spec = controller.toSpec(request("q"));

        assertThat(spec.getOutputSchema().name()).isEqualTo(AgentExecutionController.DEFAULT_SCHEMA_NAME);
        assertThat(spec.getOutputSchema().jsonSchema()).isEqualTo(AgentExecutionController.DEFAULT_OUTPUT_SCHEMA);
        assertThat(spec.getTools().toolCount()).isEqualTo(2);
    }

    @Test
    void manualTools_pauseThenResumeWithSubmittedResults() {
        provider.replyToolCalls(call("c1", "echo", Map.of("message", "x")))
                .replyText("{\"answer\":\"from caller\"}");
        AgentRunRequest request = request("go");
        request.setAutoExecuteTools(false);

        AgentRunHandle handle = controller.runSync(request);

        assertThat(handle.status()).isEqualTo(RunStatus.AWAITING_TOOL_RESULTS);
        assertThat(controller.currentPhase(handle.getRunId())).isInstanceOf(LoopPhase.ExecutingTools.class);

        controller.submitToolResults(handle.getRunId(), Map.of("c1", ToolOutput.success("from caller")));

        assertThat(handle.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(handle.steps()).element(1)
                .isEqualTo(new AgentStep.ToolResultStep("c1", "echo", "from caller", false));
    }

    @Test
    void cancel_pausedRun_endsAsCancelled() {
        provider.replyToolCalls(call("c1", "echo", Map.of("message", "x")));
        AgentRunRequest request = request("go");
        request.setAutoExecuteTools(false);
        AgentRunHandle handle = controller.runSync(request);

        controller.cancel(handle.getRunId());

        assertThat(handle.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(handle.error()).get().isInstanceOfSatisfying(AgentExecutionException.class,
                e -> assertThat(e.isResumable()).isTrue());
    }

    @Test
    void subscribe_lateListener_getsReplayAndCompletion() {
        provider.replyToolCalls(call("c1", "echo", Map.of("message", "x")))
                .replyText("{\"answer\":\"x\"}");
        AgentRunHandle handle = controller.runSync(request("go"));

        List<AgentStep> seen = new ArrayList<>();
        AtomicReference<Object> completed = new AtomicReference<>();
        handle.subscribe(new AgentStepListener() {
            @Override
            public void onStep(AgentStep step) {
                seen.add(step);
            }

            @Override
            public void onComplete(Object output) {
                completed.set(output);
            }
        });

        assertThat(seen).hasSize(3);
        assertThat(completed.get()).isEqualTo(Map.of("answer", "x"));
    }

    @Test
    void subscribe_liveListener_receivesStepsAsEmitted() {
        AgentExecutionController background = controller(deferred::add);
        provider.replyText("{\"answer\":\"live\"}");
        AgentRunHandle handle = background.start(request("go"));

        List<AgentStep> seen = new ArrayList<>();
        AtomicReference<Throwable> failed = new AtomicReference<>();
        handle.subscribe(new AgentStepListener() {
            @Override
            public void onStep(AgentStep step) {
                seen.add(step);
            }

            @Override
            public void onError(Throwable error) {
                failed.set(error);
            }
        });
        deferred.forEach(Runnable::run);

        assertThat(seen).singleElement().isInstanceOf(AgentStep.FinalResponse.class);
        assertThat(failed.get()).isNull();
    }

    @Test
    void discard_forgetsRun() {
        provider.replyText("{\"answer\":\"x\"}");
        AgentRunHandle handle = controller.runSync(request("go"));

        controller.discard(handle.getRunId());

        assertThat(controller.list()).isEmpty();
        assertThatThrownBy(() -> controller.find(handle.getRunId())).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> controller.discard(handle.getRunId())).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void find_unknownRun_throws() {
        assertThatThrownBy(() -> controller.find("nope")).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void finishedRuns_areEvictedAfterRetention_pausedRunsAreKept() {
        MutableClock clock = new MutableClock(NOW);
        properties.setRunRetention(Duration.ofMinutes(10));
        AgentExecutionController sync = controller(Runnable::run, clock);

        provider.replyToolCalls(call("c1", "echo", Map.of("message", "x")));
        AgentRunRequest manual = request("wait for me");
        manual.setAutoExecuteTools(false);
        AgentRunHandle paused = sync.runSync(manual);
        for (int i = 0; i < 200; i++) {
            provider.replyText("{\"answer\":\"" + i + "\"}");
            sync.runSync(request("q" + i));
        }
        assertThat(sync.list()).hasSize(201);

        clock.advance(Duration.ofMinutes(5));
        provider.replyText("{\"answer\":\"recent\"}");
        AgentRunHandle recent = sync.runSync(request("recent"));
        assertThat(recent.getFinishedAt()).contains(NOW.plus(Duration.ofMinutes(5)));

        clock.advance(Duration.ofMinutes(6));
        provider.replyText("{\"answer\":\"latest\"}");
        AgentRunHandle latest = sync.runSync(request("latest"));

        assertThat(sync.list()).containsExactlyInAnyOrder(paused, recent, latest);
        assertThat(paused.status()).isEqualTo(RunStatus.AWAITING_TOOL_RESULTS);
        assertThat(paused.getFinishedAt()).isEmpty();
    }

    private AgentExecutionController controller(Executor runExecutor) {
        return controller(runExecutor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AgentExecutionController controller(Executor runExecutor, Clock clock) {
        AgentExecutionEngine engine = new AgentExecutionEngine(
                new RetryingRoundTrip(provider, new RetryPolicy(RetryConfiguration.DISABLED), null),
                Runnable::run, objectMapper);
        ToolRegistry registry = new ToolRegistry(List.of(new CalculatorTool(), new EchoTool()), objectMapper);
        return new AgentExecutionController(engine, registry, properties, runExecutor, clock);
    }

    private static AgentRunRequest request(String prompt) {
        AgentRunRequest request = new AgentRunRequest();
        request.setPrompt(prompt);
        return request;
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

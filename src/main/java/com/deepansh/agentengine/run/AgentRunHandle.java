package com.deepansh.agentengine.run;

import com.deepansh.agentengine.core.AgentExecutionException;
import com.deepansh.agentengine.core.AgentRun;
import com.deepansh.agentengine.core.LoopPhase;
import com.deepansh.agentengine.core.TerminationReason;
import com.deepansh.agentengine.model.AgentStep;
import com.deepansh.agentengine.model.TokenUsage;
import com.deepansh.agentengine.tool.ToolOutput;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A run executing in the background. Collects the emitted steps, fans them out to
 * subscribers and exposes the outcome as a future.
 */
@Slf4j
public class AgentRunHandle {

    private final AgentRun<?> run;
    private final Executor executor;
    private final Clock clock;
    private final Instant startedAt;

    private final List<AgentStep> steps = new CopyOnWriteArrayList<>();
    private final List<AgentStepListener> listeners = new ArrayList<>();
    private final Object listenerLock = new Object();
    private final Object driveLock = new Object();
    private final CompletableFuture<Object> result = new CompletableFuture<>();

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile Throwable error;
    private volatile Instant finishedAt;

    AgentRunHandle(AgentRun<?> run, Executor executor, Clock clock) {
        this.run = run;
        this.executor = executor;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public String getRunId() {
        return run.getRunId();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /** Empty while the run is still going or paused. */
    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public RunStatus status() {
        return status;
    }

    public LoopPhase currentPhase() {
        return run.currentPhase();
    }

    /** Snapshot of the steps emitted so far. */
    public List<AgentStep> steps() {
        return List.copyOf(steps);
    }

    public int stepCount() {
        return run.getStepCount();
    }

    public TokenUsage usage() {
        return run.getUsage();
    }

    public Optional<Object> output() {
        if (!result.isDone() || result.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(result.join());
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public CompletableFuture<Object> result() {
        return result;
    }

    /**
     * Blocks until the run finishes.
     *
     * @return the decoded final answer
     * @throws AgentExecutionException when the run ended without an answer
     * @throws TimeoutException when the run is still going after {@code timeout}
     */
    public Object awaitResult(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    public void cancel() {
        run.cancel();
        log.info("Cancellation requested [run={}, phase={}]", getRunId(), run.currentPhase().label());
        if (status == RunStatus.AWAITING_TOOL_RESULTS) {
            pump();
        }
    }

    public void submitToolResults(Map<String, ToolOutput> outputs) {
        run.submitToolResults(outputs);
        status = RunStatus.RUNNING;
        pump();
    }

    /** Replays the steps emitted so far, then streams live ones. */
    public void subscribe(AgentStepListener listener) {
        synchronized (listenerLock) {
            steps.forEach(listener::onStep);
            if (status.isDone()) {
                notifyEnd(listener);
            } else {
                listeners.add(listener);
            }
        }
    }

    public void unsubscribe(AgentStepListener listener) {
        synchronized (listenerLock) {
            listeners.remove(listener);
        }
    }

    void pump() {
        executor.execute(this::drive);
    }

    private void drive() {
        synchronized (driveLock) {
            if (status.isDone()) {
                return;
            }
            try {
                while (run.hasNext()) {
                    AgentStep step = run.next();
                    publish(step);
                    if (step instanceof AgentStep.FinalResponse answer) {
                        finish(RunStatus.COMPLETED, answer.output(), null);
                    }
                }
                if (run.isAwaitingToolResults()) {
                    status = RunStatus.AWAITING_TOOL_RESULTS;
                    log.info("Run paused for tool results [run={}]", getRunId());
                }
            } catch (AgentExecutionException e) {
                finish(e.getReason() == TerminationReason.CANCELLED ? RunStatus.CANCELLED : RunStatus.FAILED, null, e);
            } catch (RuntimeException e) {
                log.error("Agent run crashed [run={}]", getRunId(), e);
                finish(RunStatus.FAILED, null, e);
            }
        }
    }

    private void publish(AgentStep step) {
        synchronized (listenerLock) {
            steps.add(step);
            for (AgentStepListener listener : List.copyOf(listeners)) {
                try {
                    listener.onStep(step);
                } catch (RuntimeException e) {
                    log.debug("Dropping listener that failed on step [run={}]: {}", getRunId(), e.getMessage());
                    listeners.remove(listener);
                }
            }
        }
    }

    private void finish(RunStatus finalStatus, Object output, Throwable failure) {
        synchronized (listenerLock) {
            this.error = failure;
            this.finishedAt = clock.instant();
            this.status = finalStatus;
            for (AgentStepListener listener : List.copyOf(listeners)) {
                try {
                    notifyEnd(listener);
                } catch (RuntimeException e) {
                    log.debug("Listener failed on completion [run={}]: {}", getRunId(), e.getMessage());
                }
            }
            listeners.clear();
        }
        if (failure == null) {
            result.complete(output);
        } else {
            result.completeExceptionally(failure);
        }
    }

    private void notifyEnd(AgentStepListener listener) {
        if (error != null) {
            listener.onError(error);
        } else {
            listener.onComplete(finalOutput());
        }
    }

    private Object finalOutput() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i) instanceof AgentStep.FinalResponse answer) {
                return answer.output();
            }
        }
        return null;
    }
}

package com.deepansh.agentengine.retry;

import com.deepansh.agentengine.llm.FailureKind;
import com.deepansh.agentengine.llm.ProviderException;
import com.deepansh.agentengine.llm.ProviderRoundTrip;
import com.deepansh.agentengine.model.ProviderRequest;
import com.deepansh.agentengine.model.ProviderResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Decorates a {@link ProviderRoundTrip} with classified retries.
 *
 * Every failure becomes a {@link ProviderException}: network errors count as SERVER_ERROR,
 * anything unrecognised as FATAL. Rate-limited failures get the vendor's reset hint attached
 * before the {@link RetryPolicy} picks the wait. Resilience4j drives the attempts; each retry
 * publishes a {@link RetryEvent} to the configured listener and the per-call one, then sleeps.
 */
@Slf4j
public class RetryingRoundTrip implements ProviderRoundTrip {

    private final ProviderRoundTrip delegate;
    private final RetryPolicy policy;
    private final RateLimitHintExtractor hintExtractor;

    public RetryingRoundTrip(ProviderRoundTrip delegate, RetryPolicy policy, RateLimitHintExtractor hintExtractor) {
        this.delegate = delegate;
        this.policy = policy;
        this.hintExtractor = hintExtractor == null ? RateLimitHintExtractor.none() : hintExtractor;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    @Override
    public ProviderResponse execute(ProviderRequest request) {
        return execute(request, null);
    }

    /**
     * @param callListener notified of retries of this call only, in addition to the configured listener
     * @throws ProviderException the first fatal failure, or the last transient one once retries run out
     */
    public ProviderResponse execute(ProviderRequest request, RetryEventListener callListener) {
        RetryConfiguration config = policy.getConfig();
        List<RetryEventListener> listeners = Stream.of(config.listener(), callListener)
                .filter(Objects::nonNull)
                .toList();

        RetryConfig retryConfig = RetryConfig.<ProviderResponse>custom()
                .maxAttempts(config.maxRetries() + 1)
                .retryOnException(t -> t instanceof ProviderException pe && pe.getKind() != FailureKind.FATAL)
                .intervalBiFunction((numOfAttempts, either) -> policy
                        .nextDelay(numOfAttempts - 1, (ProviderException) either.getLeft())
                        .map(Duration::toMillis)
                        .orElse(0L))
                .build();

        Retry retry = Retry.of("llm-round-trip", retryConfig);
        retry.getEventPublisher().onRetry(e -> {
            ProviderException failure = (ProviderException) e.getLastThrowable();
            RetryEvent event = new RetryEvent(e.getNumberOfRetryAttempts(), config.maxRetries(),
                    e.getWaitInterval(), failure.getKind(), failure.getStatusCode(), failure.getMessage());
            log.warn("LLM round trip failed [{} {}], retry {}/{} in {}ms: {}",
                    event.reason(), event.statusCode(), event.attempt(), event.maxRetries(),
                    event.delay().toMillis(), event.message());
            listeners.forEach(l -> l.onRetry(event));
        });
        retry.getEventPublisher().onError(e ->
                log.error("LLM round trip gave up after {} attempt(s): {}",
                        e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));

        return retry.executeSupplier(() -> attempt(request));
    }

    private ProviderResponse attempt(ProviderRequest request) {
        try {
            return delegate.execute(request);
        } catch (ProviderException e) {
            if (e.getKind() == FailureKind.RATE_LIMITED && e.getRetryAfter().isEmpty()) {
                Optional<Duration> hint = hintExtractor.extract(e.getHeaders());
                if (hint.isPresent()) {
                    log.debug("Rate-limit hint: wait at least {}ms", hint.get().toMillis());
                    throw e.withRetryAfter(hint.get());
                }
            }
            throw e;
        } catch (ResourceAccessException e) {
            throw ProviderException.serverError(0, "Provider unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw ProviderException.fatal(0, "Unexpected provider failure: " + e.getMessage(), e);
        }
    }
}

package com.deepansh.agentengine.retry;

import com.deepansh.agentengine.llm.FailureKind;
import com.deepansh.agentengine.llm.ProviderException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 *
 * <pre>
 * delay = min(maxDelay, baseDelay * 2^attempt) * uniform(1, 1 + jitter), capped at maxDelay
 * </pre>
 *
 * Jitter only ever lengthens the wait, so delays never decrease from one attempt to the next.
 *
 * A retry-after hint on a rate-limited failure replaces the computed delay when it is
 * longer, still capped at {@code maxDelay}.
 */
public class RetryPolicy {

    private final RetryConfiguration config;
    private final DoubleSupplier random;

    public RetryPolicy(RetryConfiguration config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random source of values in [0, 1) used for jitter */
    public RetryPolicy(RetryConfiguration config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    public RetryConfiguration getConfig() {
        return config;
    }

    /**
     * @param attempt 0 for the first try
     * @return the wait before the next attempt, or empty when the failure must propagate
     */
    public Optional<Duration> nextDelay(int attempt, ProviderException failure) {
        if (failure.getKind() == FailureKind.FATAL || attempt >= config.maxRetries()) {
            return Optional.empty();
        }

        long maxMillis = config.maxDelay().toMillis();
        double exponential = config.baseDelay().toMillis() * Math.pow(2, attempt);
        double capped = Math.min(maxMillis, exponential);

        double jitter = config.jitterFraction();
        double factor = 1.0 + jitter * random.getAsDouble();
        long delayMillis = (long) Math.min(maxMillis, capped * factor);

        Duration delay = Duration.ofMillis(delayMillis);
        Optional<Duration> hint = failure.getRetryAfter();
        if (hint.isPresent() && hint.get().compareTo(delay) > 0) {
            delay = hint.get().compareTo(config.maxDelay()) > 0 ? config.maxDelay() : hint.get();
        }
        return Optional.of(delay);
    }
}

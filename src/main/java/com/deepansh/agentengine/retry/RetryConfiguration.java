package com.deepansh.agentengine.retry;

import java.time.Duration;
import java.util.Locale;

/**
 * Retry budget and backoff shape for provider round trips.
 *
 * Values are clamped on construction: negative retries and delays become zero,
 * {@code maxDelay} is never below {@code baseDelay}, and jitter stays in [0, 1].
 */
public record RetryConfiguration(int maxRetries, Duration baseDelay, Duration maxDelay,
                                 double jitterFraction, RetryEventListener listener) {

    public static final RetryConfiguration DEFAULT =
            new RetryConfiguration(5, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.1, null);

    public static final RetryConfiguration DISABLED =
            new RetryConfiguration(0, Duration.ZERO, Duration.ZERO, 0.0, null);

    public static final RetryConfiguration AGGRESSIVE =
            new RetryConfiguration(10, Duration.ofMillis(500), Duration.ofSeconds(120), 0.2, null);

    public static final RetryConfiguration CONSERVATIVE =
            new RetryConfiguration(3, Duration.ofSeconds(2), Duration.ofSeconds(30), 0.1, null);

    public RetryConfiguration {
        maxRetries = Math.max(0, maxRetries);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
        jitterFraction = Double.isNaN(jitterFraction) ? 0.0 : Math.min(1.0, Math.max(0.0, jitterFraction));
    }

    public static RetryConfiguration custom(int maxRetries, Duration baseDelay, Duration maxDelay,
                                            double jitterFraction) {
        return new RetryConfiguration(maxRetries, baseDelay, maxDelay, jitterFraction, null);
    }

    /** Resolves a preset by name: default, disabled, aggressive or conservative. */
    public static RetryConfiguration preset(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "default" -> DEFAULT;
            case "disabled", "none" -> DISABLED;
            case "aggressive" -> AGGRESSIVE;
            case "conservative" -> CONSERVATIVE;
            default -> throw new IllegalArgumentException("Unknown retry preset '" + name
                    + "'. Expected one of: default, disabled, aggressive, conservative");
        };
    }

    public RetryConfiguration withListener(RetryEventListener listener) {
        return new RetryConfiguration(maxRetries, baseDelay, maxDelay, jitterFraction, listener);
    }
}

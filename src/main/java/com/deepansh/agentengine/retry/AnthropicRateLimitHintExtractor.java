package com.deepansh.agentengine.retry;

import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Anthropic-style headers: {@code retry-after}, then {@code anthropic-ratelimit-requests-reset},
 * then {@code anthropic-ratelimit-tokens-reset}. The reset headers are RFC 3339 instants.
 */
public class AnthropicRateLimitHintExtractor implements RateLimitHintExtractor {

    static final String REQUESTS_RESET = "anthropic-ratelimit-requests-reset";
    static final String TOKENS_RESET = "anthropic-ratelimit-tokens-reset";

    private final Clock clock;

    public AnthropicRateLimitHintExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Duration> extract(HttpHeaders headers) {
        return RetryAfterHintExtractor.parse(headers.getFirst(HttpHeaders.RETRY_AFTER), clock)
                .or(() -> untilInstant(headers.getFirst(REQUESTS_RESET)))
                .or(() -> untilInstant(headers.getFirst(TOKENS_RESET)));
    }

    private Optional<Duration> untilInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            Duration until = Duration.between(clock.instant(), OffsetDateTime.parse(value.trim()).toInstant());
            return Optional.of(until.isNegative() ? Duration.ZERO : until);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}

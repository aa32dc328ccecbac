package com.deepansh.agentengine.retry;

import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Standard {@code Retry-After} header: delta-seconds, or an HTTP-date.
 */
public class RetryAfterHintExtractor implements RateLimitHintExtractor {

    private final Clock clock;

    public RetryAfterHintExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Duration> extract(HttpHeaders headers) {
        return parse(headers.getFirst(HttpHeaders.RETRY_AFTER), clock);
    }

    static Optional<Duration> parse(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            double seconds = Double.parseDouble(trimmed);
            if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration until = Duration.between(clock.instant(), at.toInstant());
                return Optional.of(until.isNegative() ? Duration.ZERO : until);
            } catch (DateTimeParseException notDate) {
                return Optional.empty();
            }
        }
    }
}

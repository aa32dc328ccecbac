package com.deepansh.agentengine.retry;

import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-style headers (also sent by Groq): {@code retry-after}, then
 * {@code x-ratelimit-reset-requests}, then {@code x-ratelimit-reset-tokens}.
 * Reset values look like {@code 120ms}, {@code 1s}, {@code 2m}, {@code 6m0s} or bare seconds.
 */
public class OpenAiRateLimitHintExtractor implements RateLimitHintExtractor {

    static final String RESET_REQUESTS = "x-ratelimit-reset-requests";
    static final String RESET_TOKENS = "x-ratelimit-reset-tokens";

    private static final Pattern BARE_SECONDS = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h)");

    private final Clock clock;

    public OpenAiRateLimitHintExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Duration> extract(HttpHeaders headers) {
        return RetryAfterHintExtractor.parse(headers.getFirst(HttpHeaders.RETRY_AFTER), clock)
                .or(() -> parseReset(headers.getFirst(RESET_REQUESTS)))
                .or(() -> parseReset(headers.getFirst(RESET_TOKENS)));
    }

    static Optional<Duration> parseReset(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (BARE_SECONDS.matcher(trimmed).matches()) {
            return Optional.of(Duration.ofMillis(Math.round(Double.parseDouble(trimmed) * 1000)));
        }

        Matcher m = COMPONENT.matcher(trimmed);
        double millis = 0;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) {
                return Optional.empty();
            }
            double amount = Double.parseDouble(m.group(1));
            millis += switch (m.group(2)) {
                case "ms" -> amount;
                case "s" -> amount * 1_000;
                case "m" -> amount * 60_000;
                default -> amount * 3_600_000;
            };
            end = m.end();
        }
        if (end == 0 || end != trimmed.length()) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(millis)));
    }
}

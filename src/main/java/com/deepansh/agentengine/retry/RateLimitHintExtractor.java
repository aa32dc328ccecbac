package com.deepansh.agentengine.retry;

import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads a vendor's "wait at least this long" hint from the headers of a 429 response.
 * Each provider family advertises its reset window differently.
 */
@FunctionalInterface
public interface RateLimitHintExtractor {

    Optional<Duration> extract(HttpHeaders headers);

    static RateLimitHintExtractor none() {
        return headers -> Optional.empty();
    }
}

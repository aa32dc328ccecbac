package com.deepansh.agentengine.llm;

import lombok.Getter;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.Optional;

/**
 * A classified round-trip failure. Carries the response headers so a
 * {@link com.deepansh.agentengine.retry.RateLimitHintExtractor} can read vendor hints from them.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final FailureKind kind;

    /** HTTP status, or 0 when no response was received */
    private final int statusCode;

    private final HttpHeaders headers;

    private final Duration retryAfter;

    public ProviderException(FailureKind kind, int statusCode, String message,
                             HttpHeaders headers, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.headers = headers == null ? HttpHeaders.EMPTY : headers;
        this.retryAfter = retryAfter;
    }

    public static ProviderException rateLimited(String message, HttpHeaders headers) {
        return new ProviderException(FailureKind.RATE_LIMITED, 429, message, headers, null, null);
    }

    public static ProviderException serverError(int statusCode, String message, Throwable cause) {
        return new ProviderException(FailureKind.SERVER_ERROR, statusCode, message, null, null, cause);
    }

    public static ProviderException fatal(int statusCode, String message, Throwable cause) {
        return new ProviderException(FailureKind.FATAL, statusCode, message, null, null, cause);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public ProviderException withRetryAfter(Duration hint) {
        ProviderException copy = new ProviderException(kind, statusCode, getMessage(), headers, hint, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}

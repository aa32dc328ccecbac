package com.deepansh.agentengine.retry;

import com.deepansh.agentengine.llm.FailureKind;

import java.time.Duration;

/**
 * Published once per retry, before the wait starts.
 *
 * @param attempt    1-based retry number
 * @param maxRetries retries the policy allows in total
 * @param delay      wait before the next attempt
 * @param statusCode HTTP status of the failure, 0 when no response was received
 */
public record RetryEvent(int attempt, int maxRetries, Duration delay, FailureKind reason,
                         int statusCode, String message) {

    public int remainingRetries() {
        return Math.max(0, maxRetries - attempt);
    }
}

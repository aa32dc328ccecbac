package com.deepansh.agentengine.llm;

/**
 * Classification of a failed round trip.
 *
 * | Kind          | Typical cause                                  | Retried |
 * |---------------|------------------------------------------------|---------|
 * | RATE_LIMITED  | HTTP 429                                       | yes     |
 * | SERVER_ERROR  | HTTP 5xx, 408, connection reset, read timeout  | yes     |
 * | FATAL         | 401/403, malformed request, undecodable body   | no      |
 */
public enum FailureKind {
    RATE_LIMITED,
    SERVER_ERROR,
    FATAL;

    public boolean isTransient() {
        return this != FATAL;
    }
}

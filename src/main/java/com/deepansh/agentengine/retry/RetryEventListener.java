package com.deepansh.agentengine.retry;

@FunctionalInterface
public interface RetryEventListener {

    void onRetry(RetryEvent event);
}

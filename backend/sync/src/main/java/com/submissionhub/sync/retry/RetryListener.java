package com.submissionhub.sync.retry;

import java.time.Duration;

@FunctionalInterface
public interface RetryListener {
    RetryListener NONE = (operation, attempt, delay, cause) -> {
    };

    void onRetry(String operation, int attempt, Duration delay, RuntimeException cause);
}

package com.submissionhub.sync.retry;

import com.submissionhub.sync.config.SyncSettings;
import com.submissionhub.sync.error.ConnectivityException;
import com.submissionhub.sync.error.RemoteServerException;
import com.submissionhub.sync.error.SyncException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

// maxAttempts counts the first attempt.
public final class RetryPolicy {
    private static final Logger LOGGER = Logger.getLogger(RetryPolicy.class.getName());

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final Predicate<RuntimeException> retryable;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryPolicy(
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay,
            double jitter,
            Predicate<RuntimeException> retryable,
            Sleeper sleeper,
            DoubleSupplier random
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay is required");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay is required");
        this.jitter = jitter;
        this.retryable = Objects.requireNonNull(retryable, "retryable is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.random = Objects.requireNonNull(random, "random is required");
    }

    public static RetryPolicy from(SyncSettings settings) {
        return new RetryPolicy(
                settings.maxAttempts(),
                settings.retryBaseDelay(),
                settings.retryMaxDelay(),
                settings.retryJitter(),
                RetryPolicy::isTransient,
                Sleeper.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    public static boolean isTransient(RuntimeException failure) {
        return failure instanceof SyncException classified && classified.retryable();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        return execute(operation, call, RetryListener.NONE);
    }

    public <T> T execute(String operation, Supplier<T> call, RetryListener listener) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (RuntimeException failure) {
                if (attempt >= maxAttempts || !retryable.test(failure)) {
                    throw failure;
                }
                Duration delay = delayFor(attempt, failure);
                LOGGER.warning(operation + " failed on attempt " + attempt + "/" + maxAttempts
                        + ", retrying in " + delay.toMillis() + " ms: " + failure.getMessage());
                listener.onRetry(operation, attempt, delay, failure);
                pause(operation, delay);
            }
        }
    }

    Duration delayFor(int attempt, RuntimeException failure) {
        long base = baseDelay.toMillis();
        long exponential = base << Math.min(attempt - 1, 30);
        long cap = maxDelay.toMillis();
        long capped = Math.min(exponential < 0 ? Long.MAX_VALUE : exponential, cap);
        // jitter goes on top of the cap so retries that hit it still spread out
        long jittered = capped + (long) (capped * jitter * random.getAsDouble());
        if (failure instanceof RemoteServerException server && server.retryAfter().isPresent()) {
            jittered = Math.max(jittered, Math.min(server.retryAfter().get().toMillis(), cap));
        }
        return Duration.ofMillis(jittered);
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while waiting to retry " + operation, e);
        }
    }
}

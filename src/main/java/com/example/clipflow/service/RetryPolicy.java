package com.example.clipflow.service;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.exceptions.ErrorClassifier;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.exceptions.TransientExternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Exponential backoff parameterized by error classification. Used for in-place retries of
 * external calls (recognition upload, media tool invocations) and for scheduling a new
 * work unit attempt after a transient failure.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(PipelineSettings settings) {
        return new RetryPolicy(settings.maxAttempts(), settings.retryBaseDelay(), settings.retryMaxDelay(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based): base * 2^(attempt-1), capped.
     */
    public Duration backoffFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public boolean shouldRetry(ErrorClassification classification, int attemptsMade) {
        return classification == ErrorClassification.TRANSIENT && attemptsMade < maxAttempts;
    }

    /**
     * Runs {@code action}, retrying transient failures in place. Permanent failures and the last
     * transient failure are rethrown unchecked.
     */
    public <T> T execute(String operation, Callable<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.call();
            } catch (Exception e) {
                ErrorClassification classification = ErrorClassifier.classify(e);
                if (!shouldRetry(classification, attempt)) {
                    throw asUnchecked(operation, e, classification);
                }
                Duration delay = backoffFor(attempt);
                log.warn("[Retry] {} failed on attempt {}/{} ({}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, classification, delay.toMillis(), e.getMessage());
                pause(operation, delay);
                attempt++;
            }
        }
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExternalException("Interrupted while waiting to retry " + operation, e);
        }
    }

    private static RuntimeException asUnchecked(String operation, Exception e, ErrorClassification classification) {
        if (e instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        String message = operation + " failed: " + e.getMessage();
        return classification == ErrorClassification.TRANSIENT
                ? new TransientExternalException(message, e)
                : new PermanentInputException(message, e);
    }
}

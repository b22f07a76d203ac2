package com.example.protocolrebuild.regeneration;

import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;

/**
 * Two separate budgets per section: {@code maxAttempts} counts attempts whose response was
 * malformed or failed validation (retried immediately with the error fed back);
 * {@code maxTransientRetries} counts transient oracle failures (retried after exponential backoff).
 */
public record RetryPolicy(int maxAttempts, int maxTransientRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (maxTransientRetries < 0) {
            throw new IllegalArgumentException("maxTransientRetries must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /** 3 attempts, 3 transient retries, 1s/2s/4s capped at 8s. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(8));
    }

    public BackOffExecution startBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(initialBackoff.toMillis(), multiplier);
        backOff.setMaxInterval(maxBackoff.toMillis());
        backOff.setMaxAttempts(maxTransientRetries);
        return backOff.start();
    }
}

package org.abstractica.vaultbridge;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry schedule with exponential backoff.
 *
 * <p>The delay before attempt {@code n + 1} is {@code initialDelay * backoffMultiplier^(n - 1)},
 * rounded to whole milliseconds.</p>
 *
 * @param maxAttempts       total number of attempts, at least 1
 * @param initialDelay      delay after the first failed attempt
 * @param backoffMultiplier factor applied to the delay after each failure, at least 1.0
 * @param requestTimeout    timeout of each individual request attempt
 * @param initialWait       wait before the first attempt
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        double backoffMultiplier,
        Duration requestTimeout,
        Duration initialWait
)
{
    public RetryPolicy
    {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(initialWait, "initialWait");
        if (maxAttempts < 1)
        {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (backoffMultiplier < 1.0)
        {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0: " + backoffMultiplier);
        }
        if (initialDelay.isNegative() || initialWait.isNegative())
        {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero())
        {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    /**
     * Returns the default request retry policy: 3 attempts, 2s initial delay,
     * multiplier 1.5, 30s per-request timeout, no initial wait.
     *
     * @return the default policy
     */
    public static RetryPolicy defaults()
    {
        return new RetryPolicy(3, Duration.ofSeconds(2), 1.5, Duration.ofSeconds(30), Duration.ZERO);
    }

    /**
     * Returns a policy that retries at a fixed interval.
     *
     * @param maxAttempts total number of attempts
     * @param interval    delay between attempts
     * @return the policy
     */
    public static RetryPolicy fixed(int maxAttempts, Duration interval)
    {
        return new RetryPolicy(maxAttempts, interval, 1.0, Duration.ofSeconds(30), Duration.ZERO);
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param failedAttempt the 1-based number of the attempt that failed
     * @return delay before the next attempt
     */
    public Duration delayAfter(int failedAttempt)
    {
        if (failedAttempt < 1)
        {
            throw new IllegalArgumentException("failedAttempt must be at least 1: " + failedAttempt);
        }
        double delay = initialDelay.toMillis();
        for (int i = 1; i < failedAttempt; i++)
        {
            delay = Math.round(delay * backoffMultiplier);
        }
        return Duration.ofMillis((long) delay);
    }

    public RetryPolicy withMaxAttempts(int newMaxAttempts)
    {
        return new RetryPolicy(newMaxAttempts, initialDelay, backoffMultiplier, requestTimeout, initialWait);
    }

    public RetryPolicy withInitialDelay(Duration newInitialDelay)
    {
        return new RetryPolicy(maxAttempts, newInitialDelay, backoffMultiplier, requestTimeout, initialWait);
    }

    public RetryPolicy withRequestTimeout(Duration newRequestTimeout)
    {
        return new RetryPolicy(maxAttempts, initialDelay, backoffMultiplier, newRequestTimeout, initialWait);
    }

    public RetryPolicy withInitialWait(Duration newInitialWait)
    {
        return new RetryPolicy(maxAttempts, initialDelay, backoffMultiplier, requestTimeout, newInitialWait);
    }
}

package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}.
 *
 * <p>Each attempt is a fresh call to the supplier. Delays between attempts
 * grow by the policy's multiplier. The last failure is propagated unchanged
 * once attempts run out or the failure is not retryable.</p>
 */
final class Retrier
{
    private static final Logger LOG = LoggerFactory.getLogger(Retrier.class);

    private final ScheduledExecutorService scheduler;

    Retrier(ScheduledExecutorService scheduler)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    <T> CompletableFuture<T> retry(String operation,
                                   RetryPolicy policy,
                                   Predicate<Throwable> retryable,
                                   Supplier<CompletableFuture<T>> attempt)
    {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(retryable, "retryable");
        Objects.requireNonNull(attempt, "attempt");

        CompletableFuture<T> result = new CompletableFuture<>();
        schedule(policy.initialWait(), () -> run(operation, policy, retryable, attempt, 1, result), result);
        return result;
    }

    private <T> void run(String operation,
                         RetryPolicy policy,
                         Predicate<Throwable> retryable,
                         Supplier<CompletableFuture<T>> attempt,
                         int attemptNumber,
                         CompletableFuture<T> result)
    {
        if (result.isDone())
        {
            return;
        }

        CompletableFuture<T> future;
        try
        {
            future = attempt.get();
        }
        catch (RuntimeException e)
        {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) ->
        {
            if (error == null)
            {
                result.complete(value);
                return;
            }

            Throwable cause = unwrap(error);
            if (attemptNumber >= policy.maxAttempts() || !retryable.test(cause))
            {
                if (attemptNumber > 1)
                {
                    LOG.warn("{} failed after {} attempts: {}", operation, attemptNumber, cause.getMessage());
                }
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = policy.delayAfter(attemptNumber);
            LOG.info("{} attempt {}/{} failed ({}), retrying in {}ms",
                    operation, attemptNumber, policy.maxAttempts(), cause.getMessage(), delay.toMillis());
            schedule(delay, () -> run(operation, policy, retryable, attempt, attemptNumber + 1, result), result);
        });
    }

    private void schedule(Duration delay, Runnable task, CompletableFuture<?> result)
    {
        try
        {
            if (delay.isZero())
            {
                scheduler.execute(task);
            }
            else
            {
                scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        catch (RejectedExecutionException e)
        {
            result.completeExceptionally(e);
        }
    }

    static Throwable unwrap(Throwable error)
    {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null)
        {
            cause = cause.getCause();
        }
        return cause;
    }
}

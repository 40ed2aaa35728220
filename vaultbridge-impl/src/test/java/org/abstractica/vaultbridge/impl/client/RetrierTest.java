package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.RetryPolicy;
import org.abstractica.vaultbridge.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Retrier.
 */
class RetrierTest
{
    private static final RetryPolicy FAST = new RetryPolicy(
            3, Duration.ofMillis(10), 1.5, Duration.ofSeconds(1), Duration.ZERO);

    private ScheduledExecutorService scheduler;
    private Retrier retrier;

    @BeforeEach
    void setUp()
    {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        retrier = new Retrier(scheduler);
    }

    @AfterEach
    void tearDown()
    {
        scheduler.shutdownNow();
    }

    @Test
    void succeedsOnFirstAttempt() throws Exception
    {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.retry("op", FAST, cause -> true, () ->
        {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }).get(2, TimeUnit.SECONDS);

        assertEquals("ok", result);
        assertEquals(1, attempts.get());
    }

    @Test
    void retriesUntilSuccess() throws Exception
    {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.retry("op", FAST, cause -> true, () ->
        {
            if (attempts.incrementAndGet() < 3)
            {
                return CompletableFuture.failedFuture(new TransportException("down"));
            }
            return CompletableFuture.completedFuture("ok");
        }).get(2, TimeUnit.SECONDS);

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void propagatesLastFailureAfterMaxAttempts()
    {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = retrier.retry("op", FAST, cause -> true,
                () -> CompletableFuture.failedFuture(
                        new TransportException("attempt " + attempts.incrementAndGet())));

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
        assertEquals("attempt 3", e.getCause().getMessage());
        assertEquals(3, attempts.get());
    }

    @Test
    void stopsOnNonRetryableFailure()
    {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = retrier.retry("op", FAST,
                cause -> !(cause instanceof IllegalArgumentException),
                () ->
                {
                    attempts.incrementAndGet();
                    return CompletableFuture.failedFuture(new IllegalArgumentException("bad"));
                });

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(1, attempts.get());
    }

    @Test
    void synchronousThrowCountsAsFailedAttempt() throws Exception
    {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.retry("op", FAST, cause -> true, () ->
        {
            if (attempts.incrementAndGet() == 1)
            {
                throw new IllegalStateException("not yet");
            }
            return CompletableFuture.completedFuture("ok");
        }).get(2, TimeUnit.SECONDS);

        assertEquals("ok", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void unwrapsCompletionExceptions()
    {
        TransportException cause = new TransportException("down");

        assertSame(cause, Retrier.unwrap(new CompletionException(cause)));
        assertSame(cause, Retrier.unwrap(new ExecutionException(new CompletionException(cause))));
        assertSame(cause, Retrier.unwrap(cause));
    }
}

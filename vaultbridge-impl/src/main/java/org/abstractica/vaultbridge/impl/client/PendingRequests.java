package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.RequestTimeoutException;
import org.abstractica.vaultbridge.VaultResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Correlation table of in-flight requests keyed by request id.
 *
 * <p>Each entry leaves the table exactly once: on a matching response, on
 * its timeout, on an explicit failure, or when the caller cancels. Whatever
 * arrives after that finds no entry and is reported as unmatched.</p>
 */
final class PendingRequests
{
    private static final Logger LOG = LoggerFactory.getLogger(PendingRequests.class);

    private final ScheduledExecutorService scheduler;
    private final DefaultBridgeClientStats stats;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    private record Entry(CompletableFuture<VaultResponse> future, ScheduledFuture<?> timeout)
    {
    }

    PendingRequests(ScheduledExecutorService scheduler, DefaultBridgeClientStats stats)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * Registers a request and arms its timeout.
     *
     * @param requestId the request id
     * @param future    completed with the response, or exceptionally
     * @param timeout   how long to wait for the response
     * @throws IllegalStateException if the id is already registered
     */
    void register(String requestId, CompletableFuture<VaultResponse> future, Duration timeout)
    {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(future, "future");
        Objects.requireNonNull(timeout, "timeout");

        if (entries.containsKey(requestId))
        {
            throw new IllegalStateException("Duplicate request id: " + requestId);
        }

        ScheduledFuture<?> timer = scheduler.schedule(
                () -> expire(requestId, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
        Entry entry = new Entry(future, timer);
        if (entries.putIfAbsent(requestId, entry) != null)
        {
            timer.cancel(false);
            throw new IllegalStateException("Duplicate request id: " + requestId);
        }

        // Caller-side cancellation releases the slot
        future.whenComplete((response, error) ->
        {
            if (entries.remove(requestId, entry))
            {
                timer.cancel(false);
            }
        });
    }

    /**
     * Resolves a request with its response.
     *
     * @return false if no request with that id is pending
     */
    boolean complete(String requestId, VaultResponse response)
    {
        Entry entry = entries.remove(requestId);
        if (entry == null)
        {
            return false;
        }
        entry.timeout().cancel(false);
        entry.future().complete(response);
        return true;
    }

    /**
     * Fails a single request.
     *
     * @return false if no request with that id is pending
     */
    boolean fail(String requestId, Throwable cause)
    {
        Entry entry = entries.remove(requestId);
        if (entry == null)
        {
            return false;
        }
        entry.timeout().cancel(false);
        entry.future().completeExceptionally(cause);
        return true;
    }

    /**
     * Fails every pending request with the same cause.
     *
     * @param cause the failure
     * @return the number of requests failed
     */
    int failAll(Throwable cause)
    {
        List<String> ids = new ArrayList<>(entries.keySet());
        int failed = 0;
        for (String id : ids)
        {
            if (fail(id, cause))
            {
                failed++;
            }
        }
        return failed;
    }

    boolean contains(String requestId)
    {
        return entries.containsKey(requestId);
    }

    int size()
    {
        return entries.size();
    }

    private void expire(String requestId, Duration timeout)
    {
        Entry entry = entries.remove(requestId);
        if (entry == null)
        {
            return;
        }
        stats.recordTimeout();
        LOG.debug("Request {} timed out after {}ms", requestId, timeout.toMillis());
        entry.future().completeExceptionally(new RequestTimeoutException(requestId, timeout));
    }
}

package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.BridgeClientStats;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Thread-safe counters behind {@link BridgeClientStats}.
 */
class DefaultBridgeClientStats implements BridgeClientStats
{
    private final AtomicLong requestsSent = new AtomicLong();
    private final AtomicLong responsesReceived = new AtomicLong();
    private final AtomicLong requestsTimedOut = new AtomicLong();
    private final AtomicLong decryptionFailures = new AtomicLong();
    private final AtomicLong strayResponses = new AtomicLong();
    private final AtomicLong serverErrors = new AtomicLong();

    private volatile IntSupplier pendingRequests = () -> 0;

    void bindPendingRequests(IntSupplier pendingRequests)
    {
        this.pendingRequests = pendingRequests;
    }

    void recordRequestSent()
    {
        requestsSent.incrementAndGet();
    }

    void recordResponse()
    {
        responsesReceived.incrementAndGet();
    }

    void recordTimeout()
    {
        requestsTimedOut.incrementAndGet();
    }

    void recordDecryptionFailure()
    {
        decryptionFailures.incrementAndGet();
    }

    void recordStrayResponse()
    {
        strayResponses.incrementAndGet();
    }

    void recordServerError()
    {
        serverErrors.incrementAndGet();
    }

    @Override
    public long getRequestsSent()
    {
        return requestsSent.get();
    }

    @Override
    public long getResponsesReceived()
    {
        return responsesReceived.get();
    }

    @Override
    public long getRequestsTimedOut()
    {
        return requestsTimedOut.get();
    }

    @Override
    public long getDecryptionFailures()
    {
        return decryptionFailures.get();
    }

    @Override
    public long getStrayResponses()
    {
        return strayResponses.get();
    }

    @Override
    public long getServerErrors()
    {
        return serverErrors.get();
    }

    @Override
    public int getPendingRequests()
    {
        return pendingRequests.getAsInt();
    }

    @Override
    public String toString()
    {
        return "BridgeClientStats{sent=" + getRequestsSent()
                + ", received=" + getResponsesReceived()
                + ", timedOut=" + getRequestsTimedOut()
                + ", decryptionFailures=" + getDecryptionFailures()
                + ", stray=" + getStrayResponses()
                + ", serverErrors=" + getServerErrors()
                + ", pending=" + getPendingRequests()
                + "}";
    }
}

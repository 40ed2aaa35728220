package org.abstractica.vaultbridge.impl.transport;

import org.abstractica.vaultbridge.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process transport for tests and local development.
 *
 * <p>Acts as both ends of a connection: the client side implements
 * {@link Transport}, while the peer side is driven through
 * {@link #deliver}, {@link #closeFromPeer}, {@link #fail} and the outbound
 * queue. A peer handler can be installed to answer messages as they are
 * sent.</p>
 *
 * <pre>{@code
 * SimulatedTransport transport = new SimulatedTransport();
 * transport.setPeer(message -> transport.deliver(answer(message)));
 *
 * // Or drive the peer by hand
 * String handshake = transport.takeSent(Duration.ofSeconds(1));
 * transport.deliver("{\"type\":\"handshakeResponse\", ...}");
 * }</pre>
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    private final BlockingQueue<String> outbound = new LinkedBlockingQueue<>();
    private final AtomicInteger connectCount = new AtomicInteger(0);

    private volatile TransportListener listener;
    private volatile boolean open;
    private volatile URI lastUri;

    // Failure injection
    private volatile Throwable connectFailure;
    private volatile int connectFailuresRemaining;
    private volatile Throwable sendFailure;

    private volatile Consumer<String> peer;

    // ========== Transport ==========

    @Override
    public synchronized CompletableFuture<Void> connect(URI uri, TransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        if (open)
        {
            return CompletableFuture.completedFuture(null);
        }

        connectCount.incrementAndGet();
        lastUri = uri;

        if (connectFailure != null && connectFailuresRemaining != 0)
        {
            if (connectFailuresRemaining > 0)
            {
                connectFailuresRemaining--;
            }
            LOG.debug("Simulated connect failure to {}", uri);
            return CompletableFuture.failedFuture(
                    new TransportException("Failed to connect to " + uri, connectFailure));
        }

        this.listener = listener;
        this.open = true;
        LOG.debug("Simulated connection open to {}", uri);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(String message)
    {
        Objects.requireNonNull(message, "message");

        if (!open)
        {
            return CompletableFuture.failedFuture(new TransportException("Not connected"));
        }
        if (sendFailure != null)
        {
            return CompletableFuture.failedFuture(new TransportException("Send failed", sendFailure));
        }

        outbound.add(message);

        Consumer<String> handler = peer;
        if (handler != null)
        {
            try
            {
                handler.accept(message);
            }
            catch (Exception e)
            {
                LOG.error("Simulated peer error", e);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    @Override
    public void close()
    {
        TransportListener current;
        synchronized (this)
        {
            if (!open)
            {
                return;
            }
            open = false;
            current = listener;
        }
        current.onClose(1000, "Closed by client");
    }

    // ========== Peer side ==========

    /**
     * Installs a handler called with every message the client sends.
     *
     * @param peer the handler, or null to remove it
     */
    public void setPeer(Consumer<String> peer)
    {
        this.peer = peer;
    }

    /**
     * Delivers a message from the peer to the client.
     *
     * @param message the message
     * @throws IllegalStateException if not connected
     */
    public void deliver(String message)
    {
        TransportListener current = listener;
        if (!open || current == null)
        {
            throw new IllegalStateException("Not connected");
        }
        current.onMessage(message);
    }

    /**
     * Closes the connection from the peer side.
     *
     * @param statusCode close status code
     * @param reason     close reason
     */
    public void closeFromPeer(int statusCode, String reason)
    {
        TransportListener current;
        synchronized (this)
        {
            if (!open)
            {
                return;
            }
            open = false;
            current = listener;
        }
        current.onClose(statusCode, reason);
    }

    /**
     * Fails the connection with an error.
     *
     * @param error the error reported to the client
     */
    public void fail(Throwable error)
    {
        TransportListener current;
        synchronized (this)
        {
            if (!open)
            {
                return;
            }
            open = false;
            current = listener;
        }
        current.onError(error);
    }

    /**
     * Makes connection attempts fail.
     *
     * @param error the cause, or null to let connections succeed again
     * @param times number of attempts to fail, or -1 for all
     */
    public void setConnectFailure(Throwable error, int times)
    {
        this.connectFailure = error;
        this.connectFailuresRemaining = times;
    }

    /**
     * Makes sends fail.
     *
     * @param error the cause, or null to let sends succeed again
     */
    public void setSendFailure(Throwable error)
    {
        this.sendFailure = error;
    }

    /**
     * Waits for the next message sent by the client.
     *
     * @param timeout maximum time to wait
     * @return the message, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public String takeSent(Duration timeout) throws InterruptedException
    {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes and returns all messages sent so far.
     *
     * @return sent messages in order
     */
    public List<String> drainSent()
    {
        List<String> messages = new ArrayList<>();
        outbound.drainTo(messages);
        return messages;
    }

    public int getConnectCount()
    {
        return connectCount.get();
    }

    public URI getLastUri()
    {
        return lastUri;
    }
}

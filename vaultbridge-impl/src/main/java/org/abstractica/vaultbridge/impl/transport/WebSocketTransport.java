package org.abstractica.vaultbridge.impl.transport;

import org.abstractica.vaultbridge.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Transport over the JDK WebSocket client.
 *
 * <p>Sends are chained so that a new text frame is only started after the
 * previous one completed, as {@link WebSocket} requires. Fragmented text
 * messages are reassembled before they reach the listener.</p>
 */
public class WebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    private final Object lock = new Object();
    private WebSocket webSocket;
    private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);

    /**
     * Creates a transport with its own HTTP client.
     *
     * @param connectTimeout maximum time to open a connection
     */
    public WebSocketTransport(Duration connectTimeout)
    {
        this(HttpClient.newHttpClient(), connectTimeout);
    }

    /**
     * Creates a transport using the given HTTP client.
     *
     * @param httpClient     the client used to open WebSockets
     * @param connectTimeout maximum time to open a connection
     */
    public WebSocketTransport(HttpClient httpClient, Duration connectTimeout)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<Void> connect(URI uri, TransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        if (isOpen())
        {
            return CompletableFuture.completedFuture(null);
        }

        LOG.debug("Opening WebSocket to {}", uri);

        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new ListenerAdapter(listener))
                .handle((ws, error) ->
                {
                    if (error != null)
                    {
                        throw new CompletionException(
                                new TransportException("Failed to connect to " + uri, unwrap(error)));
                    }
                    synchronized (lock)
                    {
                        webSocket = ws;
                        sendChain = CompletableFuture.completedFuture(null);
                    }
                    LOG.info("WebSocket connected to {}", uri);
                    return null;
                });
    }

    @Override
    public CompletableFuture<Void> send(String message)
    {
        Objects.requireNonNull(message, "message");

        synchronized (lock)
        {
            WebSocket ws = webSocket;
            if (ws == null || ws.isOutputClosed())
            {
                return CompletableFuture.failedFuture(new TransportException("Not connected"));
            }

            CompletableFuture<Void> next = sendChain
                    .handle((ignored, previousError) -> ws)
                    .thenCompose(socket -> socket.sendText(message, true))
                    .handle((socket, error) ->
                    {
                        if (error != null)
                        {
                            throw new CompletionException(new TransportException("Send failed", unwrap(error)));
                        }
                        return null;
                    });
            sendChain = next;
            return next;
        }
    }

    @Override
    public boolean isOpen()
    {
        synchronized (lock)
        {
            return webSocket != null && !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }
    }

    @Override
    public void close()
    {
        WebSocket ws;
        synchronized (lock)
        {
            ws = webSocket;
            webSocket = null;
        }

        if (ws != null && !ws.isOutputClosed())
        {
            LOG.debug("Closing WebSocket");
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .whenComplete((socket, error) ->
                    {
                        if (error != null)
                        {
                            LOG.debug("Close handshake failed: {}", error.getMessage());
                            ws.abort();
                        }
                    });
        }
    }

    private void clear(WebSocket ws)
    {
        synchronized (lock)
        {
            if (webSocket == ws)
            {
                webSocket = null;
            }
        }
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null)
        {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Adapts JDK WebSocket callbacks to a {@link TransportListener}.
     */
    private final class ListenerAdapter implements WebSocket.Listener
    {
        private final TransportListener listener;
        private final StringBuilder partial = new StringBuilder();

        ListenerAdapter(TransportListener listener)
        {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket ws)
        {
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last)
        {
            partial.append(data);
            if (last)
            {
                String message = partial.toString();
                partial.setLength(0);
                safeCallback(() -> listener.onMessage(message));
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last)
        {
            LOG.debug("Ignoring binary frame of {} bytes", data.remaining());
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason)
        {
            LOG.info("WebSocket closed: {} {}", statusCode, reason);
            clear(ws);
            safeCallback(() -> listener.onClose(statusCode, reason));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error)
        {
            LOG.warn("WebSocket error: {}", error.toString());
            clear(ws);
            safeCallback(() -> listener.onError(error));
        }

        private void safeCallback(Runnable callback)
        {
            try
            {
                callback.run();
            }
            catch (Exception e)
            {
                LOG.error("Transport listener error", e);
            }
        }
    }
}

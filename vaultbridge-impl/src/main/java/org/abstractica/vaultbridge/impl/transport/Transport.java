package org.abstractica.vaultbridge.impl.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Full-duplex, message-oriented connection to the bridge.
 *
 * <p>Transport moves text messages without any knowledge of their content,
 * encryption or pairing state. One transport carries at most one connection
 * at a time; each {@link #connect} call supplies the listener for that
 * connection.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Opens a connection.
     *
     * <p>Returns a completed future if a connection is already open.</p>
     *
     * @param uri      the bridge endpoint
     * @param listener receives messages and the close/error event of this connection
     * @return future completed when open, or failed with
     *         {@link org.abstractica.vaultbridge.TransportException}
     */
    CompletableFuture<Void> connect(URI uri, TransportListener listener);

    /**
     * Sends one text message.
     *
     * <p>May be called from any thread; messages are written in call order.</p>
     *
     * @param message the message
     * @return future completed when written, or failed with
     *         {@link org.abstractica.vaultbridge.TransportException}
     */
    CompletableFuture<Void> send(String message);

    /**
     * Returns whether a connection is open.
     *
     * @return true if messages can be sent
     */
    boolean isOpen();

    /**
     * Closes the current connection, if any.
     */
    @Override
    void close();
}

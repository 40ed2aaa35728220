package org.abstractica.vaultbridge.impl.transport;

/**
 * Receives the events of one transport connection.
 *
 * <p>Called from transport threads. Implementations must not block.</p>
 */
public interface TransportListener
{
    /**
     * Called for each complete text message.
     *
     * @param message the message
     */
    void onMessage(String message);

    /**
     * Called once when the connection closes normally or is closed by the peer.
     *
     * @param statusCode close status code
     * @param reason     close reason, possibly empty
     */
    void onClose(int statusCode, String reason);

    /**
     * Called once when the connection fails. No further events follow.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}

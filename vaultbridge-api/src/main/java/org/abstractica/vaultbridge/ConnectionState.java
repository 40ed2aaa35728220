package org.abstractica.vaultbridge;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a client's connection.
 *
 * @param status          current pairing status
 * @param clientId        the client's identifier (32 lowercase hex characters)
 * @param error           last recorded error, or null
 * @param serverPublicKey the peer's public key (base64 SPKI) from the last handshake, or null
 */
public record ConnectionState(
        ConnectionStatus status,
        String clientId,
        String error,
        String serverPublicKey
)
{
    public ConnectionState
    {
        Objects.requireNonNull(status, "status");
    }

    /**
     * Returns the initial state for a client.
     *
     * @param clientId the client identifier
     * @return a disconnected state without error or peer key
     */
    public static ConnectionState initial(String clientId)
    {
        return new ConnectionState(ConnectionStatus.DISCONNECTED, clientId, null, null);
    }

    /**
     * Returns the last recorded error.
     *
     * @return the error message, or empty
     */
    public Optional<String> getError()
    {
        return Optional.ofNullable(error);
    }

    /**
     * Returns whether a handshake has delivered the peer's public key.
     *
     * @return true if the peer key is known
     */
    public boolean hasServerPublicKey()
    {
        return serverPublicKey != null;
    }

    /**
     * Returns whether requests may be sent in this state.
     *
     * @return true if paired
     */
    public boolean isPaired()
    {
        return status == ConnectionStatus.PAIRED;
    }

    public ConnectionState withStatus(ConnectionStatus newStatus)
    {
        return new ConnectionState(newStatus, clientId, error, serverPublicKey);
    }

    public ConnectionState withError(String newError)
    {
        return new ConnectionState(status, clientId, newError, serverPublicKey);
    }

    public ConnectionState withServerPublicKey(String newServerPublicKey)
    {
        return new ConnectionState(status, clientId, error, newServerPublicKey);
    }
}

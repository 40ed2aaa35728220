package org.abstractica.vaultbridge.impl.protocol;

/**
 * A message exchanged with the bridge.
 */
public sealed interface BridgeMessage permits
        Handshake,
        HandshakeResponse,
        AuthorizationUpdate,
        Request,
        Response,
        ErrorMessage,
        Ping,
        Pong
{
    /**
     * Returns the message type written to the {@code type} field.
     *
     * @return the type
     */
    MessageType type();
}

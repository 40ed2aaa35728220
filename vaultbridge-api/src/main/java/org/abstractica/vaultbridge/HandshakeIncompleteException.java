package org.abstractica.vaultbridge;

/**
 * A request was attempted before the handshake delivered the peer's public key.
 */
public class HandshakeIncompleteException extends BridgeException
{
    public HandshakeIncompleteException()
    {
        super("Handshake not complete");
    }
}
